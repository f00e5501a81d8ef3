package fr.lapetina.configgraph.domain.graph;

/**
 * Service-provider hook for contributing types at startup.
 *
 * Implementations are listed in
 * {@code META-INF/services/fr.lapetina.configgraph.domain.graph.TypeRegistrar}
 * and picked up by {@link TypeRegistry#loadRegistrars()}.
 */
public interface TypeRegistrar {

    void registerTypes(TypeRegistry registry);
}
