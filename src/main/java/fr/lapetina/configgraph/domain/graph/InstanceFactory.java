package fr.lapetina.configgraph.domain.graph;

/**
 * Builds an instance of a registered type from resolved bindings.
 *
 * Any exception thrown here is wrapped in an
 * {@link fr.lapetina.configgraph.domain.exception.ObjectInstantiationException}
 * carrying the section name and provenance.
 *
 * @param <T> the constructed type
 */
@FunctionalInterface
public interface InstanceFactory<T> {

    T create(Bindings bindings) throws Exception;
}
