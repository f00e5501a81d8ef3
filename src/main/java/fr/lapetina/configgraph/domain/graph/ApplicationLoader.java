package fr.lapetina.configgraph.domain.graph;

/**
 * Supplies independently configured builders for {@code application(<owner>):}
 * directives.
 */
@FunctionalInterface
public interface ApplicationLoader {

    /**
     * Creates a builder over the owner's own configuration.
     *
     * @throws fr.lapetina.configgraph.domain.exception.ImportResolutionException
     *         if the owner's configuration can not be loaded
     */
    InstanceGraphBuilder load(String owner);
}
