package fr.lapetina.configgraph.infrastructure.source;

/**
 * Reader of one configuration source into sections.
 */
public interface ConfigSource {

    /**
     * Returns a description of where the sections come from, recorded as
     * their provenance.
     */
    String getDescription();

    /**
     * Reads the source.
     *
     * @throws fr.lapetina.configgraph.domain.exception.ImportResolutionException
     *         if the source can not be read or parsed
     */
    ConfigContent load();
}
