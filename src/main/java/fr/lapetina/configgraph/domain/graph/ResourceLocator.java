package fr.lapetina.configgraph.domain.graph;

import java.nio.file.Path;

/**
 * Resolves {@code resource(<owner>):<path>} values to file system paths.
 */
@FunctionalInterface
public interface ResourceLocator {

    /**
     * @param owner        owning module token, or {@code null} for the application itself
     * @param relativePath resource path relative to the owner
     */
    Path resolve(String owner, String relativePath);
}
