package fr.lapetina.configgraph.infrastructure.resource;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.graph.ApplicationLoader;
import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import fr.lapetina.configgraph.domain.model.SectionStore;
import fr.lapetina.configgraph.infrastructure.config.ImportResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads another application's root configuration through the import
 * resolver and wraps it in its own builder.
 */
public final class ManifestApplicationLoader implements ApplicationLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestApplicationLoader.class);

    private final Map<String, Path> rootFiles;
    private final ImportResolver resolver;
    private final Function<SectionStore, InstanceGraphBuilder> builderFactory;

    /**
     * @param rootFiles      root configuration file per owner
     * @param resolver       resolver used for every owner
     * @param builderFactory creates the owner's builder from its store
     */
    public ManifestApplicationLoader(Map<String, Path> rootFiles, ImportResolver resolver,
                                     Function<SectionStore, InstanceGraphBuilder> builderFactory) {
        this.rootFiles = Map.copyOf(rootFiles);
        this.resolver = resolver;
        this.builderFactory = builderFactory;
    }

    @Override
    public InstanceGraphBuilder load(String owner) {
        Path root = rootFiles.get(owner);
        if (root == null) {
            throw new ImportResolutionException(owner, "Unknown application '" + owner + "', known: "
                    + rootFiles.keySet());
        }
        log.info("Loading application '{}' from {}", owner, root);
        return builderFactory.apply(resolver.resolve(root));
    }
}
