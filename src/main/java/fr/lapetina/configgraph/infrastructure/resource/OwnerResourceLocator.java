package fr.lapetina.configgraph.infrastructure.resource;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.graph.ResourceLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves resources against a directory per owner.
 *
 * Without an owner, paths are relative to the application's own base
 * directory. Owners without a registered directory are looked up on the
 * classpath under {@code <owner>/<path>}.
 */
public final class OwnerResourceLocator implements ResourceLocator {

    private static final Logger log = LoggerFactory.getLogger(OwnerResourceLocator.class);

    private final Path baseDirectory;
    private final Map<String, Path> ownerDirectories;

    public OwnerResourceLocator(Path baseDirectory, Map<String, Path> ownerDirectories) {
        this.baseDirectory = baseDirectory;
        this.ownerDirectories = Map.copyOf(ownerDirectories);
    }

    @Override
    public Path resolve(String owner, String relativePath) {
        if (owner == null || owner.isEmpty()) {
            return baseDirectory.resolve(relativePath).normalize();
        }
        Path directory = ownerDirectories.get(owner);
        if (directory != null) {
            return directory.resolve(relativePath).normalize();
        }
        URL url = Thread.currentThread().getContextClassLoader().getResource(owner + "/" + relativePath);
        if (url == null || !"file".equals(url.getProtocol())) {
            throw new ImportResolutionException(owner, "No resource '" + relativePath + "' for owner '" + owner + "'");
        }
        try {
            Path path = Path.of(url.toURI());
            log.debug("Resource {}:{} found on classpath at {}", owner, relativePath, path);
            return path;
        } catch (URISyntaxException e) {
            throw new ImportResolutionException(owner, "Invalid resource location: " + url, e);
        }
    }
}
