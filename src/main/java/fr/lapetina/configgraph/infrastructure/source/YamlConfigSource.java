package fr.lapetina.configgraph.infrastructure.source;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * YAML reader: top-level keys become sections and the document is kept as
 * the tree. An optional rewriter transforms the document before it is
 * flattened, which is how conditional YAML is applied.
 */
public final class YamlConfigSource implements ConfigSource {

    private final Path path;
    private final TreeFlattener flattener;
    private final UnaryOperator<Map<String, Object>> rewriter;

    public YamlConfigSource(Path path, TreeFlattener flattener) {
        this(path, flattener, UnaryOperator.identity());
    }

    public YamlConfigSource(Path path, TreeFlattener flattener, UnaryOperator<Map<String, Object>> rewriter) {
        this.path = path;
        this.flattener = flattener;
        this.rewriter = rewriter;
    }

    @Override
    public String getDescription() {
        return path.toString();
    }

    @Override
    public ConfigContent load() {
        Map<String, Object> document = rewriter.apply(readDocument(path));
        return new ConfigContent(flattener.flatten(document, getDescription()), document);
    }

    /**
     * Reads a YAML file into a string-keyed map.
     */
    public static Map<String, Object> readDocument(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return TreeFlattener.stringKeys(new Yaml().load(in), path.toString());
        } catch (IOException e) {
            throw new ImportResolutionException(path.toString(), "Can not read YAML file: " + e.getMessage(), e);
        } catch (YAMLException e) {
            throw new ImportResolutionException(path.toString(), "Invalid YAML: " + e.getMessage(), e);
        }
    }
}
