package fr.lapetina.configgraph.infrastructure.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.domain.exception.ImportResolutionException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * JSON reader: top-level keys become sections and the document is kept as
 * the tree.
 */
public final class JsonConfigSource implements ConfigSource {

    private final Path path;
    private final ObjectMapper mapper;
    private final TreeFlattener flattener;

    public JsonConfigSource(Path path, ObjectMapper mapper, TreeFlattener flattener) {
        this.path = path;
        this.mapper = mapper;
        this.flattener = flattener;
    }

    @Override
    public String getDescription() {
        return path.toString();
    }

    @Override
    public ConfigContent load() {
        Map<String, Object> document;
        try {
            document = TreeFlattener.stringKeys(mapper.readValue(path.toFile(), Object.class), getDescription());
        } catch (IOException e) {
            throw new ImportResolutionException(getDescription(), "Can not read JSON file: " + e.getMessage(), e);
        }
        return new ConfigContent(flattener.flatten(document, getDescription()), document);
    }
}
