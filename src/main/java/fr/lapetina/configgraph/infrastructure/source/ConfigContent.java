package fr.lapetina.configgraph.infrastructure.source;

import fr.lapetina.configgraph.domain.model.Section;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a {@link ConfigSource} read: flat sections plus, for hierarchical
 * formats, the nested tree keyed by top-level name.
 *
 * @param sections flattened sections in source order
 * @param tree     nested nodes, empty for flat formats
 */
public record ConfigContent(List<Section> sections, Map<String, Object> tree) {

    public ConfigContent {
        sections = List.copyOf(sections);
        tree = tree == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tree));
    }

    public static ConfigContent flat(List<Section> sections) {
        return new ConfigContent(sections, Map.of());
    }
}
