package fr.lapetina.configgraph.infrastructure.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.model.Section;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a nested document into sections.
 *
 * Each top-level mapping becomes a section. Scalar leaves are written the
 * way the directive rules read them back ({@code True}, {@code False},
 * {@code None}); nested mappings and lists become {@code json:} options.
 * Top-level scalars go to the default section.
 */
public final class TreeFlattener {

    private final ObjectMapper mapper;
    private final String defaultSection;

    public TreeFlattener(ObjectMapper mapper, String defaultSection) {
        this.mapper = mapper;
        this.defaultSection = defaultSection;
    }

    public List<Section> flatten(Map<String, Object> document, String provenance) {
        List<Section> sections = new ArrayList<>();
        Map<String, String> defaults = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : document.entrySet()) {
            if (e.getValue() instanceof Map<?, ?> node) {
                Map<String, String> options = new LinkedHashMap<>();
                node.forEach((k, v) -> options.put(String.valueOf(k), toOption(v, provenance)));
                sections.add(new Section(e.getKey(), options, provenance));
            } else {
                defaults.put(e.getKey(), toOption(e.getValue(), provenance));
            }
        }
        if (!defaults.isEmpty()) {
            sections.add(new Section(defaultSection, defaults, provenance));
        }
        return sections;
    }

    /**
     * Renders a leaf as an option string.
     */
    public String toOption(Object value, String provenance) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof Map || value instanceof List) {
            try {
                return "json: " + mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new ImportResolutionException(provenance, "Can not encode node: " + e.getOriginalMessage(), e);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Normalizes keys of a parsed document to strings.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> stringKeys(Object document, String provenance) {
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ImportResolutionException(provenance, "Top level must be a mapping but was "
                    + document.getClass().getSimpleName());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v instanceof Map ? stringKeys(v, provenance) : v));
        return out;
    }
}
