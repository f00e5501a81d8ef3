package fr.lapetina.configgraph.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Type identifier plus raw constructor bindings derived from a section.
 * Immutable and thread-safe.
 *
 * @param sectionName the section the spec was derived from
 * @param typeId      registered type identifier, or {@code null} for a plain mapping
 * @param bindings    raw option strings, in section order, without the type option
 * @param provenance  originating source of the section
 */
public record ObjectSpec(
        String sectionName,
        String typeId,
        Map<String, String> bindings,
        String provenance
) {
    public ObjectSpec {
        Objects.requireNonNull(sectionName, "Section name is required");
        bindings = bindings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(bindings))
                : Map.of();
    }

    /**
     * Derives a spec from a section, splitting off the type-bearing option.
     */
    public static ObjectSpec fromSection(Section section, String typeOption) {
        Map<String, String> bindings = new LinkedHashMap<>(section.getOptions());
        String typeId = bindings.remove(typeOption);
        return new ObjectSpec(section.getName(), typeId, bindings, section.getProvenance());
    }

    public boolean isTyped() {
        return typeId != null;
    }
}
