package fr.lapetina.configgraph.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, ordered set of option/value strings.
 * Immutable; merging produces a new section.
 */
public final class Section {

    private final String name;
    private final Map<String, String> options;
    private final String provenance;

    public Section(String name, Map<String, String> options, String provenance) {
        this.name = Objects.requireNonNull(name, "Section name is required");
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(
                options != null ? options : Map.of()));
        this.provenance = provenance != null ? provenance : "<unknown>";
    }

    public static Section of(String name, Map<String, String> options) {
        return new Section(name, options, null);
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getOptions() {
        return options;
    }

    public String getProvenance() {
        return provenance;
    }

    public Optional<String> getOption(String option) {
        return Optional.ofNullable(options.get(option));
    }

    public boolean hasOption(String option) {
        return options.containsKey(option);
    }

    /**
     * Returns a section with {@code other}'s options appended, overwriting
     * options already present under the same key. Provenance becomes the
     * later source.
     */
    public Section mergedWith(Section other) {
        Map<String, String> merged = new LinkedHashMap<>(options);
        merged.putAll(other.options);
        return new Section(name, merged, other.provenance);
    }

    /**
     * Returns a copy with the given options replaced.
     */
    public Section withOptions(Map<String, String> newOptions) {
        return new Section(name, newOptions, provenance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Section other)) return false;
        return name.equals(other.name) && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, options);
    }

    @Override
    public String toString() {
        return "Section{" + name + ", options=" + options.keySet() + ", from=" + provenance + "}";
    }
}
