package fr.lapetina.configgraph.infrastructure.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of an {@link ImportManifest}.
 *
 * @param name        name of the manifest section describing the entry
 * @param type        source type
 * @param configFiles file paths, possibly holding {@code ^{token}} and {@code ${section:option}} placeholders
 * @param references  sections that must be loaded before the paths are substituted
 * @param optional    whether a missing source is skipped instead of failing
 * @param options     every option of the entry section, for type-specific settings
 * @param baseDirectory directory relative paths are resolved against
 */
public record ImportEntry(
        String name,
        ImportType type,
        List<String> configFiles,
        List<String> references,
        boolean optional,
        Map<String, String> options,
        Path baseDirectory
) {
    public ImportEntry {
        Objects.requireNonNull(name, "Entry name is required");
        Objects.requireNonNull(type, "Entry type is required");
        configFiles = configFiles != null ? List.copyOf(configFiles) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    public Optional<String> getOption(String option) {
        return Optional.ofNullable(options.get(option));
    }
}
