package fr.lapetina.configgraph.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.domain.directive.handlers.CollectionDirectiveHandler;
import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.model.Section;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered description of the sources to merge, read from the import section
 * of a root INI file:
 *
 * <pre>
 * [import]
 * references = list: default
 * sections = list: base, app
 *
 * [base]
 * type = ini
 * config_file = ^{config_path}
 * </pre>
 *
 * @param entries       entries in load order
 * @param references    root sections visible to every entry's path substitution
 * @param sectionNames  the manifest sections themselves, import section included
 */
public record ImportManifest(List<ImportEntry> entries, List<String> references, Set<String> sectionNames) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ImportManifest {
        entries = List.copyOf(entries);
        references = List.copyOf(references);
        sectionNames = Set.copyOf(sectionNames);
    }

    /**
     * Reads the manifest.
     *
     * @param importSection the section listing the entries
     * @param rootSections  every section of the root file, by name
     * @param baseDirectory directory of the root file
     * @throws ImportResolutionException if an entry section is missing or invalid
     */
    public static ImportManifest parse(Section importSection, Map<String, Section> rootSections, Path baseDirectory) {
        List<String> names = list(importSection.getOption("sections").orElse(""));
        List<String> references = list(importSection.getOption("references").orElse(""));
        List<ImportEntry> entries = new ArrayList<>(names.size());
        Set<String> sectionNames = new LinkedHashSet<>();
        sectionNames.add(importSection.getName());
        for (String name : names) {
            Section section = rootSections.get(name);
            if (section == null) {
                throw new ImportResolutionException(name, "Import section '" + name + "' is not defined in "
                        + importSection.getProvenance());
            }
            sectionNames.add(name);
            entries.add(entry(section, baseDirectory));
        }
        return new ImportManifest(entries, references, sectionNames);
    }

    private static ImportEntry entry(Section section, Path baseDirectory) {
        List<String> files = new ArrayList<>();
        section.getOption("config_file").ifPresent(files::add);
        section.getOption("config_files").ifPresent(v -> files.addAll(list(v)));
        ImportType type;
        try {
            type = section.getOption("type")
                    .map(ImportType::parse)
                    .orElseGet(() -> files.isEmpty() ? ImportType.INI : ImportType.fromFileName(files.get(0)));
        } catch (IllegalArgumentException e) {
            throw new ImportResolutionException(section.getName(), e.getMessage(), e);
        }
        boolean optional = section.getOption("optional").map(ImportManifest::truthy).orElse(false);
        List<String> references = list(section.getOption("references").orElse(""));
        return new ImportEntry(section.getName(), type, files, references, optional,
                section.getOptions(), baseDirectory);
    }

    /**
     * Detects cycles among entries whose references name other entries.
     *
     * @throws ImportResolutionException naming the cycle
     */
    public void checkReferenceCycles() {
        Map<String, ImportEntry> byName = new HashMap<>();
        entries.forEach(e -> byName.put(e.name(), e));
        Map<String, Integer> state = new HashMap<>();
        for (ImportEntry entry : entries) {
            visit(entry.name(), byName, state, new ArrayList<>());
        }
    }

    private static void visit(String name, Map<String, ImportEntry> byName, Map<String, Integer> state,
                              List<String> path) {
        Integer s = state.get(name);
        if (s != null && s == 2) {
            return;
        }
        path.add(name);
        if (s != null && s == 1) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            throw new ImportResolutionException(name, "Import references form a cycle: "
                    + String.join(" -> ", cycle), cycle);
        }
        state.put(name, 1);
        ImportEntry entry = byName.get(name);
        if (entry != null) {
            for (String ref : entry.references()) {
                if (byName.containsKey(ref)) {
                    visit(ref, byName, state, path);
                }
            }
        }
        state.put(name, 2);
        path.remove(path.size() - 1);
    }

    /**
     * Reads a list option written as {@code list: a, b}, {@code json: [...]} or
     * a bare comma separated string.
     */
    static List<String> list(String raw) {
        String value = raw.trim();
        if (value.startsWith("json:")) {
            try {
                Collection<?> parsed = MAPPER.readValue(value.substring(5), List.class);
                List<String> out = new ArrayList<>();
                parsed.forEach(v -> out.add(String.valueOf(v)));
                return out;
            } catch (JsonProcessingException e) {
                throw new ImportResolutionException(raw, "Invalid JSON list: " + e.getOriginalMessage(), e);
            }
        }
        if (value.startsWith("list:")) {
            value = value.substring(5);
        } else if (value.startsWith("tuple:")) {
            value = value.substring(6);
        }
        return CollectionDirectiveHandler.split(value);
    }

    static boolean truthy(String value) {
        String v = value.trim();
        return v.equals("True") || v.equalsIgnoreCase("true") || v.equals("1") || v.equalsIgnoreCase("yes");
    }
}
