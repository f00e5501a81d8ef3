package fr.lapetina.configgraph.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.handlers.PathDirectiveHandler;
import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import fr.lapetina.configgraph.domain.graph.ResolutionContext;
import fr.lapetina.configgraph.domain.model.Section;
import fr.lapetina.configgraph.domain.model.SectionStore;
import fr.lapetina.configgraph.infrastructure.source.ConfigContent;
import fr.lapetina.configgraph.infrastructure.source.ConfigSource;
import fr.lapetina.configgraph.infrastructure.source.EnvironmentConfigSource;
import fr.lapetina.configgraph.infrastructure.source.IniConfigSource;
import fr.lapetina.configgraph.infrastructure.source.JsonConfigSource;
import fr.lapetina.configgraph.infrastructure.source.StringConfigSource;
import fr.lapetina.configgraph.infrastructure.source.TreeFlattener;
import fr.lapetina.configgraph.infrastructure.source.YamlConfigSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Merges the sources listed by a root file's import manifest into a single
 * frozen {@link SectionStore}.
 *
 * Entries are loaded in manifest order. Paths are substituted with caller
 * tokens and with the sections the entry references, which must already be
 * loaded. The root file's own sections go on top of the imports. A global
 * pass then replaces every {@code ${section:option}} placeholder against the
 * whole store.
 */
public final class ImportResolver {

    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    private final ResolverSettings.ImportsConfig settings;
    private final ObjectMapper objectMapper;
    private final Map<String, String> tokens;
    private final Map<String, String> environment;
    private final Substitutor substitutor;
    private final TreeFlattener flattener;
    private final List<String> diagnostics = new ArrayList<>();

    public ImportResolver(ResolverSettings settings, ObjectMapper objectMapper,
                          Map<String, String> tokens, Map<String, String> environment) {
        this.settings = settings.getImports();
        this.objectMapper = objectMapper;
        this.tokens = Map.copyOf(tokens);
        this.environment = environment;
        this.substitutor = new Substitutor(this.settings.getSubstitutionDepth());
        this.flattener = new TreeFlattener(objectMapper, this.settings.getDefaultSection());
    }

    public ImportResolver(ResolverSettings settings, Map<String, String> tokens) {
        this(settings, new ObjectMapper(), tokens, System.getenv());
    }

    public ImportResolver() {
        this(new ResolverSettings(), Map.of());
    }

    /**
     * Loads the root file and everything its manifest imports.
     *
     * @param root root INI file
     * @return the merged, substituted and frozen store
     * @throws ImportResolutionException if a source is missing, a reference
     *                                   is unresolved or imports form a cycle
     */
    public SectionStore resolve(Path root) {
        diagnostics.clear();
        SectionStore store = new SectionStore();
        mergeFile(root, store, new ArrayDeque<>());
        substituteAll(store);
        store.freeze();
        log.info("Resolved {} section(s) from {} ({} diagnostic(s))",
                store.size(), root, diagnostics.size());
        return store;
    }

    /**
     * Returns the messages recorded for skipped optional entries of the last
     * resolution.
     */
    public List<String> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    private void mergeFile(Path file, SectionStore store, Deque<Path> ancestry) {
        Path normalized = file.toAbsolutePath().normalize();
        if (ancestry.contains(normalized)) {
            List<String> cycle = new ArrayList<>();
            ancestry.descendingIterator().forEachRemaining(p -> cycle.add(p.toString()));
            cycle.add(normalized.toString());
            throw new ImportResolutionException(normalized.toString(), "Import files form a cycle: "
                    + String.join(" -> ", cycle), cycle);
        }
        ancestry.push(normalized);
        try {
            ConfigContent content = new IniConfigSource(normalized).load();
            Map<String, Section> rootSections = new LinkedHashMap<>();
            content.sections().forEach(s -> rootSections.put(s.getName(), s));

            Section importSection = rootSections.get(settings.getSectionName());
            if (importSection == null) {
                log.debug("No [{}] section in {}, loading as a plain INI file", settings.getSectionName(), normalized);
                store.mergeAll(content.sections());
                return;
            }

            ImportManifest manifest = ImportManifest.parse(importSection, rootSections, normalized.getParent());
            manifest.checkReferenceCycles();
            for (String reference : manifest.references()) {
                Section section = rootSections.get(reference);
                if (section == null) {
                    throw new ImportResolutionException(reference, "Referenced section '" + reference
                            + "' is not defined in " + normalized);
                }
                store.merge(section);
            }

            Set<String> loaded = new HashSet<>();
            for (ImportEntry entry : manifest.entries()) {
                if (process(entry, manifest, store, loaded, ancestry)) {
                    loaded.add(entry.name());
                }
            }

            for (Section section : content.sections()) {
                if (!manifest.sectionNames().contains(section.getName())) {
                    store.merge(section);
                }
            }
            log.info("Merged {} import(s) from {}", loaded.size(), normalized);
        } finally {
            ancestry.pop();
        }
    }

    private boolean process(ImportEntry entry, ImportManifest manifest, SectionStore store,
                            Set<String> loaded, Deque<Path> ancestry) {
        List<Path> paths;
        try {
            paths = paths(entry, manifest, store, loaded);
        } catch (ImportResolutionException e) {
            if (entry.optional()) {
                skip(entry, e.getMessage());
                return false;
            }
            throw e;
        }

        switch (entry.type()) {
            case STRING -> {
                String config = entry.getOption("config_str").orElseThrow(() ->
                        new ImportResolutionException(entry.name(), "Missing 'config_str' for string import"));
                merge(store, new StringConfigSource(config,
                        entry.getOption("option_sep").orElse(","),
                        entry.getOption("default_section").orElse(settings.getDefaultSection())));
            }
            case ENVIRONMENT -> merge(store, new EnvironmentConfigSource(
                    entry.getOption("section_name").orElse(settings.getEnvironmentSection()),
                    entry.getOption("map_delimiter").orElse(settings.getMapDelimiter()),
                    environment));
            default -> {
                if (paths.isEmpty()) {
                    throw new ImportResolutionException(entry.name(), "No 'config_file' for "
                            + entry.type().name().toLowerCase() + " import");
                }
                for (Path path : paths) {
                    if (!Files.isRegularFile(path)) {
                        if (entry.optional()) {
                            skip(entry, "File not found: " + path);
                            continue;
                        }
                        throw new ImportResolutionException(entry.name(), "File not found: " + path);
                    }
                    load(entry, path, store, ancestry);
                }
            }
        }
        return true;
    }

    private void load(ImportEntry entry, Path path, SectionStore store, Deque<Path> ancestry) {
        log.debug("Loading {} import '{}' from {}", entry.type(), entry.name(), path);
        switch (entry.type()) {
            case IMPORT -> mergeFile(path, store, ancestry);
            case YAML -> merge(store, new YamlConfigSource(path, flattener));
            case JSON -> merge(store, new JsonConfigSource(path, objectMapper, flattener));
            case CONDYAML -> {
                try (InstanceGraphBuilder snapshot = InstanceGraphBuilder.builder()
                        .store(new SectionStore(store.getSections()))
                        .objectMapper(objectMapper)
                        .build()) {
                    merge(store, new YamlConfigSource(path, flattener,
                            new ConditionalTreeRewriter(classifier(entry, store, snapshot), path.toString())));
                }
            }
            default -> merge(store, new IniConfigSource(path));
        }
    }

    /**
     * Classifies a condition value: substituted against the store loaded so
     * far, then read through the directive rules.
     */
    private Function<String, Object> classifier(ImportEntry entry, SectionStore store, InstanceGraphBuilder snapshot) {
        return raw -> {
            String value = substitutor.substitute(raw, entry.name(), store::getOption, entry.name());
            return snapshot.getParser().parse(value,
                    new DirectiveContext(snapshot, ResolutionContext.root(), entry.name()));
        };
    }

    private List<Path> paths(ImportEntry entry, ImportManifest manifest, SectionStore store, Set<String> loaded) {
        Set<String> scope = new LinkedHashSet<>(manifest.references());
        for (String reference : entry.references()) {
            if (!store.contains(reference) && !loaded.contains(reference)) {
                throw new ImportResolutionException(entry.name(), "Reference '" + reference
                        + "' is not loaded before import '" + entry.name() + "'");
            }
            scope.add(reference);
        }
        Map<String, ImportEntry> entries = new LinkedHashMap<>();
        manifest.entries().forEach(e -> entries.put(e.name(), e));

        BiFunction<String, String, Optional<String>> lookup = (section, option) -> {
            if (section.equals(entry.name())) {
                return entry.getOption(option);
            }
            if (!scope.contains(section)) {
                return Optional.empty();
            }
            Optional<String> value = store.getOption(section, option);
            if (value.isEmpty() && entries.containsKey(section)) {
                return entries.get(section).getOption(option);
            }
            return value;
        };

        List<Path> paths = new ArrayList<>(entry.configFiles().size());
        for (String file : entry.configFiles()) {
            String value = substitutor.substituteTokens(file, tokens, entry.name());
            value = substitutor.substitute(value, entry.name(), lookup, entry.name());
            Path path = PathDirectiveHandler.expand(value);
            if (!path.isAbsolute() && entry.baseDirectory() != null) {
                path = entry.baseDirectory().resolve(path);
            }
            paths.add(path.normalize());
        }
        return paths;
    }

    private void merge(SectionStore store, ConfigSource source) {
        ConfigContent content = source.load();
        store.mergeAll(content.sections());
        if (!content.tree().isEmpty()) {
            store.mergeTree(content.tree());
        }
        log.debug("Merged {} section(s) from {}", content.sections().size(), source.getDescription());
    }

    private void skip(ImportEntry entry, String reason) {
        String message = "Skipped optional import '" + entry.name() + "': " + reason;
        diagnostics.add(message);
        log.warn(message);
    }

    /**
     * Replaces placeholders in every option and tree leaf. Values are
     * computed against the raw store before any section is replaced.
     */
    private void substituteAll(SectionStore store) {
        List<Section> substituted = new ArrayList<>();
        for (Section section : store.getSections()) {
            Map<String, String> options = new LinkedHashMap<>();
            section.getOptions().forEach((option, value) -> options.put(option,
                    substitutor.substitute(value, section.getName(), store::getOption, section.getName())));
            substituted.add(section.withOptions(options));
        }
        Map<String, Object> tree = new LinkedHashMap<>();
        store.getTree().forEach((name, node) -> tree.put(name, substituteNode(node, name, store)));

        substituted.forEach(store::replace);
        store.mergeTree(tree);
    }

    private Object substituteNode(Object node, String section, SectionStore store) {
        if (node instanceof String s) {
            return substitutor.substitute(s, section, store::getOption, section);
        }
        if (node instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(k, substituteNode(v, section, store)));
            return out;
        }
        if (node instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(v -> out.add(substituteNode(v, section, store)));
            return out;
        }
        return node;
    }
}
