package fr.lapetina.configgraph.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered store of merged sections.
 *
 * Sections are append-merged while the store is open. Once the import
 * resolver freezes it, the store is read-only. A tree view of nested
 * nodes is kept alongside the flat sections for sources that have one
 * (YAML, JSON), so directives can navigate structure that the flattened
 * options only carry as {@code json:} strings.
 */
public final class SectionStore {

    private static final Logger log = LoggerFactory.getLogger(SectionStore.class);

    private final Map<String, Section> sections = new LinkedHashMap<>();
    private final Map<String, Object> tree = new LinkedHashMap<>();
    private boolean frozen;

    public SectionStore() {
    }

    public SectionStore(Collection<Section> initial) {
        initial.forEach(this::merge);
    }

    /**
     * Merges a section; options of a later section overwrite earlier ones.
     */
    public void merge(Section section) {
        checkOpen();
        Section previous = sections.get(section.getName());
        if (previous == null) {
            sections.put(section.getName(), section);
        } else {
            log.debug("Merging section '{}' from {} over {}",
                    section.getName(), section.getProvenance(), previous.getProvenance());
            sections.put(section.getName(), previous.mergedWith(section));
        }
        overlayTree(section);
    }

    /**
     * Writes the section's options into its tree node so both views agree.
     * A node that is not a mapping gives way to the section.
     */
    private void overlayTree(Section section) {
        Object node = tree.get(section.getName());
        if (node == null) {
            return;
        }
        if (node instanceof Map<?, ?> map) {
            Map<Object, Object> merged = new LinkedHashMap<>(map);
            merged.putAll(section.getOptions());
            tree.put(section.getName(), merged);
        } else {
            tree.remove(section.getName());
        }
    }

    public void mergeAll(Collection<Section> toMerge) {
        toMerge.forEach(this::merge);
    }

    /**
     * Replaces a section wholesale (used by substitution passes). The tree
     * node, if any, is left to the caller.
     */
    public void replace(Section section) {
        checkOpen();
        sections.put(section.getName(), section);
    }

    public Section remove(String name) {
        checkOpen();
        tree.remove(name);
        return sections.remove(name);
    }

    /**
     * Merges nested tree nodes. Mappings under the same top-level key are
     * merged key by key, the later node winning; anything else replaces the
     * earlier node.
     */
    public void mergeTree(Map<String, Object> nodes) {
        checkOpen();
        nodes.forEach((name, node) -> {
            Object previous = tree.get(name);
            if (previous instanceof Map<?, ?> before && node instanceof Map<?, ?> after) {
                Map<Object, Object> merged = new LinkedHashMap<>(before);
                merged.putAll(after);
                tree.put(name, merged);
            } else {
                tree.put(name, node);
            }
        });
    }

    public Optional<Section> get(String name) {
        return Optional.ofNullable(sections.get(name));
    }

    public boolean contains(String name) {
        return sections.containsKey(name);
    }

    public Optional<String> getOption(String section, String option) {
        Section s = sections.get(section);
        return s == null ? Optional.empty() : s.getOption(option);
    }

    public Set<String> getSectionNames() {
        return Collections.unmodifiableSet(sections.keySet());
    }

    public List<Section> getSections() {
        return new ArrayList<>(sections.values());
    }

    /**
     * Returns the nested node for a top-level name, or the section's options
     * as a one-level tree when no nested node was recorded.
     */
    public Optional<Object> getTreeNode(String name) {
        Object node = tree.get(name);
        if (node != null) {
            return Optional.of(node);
        }
        Section section = sections.get(name);
        if (section == null) {
            return Optional.empty();
        }
        return Optional.of(new LinkedHashMap<String, Object>(section.getOptions()));
    }

    public Map<String, Object> getTree() {
        return Collections.unmodifiableMap(tree);
    }

    public int size() {
        return sections.size();
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkOpen() {
        if (frozen) {
            throw new IllegalStateException("Section store is frozen after merge");
        }
    }

    @Override
    public String toString() {
        return "SectionStore{sections=" + sections.keySet() + ", frozen=" + frozen + "}";
    }
}
