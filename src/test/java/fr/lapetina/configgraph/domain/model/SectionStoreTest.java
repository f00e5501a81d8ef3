package fr.lapetina.configgraph.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionStoreTest {

    private SectionStore store;

    @BeforeEach
    void setUp() {
        store = new SectionStore();
    }

    @Test
    @DisplayName("should let later sources overwrite options and keep the rest")
    void shouldMergeOptions() {
        store.merge(new Section("db", Map.of("host", "localhost", "port", "5432"), "base.ini"));
        store.merge(new Section("db", Map.of("host", "db.internal"), "prod.ini"));

        Section db = store.get("db").orElseThrow();
        assertThat(db.getOptions()).containsEntry("host", "db.internal").containsEntry("port", "5432");
        assertThat(db.getProvenance()).isEqualTo("prod.ini");
    }

    @Test
    @DisplayName("should keep sections in insertion order")
    void shouldKeepOrder() {
        store.merge(Section.of("b", Map.of()));
        store.merge(Section.of("a", Map.of()));

        assertThat(store.getSectionNames()).containsExactly("b", "a");
    }

    @Test
    @DisplayName("should reject changes once frozen")
    void shouldRejectChangesWhenFrozen() {
        store.merge(Section.of("a", Map.of("x", "1")));
        store.freeze();

        assertThatThrownBy(() -> store.merge(Section.of("a", Map.of("x", "2"))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.getOption("a", "x")).contains("1");
    }

    @Test
    @DisplayName("should fall back to options when no tree node was recorded")
    void shouldFallBackToOptions() {
        store.merge(Section.of("flat", Map.of("k", "v")));
        store.mergeTree(Map.of("nested", Map.of("inner", Map.of("k", 1))));

        assertThat(store.getTreeNode("flat")).contains(Map.of("k", "v"));
        assertThat(store.getTreeNode("nested")).contains(Map.of("inner", Map.of("k", 1)));
        assertThat(store.getTreeNode("missing")).isEmpty();
    }

    @Test
    @DisplayName("should write later options into an existing tree node")
    void shouldOverlayTreeNode() {
        store.merge(Section.of("person", Map.of("first", "ann", "age", "1")));
        store.mergeTree(Map.of("person", Map.of("first", "ann", "age", 1)));

        store.merge(Section.of("person", Map.of("age", "2")));

        assertThat(store.getOption("person", "age")).contains("2");
        assertThat(store.getTreeNode("person")).contains(Map.of("first", "ann", "age", "2"));
    }

    @Test
    @DisplayName("should merge tree mappings key by key")
    void shouldMergeTreeNodes() {
        store.mergeTree(Map.of("db", Map.of("host", "a", "port", 1)));
        store.mergeTree(Map.of("db", Map.of("port", 2)));

        assertThat(store.getTreeNode("db")).contains(Map.of("host", "a", "port", 2));
    }
}
