package fr.lapetina.configgraph.infrastructure.config;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionalTreeRewriterTest {

    private final ConditionalTreeRewriter rewriter =
            new ConditionalTreeRewriter(s -> s.equals("True"), "test.yml");

    private static Map<String, Object> condition(Object test) {
        return Map.of("app", Map.of("condition", Map.of(
                "if", test,
                "then", Map.of("store", Map.of("class_name", "MemoryStore")),
                "else", Map.of("store", Map.of("class_name", "FileStore")))));
    }

    @Test
    @DisplayName("should pick the then branch when the test is truthy")
    void shouldPickThen() {
        Map<String, Object> out = rewriter.apply(condition(true));

        assertThat(out).isEqualTo(Map.of("app", Map.of("store", Map.of("class_name", "MemoryStore"))));
    }

    @Test
    @DisplayName("should classify string tests before choosing")
    void shouldClassifyStrings() {
        assertThat(rewriter.apply(condition("False")))
                .isEqualTo(Map.of("app", Map.of("store", Map.of("class_name", "FileStore"))));
        assertThat(rewriter.apply(condition("True")))
                .isEqualTo(Map.of("app", Map.of("store", Map.of("class_name", "MemoryStore"))));
    }

    @Test
    @DisplayName("should treat zero as false")
    void shouldTreatZeroAsFalse() {
        assertThat(rewriter.apply(condition(0)))
                .isEqualTo(Map.of("app", Map.of("store", Map.of("class_name", "FileStore"))));
    }

    @Test
    @DisplayName("should reject branches with different children")
    void shouldRejectDifferentChildren() {
        Map<String, Object> document = Map.of("condition", Map.of(
                "if", true,
                "then", Map.of("a", 1),
                "else", Map.of("b", 2)));

        assertThatThrownBy(() -> rewriter.apply(document))
                .isInstanceOf(ImportResolutionException.class)
                .hasMessageContaining("same child root");
    }

    @Test
    @DisplayName("should reject a condition without an else branch")
    void shouldRequireElse() {
        Map<String, Object> document = Map.of("condition", Map.of("if", true, "then", Map.of("a", 1)));

        assertThatThrownBy(() -> rewriter.apply(document))
                .isInstanceOf(ImportResolutionException.class)
                .hasMessageContaining("'else'");
    }

    @Test
    @DisplayName("should keep a null child of the chosen branch")
    @SuppressWarnings("unchecked")
    void shouldKeepNullChild() {
        Map<String, Object> then = new HashMap<>();
        then.put("store", null);
        Map<String, Object> document = Map.of("app", Map.of("condition", Map.of(
                "if", true,
                "then", then,
                "else", Map.of("store", "file"))));

        Map<String, Object> out = rewriter.apply(document);

        assertThat((Map<String, Object>) out.get("app")).containsOnlyKeys("store").containsEntry("store", null);
    }
}
