package fr.lapetina.configgraph.infrastructure.source;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.model.Section;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IniConfigSourceTest {

    private static List<Section> load(String text) {
        return IniConfigSource.ofText(text, "test.ini").load().sections();
    }

    @Test
    @DisplayName("should read sections and options with either separator")
    void shouldReadSections() {
        List<Section> sections = load("""
                # comment
                [server]
                host = localhost
                port: 8080
                ; another comment

                [client]
                url = http://localhost:8080
                """);

        assertThat(sections).extracting(Section::getName).containsExactly("server", "client");
        assertThat(sections.get(0).getOptions()).containsEntry("host", "localhost").containsEntry("port", "8080");
        assertThat(sections.get(1).getOption("url")).contains("http://localhost:8080");
        assertThat(sections.get(0).getProvenance()).isEqualTo("test.ini");
    }

    @Test
    @DisplayName("should keep directive values intact")
    void shouldKeepDirectives() {
        List<Section> sections = load("""
                [org]
                leader = instance({'share': 'deep'}): bob
                """);

        assertThat(sections.get(0).getOption("leader")).contains("instance({'share': 'deep'}): bob");
    }

    @Test
    @DisplayName("should join indented continuation lines")
    void shouldJoinContinuations() {
        List<Section> sections = load("""
                [text]
                body = first
                    second
                """);

        assertThat(sections.get(0).getOption("body")).contains("first\nsecond");
    }

    @Test
    @DisplayName("should merge repeated sections")
    void shouldMergeRepeatedSections() {
        List<Section> sections = load("""
                [a]
                x = 1
                [a]
                y = 2
                """);

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).getOptions()).containsOnlyKeys("x", "y");
    }

    @Test
    @DisplayName("should report the line of a malformed option")
    void shouldReportMalformedLine() {
        assertThatThrownBy(() -> load("[a]\nnot an option\n"))
                .isInstanceOf(ImportResolutionException.class)
                .hasMessageContaining("Line 2");
    }
}
