package fr.lapetina.configgraph.infrastructure.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.model.Section;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InlineConfigSourceTest {

    @Nested
    @DisplayName("string source")
    class StringSource {

        @Test
        @DisplayName("should split section.option pairs")
        void shouldSplitPairs() {
            List<Section> sections = new StringConfigSource("db.host=localhost, db.port=5432, debug=True")
                    .load().sections();

            assertThat(sections).extracting(Section::getName).containsExactly("db", "default");
            assertThat(sections.get(0).getOptions()).containsEntry("host", "localhost").containsEntry("port", "5432");
            assertThat(sections.get(1).getOption("debug")).contains("True");
        }

        @Test
        @DisplayName("should honour a custom separator and default section")
        void shouldHonourSeparator() {
            List<Section> sections = new StringConfigSource("a=1;b.c=2", ";", "root").load().sections();

            assertThat(sections.get(0).getName()).isEqualTo("root");
            assertThat(sections.get(1).getOption("c")).contains("2");
        }

        @Test
        @DisplayName("should reject pairs without a value")
        void shouldRejectBadPair() {
            assertThatThrownBy(() -> new StringConfigSource("novalue").load())
                    .isInstanceOf(ImportResolutionException.class);
        }
    }

    @Nested
    @DisplayName("environment source")
    class EnvironmentSource {

        @Test
        @DisplayName("should expose variables as one section with escaped delimiters")
        void shouldExposeVariables() {
            Map<String, String> env = Map.of("HOME", "/home/me", "PS1", "$ ");

            Section section = new EnvironmentConfigSource("env", "$", env).load().sections().get(0);

            assertThat(section.getName()).isEqualTo("env");
            assertThat(section.getOption("HOME")).contains("/home/me");
            assertThat(section.getOption("PS1")).contains("$$ ");
        }
    }

    @Nested
    @DisplayName("tree sources")
    class TreeSources {

        @TempDir
        Path dir;

        private final TreeFlattener flattener = new TreeFlattener(new ObjectMapper(), "default");

        @Test
        @DisplayName("should flatten YAML mappings and keep the tree")
        void shouldFlattenYaml() throws IOException {
            Path file = dir.resolve("app.yml");
            Files.writeString(file, """
                    version: 2
                    server:
                      port: 8080
                      debug: true
                      tags: [a, b]
                      pool:
                        size: 4
                    """);

            ConfigContent content = new YamlConfigSource(file, flattener).load();

            Section server = content.sections().get(0);
            assertThat(server.getName()).isEqualTo("server");
            assertThat(server.getOption("port")).contains("8080");
            assertThat(server.getOption("debug")).contains("True");
            assertThat(server.getOption("tags")).contains("json: [\"a\",\"b\"]");
            assertThat(server.getOption("pool")).contains("json: {\"size\":4}");
            assertThat(content.sections().get(1).getName()).isEqualTo("default");
            assertThat(content.tree()).containsKey("server");
        }

        @Test
        @DisplayName("should flatten JSON documents")
        void shouldFlattenJson() throws IOException {
            Path file = dir.resolve("app.json");
            Files.writeString(file, "{\"db\": {\"host\": \"localhost\", \"replica\": null}}");

            Section db = new JsonConfigSource(file, new ObjectMapper(), flattener).load().sections().get(0);

            assertThat(db.getOption("host")).contains("localhost");
            assertThat(db.getOption("replica")).contains("None");
        }

        @Test
        @DisplayName("should reject a YAML document that is not a mapping")
        void shouldRejectNonMapping() throws IOException {
            Path file = dir.resolve("list.yml");
            Files.writeString(file, "- a\n- b\n");

            assertThatThrownBy(() -> new YamlConfigSource(file, flattener).load())
                    .isInstanceOf(ImportResolutionException.class);
        }
    }
}
