package fr.lapetina.configgraph.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.TestTypes;
import fr.lapetina.configgraph.TestTypes.Person;
import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import fr.lapetina.configgraph.domain.model.Settings;
import fr.lapetina.configgraph.domain.model.SectionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportResolverTest {

    @TempDir
    Path dir;

    private ImportResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ImportResolver(new ResolverSettings(), new ObjectMapper(),
                Map.of("data", dir.toString()), Map.of("HOME", "/home/me"));
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("should load a root file without manifest as plain sections")
    void shouldLoadPlainFile() throws IOException {
        Path root = write("plain.ini", "[a]\nx = 1\n");

        SectionStore store = resolver.resolve(root);

        assertThat(store.getOption("a", "x")).contains("1");
        assertThat(store.isFrozen()).isTrue();
    }

    @Nested
    @DisplayName("manifest")
    class Manifest {

        private Path root;

        @BeforeEach
        void setUp() throws IOException {
            write("conf/base.ini", """
                    [db]
                    host = localhost
                    port = 5432
                    user = base

                    [app]
                    log = ${paths:conf_dir}/app.log
                    price = $$5
                    """);
            write("conf/overrides.yml", "db:\n  port: 6543\n");
            write("tree.json", "{\"cache\": {\"size\": 10}}");
            root = write("root.ini", """
                    [import]
                    references = list: paths
                    sections = list: base, overrides, tree, inline, environment

                    [paths]
                    conf_dir = conf

                    [base]
                    config_file = ${paths:conf_dir}/base.ini

                    [overrides]
                    type = yaml
                    config_file = ${paths:conf_dir}/overrides.yml

                    [tree]
                    config_file = ^{data}/tree.json

                    [inline]
                    type = string
                    config_str = db.pool=8

                    [environment]
                    type = environment

                    [db]
                    user = root_user
                    """);
        }

        @Test
        @DisplayName("should merge sources in order with root sections on top")
        void shouldMergeInOrder() {
            SectionStore store = resolver.resolve(root);

            assertThat(store.get("db").orElseThrow().getOptions())
                    .containsEntry("host", "localhost")
                    .containsEntry("port", "6543")
                    .containsEntry("user", "root_user")
                    .containsEntry("pool", "8");
            assertThat(store.getOption("cache", "size")).contains("10");
            assertThat(store.getOption("env", "HOME")).contains("/home/me");
            assertThat(store.getSectionNames()).contains("paths").doesNotContain("import", "base", "inline");
        }

        @Test
        @DisplayName("should substitute every value against the merged store")
        void shouldSubstituteGlobally() {
            SectionStore store = resolver.resolve(root);

            assertThat(store.getOption("app", "log")).contains("conf/app.log");
            assertThat(store.getOption("app", "price")).contains("$5");
        }

        @Test
        @DisplayName("should keep the nested tree of tree sources")
        void shouldKeepTree() {
            SectionStore store = resolver.resolve(root);

            assertThat(store.getTreeNode("cache")).contains(Map.of("size", 10));
        }
    }

    @Nested
    @DisplayName("missing sources")
    class MissingSources {

        @Test
        @DisplayName("should skip a missing optional file with a diagnostic")
        void shouldSkipOptional() throws IOException {
            Path root = write("root.ini", """
                    [import]
                    sections = list: extra

                    [extra]
                    config_file = missing.ini
                    optional = True

                    [a]
                    x = 1
                    """);

            SectionStore store = resolver.resolve(root);

            assertThat(store.getOption("a", "x")).contains("1");
            assertThat(resolver.getDiagnostics()).singleElement().asString().contains("missing.ini");
        }

        @Test
        @DisplayName("should fail on a missing required file")
        void shouldFailOnRequired() throws IOException {
            Path root = write("root.ini", """
                    [import]
                    sections = list: extra

                    [extra]
                    config_file = missing.ini
                    """);

            assertThatThrownBy(() -> resolver.resolve(root))
                    .isInstanceOf(ImportResolutionException.class)
                    .hasMessageContaining("File not found");
        }

        @Test
        @DisplayName("should fail when a reference is loaded after the entry using it")
        void shouldFailOnLateReference() throws IOException {
            write("later.ini", "[later]\ndir = x\n");
            Path root = write("root.ini", """
                    [import]
                    sections = list: early, later_entry

                    [early]
                    type = string
                    config_str = a.b=1
                    references = list: later

                    [later_entry]
                    config_file = later.ini
                    """);

            assertThatThrownBy(() -> resolver.resolve(root))
                    .isInstanceOf(ImportResolutionException.class)
                    .hasMessageContaining("not loaded");
        }

        @Test
        @DisplayName("should fail on an unresolved placeholder")
        void shouldFailOnUnresolvedPlaceholder() throws IOException {
            Path root = write("root.ini", "[a]\nx = ${nowhere:y}\n");

            assertThatThrownBy(() -> resolver.resolve(root))
                    .isInstanceOf(ImportResolutionException.class)
                    .hasMessageContaining("nowhere");
        }
    }

    @Nested
    @DisplayName("conditional YAML")
    class ConditionalYaml {

        private Path root(String testing) throws IOException {
            write("cond.yml", """
                    app:
                      condition:
                        if: ${default:testing}
                        then:
                          store: memory
                        else:
                          store: file
                    """);
            return write("root.ini", """
                    [import]
                    references = list: default
                    sections = list: cond

                    [default]
                    testing = %s

                    [cond]
                    type = condyaml
                    config_file = cond.yml
                    """.formatted(testing));
        }

        @Test
        @DisplayName("should take the then branch when the condition holds")
        void shouldTakeThen() throws IOException {
            assertThat(resolver.resolve(root("True")).getOption("app", "store")).contains("memory");
        }

        @Test
        @DisplayName("should take the else branch otherwise")
        void shouldTakeElse() throws IOException {
            assertThat(resolver.resolve(root("False")).getOption("app", "store")).contains("file");
        }
    }

    @Nested
    @DisplayName("nested imports")
    class NestedImports {

        @Test
        @DisplayName("should merge a child manifest")
        void shouldMergeChild() throws IOException {
            write("child/child.ini", """
                    [import]
                    sections = list: inline

                    [inline]
                    type = string
                    config_str = child.flag=on
                    """);
            Path root = write("root.ini", """
                    [import]
                    sections = list: child

                    [child]
                    type = import
                    config_file = child/child.ini
                    """);

            assertThat(resolver.resolve(root).getOption("child", "flag")).contains("on");
        }

        @Test
        @DisplayName("should detect files importing each other")
        void shouldDetectFileCycle() throws IOException {
            write("child.ini", """
                    [import]
                    sections = list: back

                    [back]
                    type = import
                    config_file = root.ini
                    """);
            Path root = write("root.ini", """
                    [import]
                    sections = list: child

                    [child]
                    type = import
                    config_file = child.ini
                    """);

            assertThatThrownBy(() -> resolver.resolve(root))
                    .isInstanceOf(ImportResolutionException.class)
                    .hasMessageContaining("cycle");
        }
    }

    @Nested
    @DisplayName("overrides of tree sources")
    class TreeOverrides {

        private Path root;

        @BeforeEach
        void setUp() throws IOException {
            write("person.yml", "person:\n  first: ann\n  age: 1\n");
            root = write("root.ini", """
                    [import]
                    sections = list: people

                    [people]
                    config_file = person.yml

                    [person]
                    age = 2

                    [holder]
                    as_record = dataclass(Person): person
                    as_tree = tree: person
                    """);
        }

        @Test
        @DisplayName("should carry a root override into the tree view")
        void shouldOverrideTreeNode() {
            SectionStore store = resolver.resolve(root);

            assertThat(store.getOption("person", "age")).contains("2");
            assertThat(store.getTreeNode("person")).contains(Map.of("first", "ann", "age", "2"));
        }

        @Test
        @DisplayName("should build records and trees from the overridden values")
        void shouldBuildFromOverriddenValues() {
            try (InstanceGraphBuilder builder = InstanceGraphBuilder.builder()
                    .store(resolver.resolve(root))
                    .types(TestTypes.registry())
                    .build()) {
                Settings holder = builder.resolve("holder", Settings.class);

                assertThat(holder.get("as_record")).isEqualTo(new Person("ann", 2));
                assertThat(((Settings) holder.get("as_tree")).get("age")).isEqualTo(2);
            }
        }
    }

    @Nested
    @DisplayName("entry references")
    class EntryReferences {

        private Path root(String references) throws IOException {
            write("yes.ini", "[loaded]\nflag = on\n");
            return write("root.ini", """
                    [import]
                    sections = list: first, second

                    [first]
                    type = string
                    config_str = a_section.value=yes

                    [second]
                    config_file = ${a_section:value}.ini
                    %s
                    """.formatted(references));
        }

        @Test
        @DisplayName("should substitute a path from a referenced section loaded earlier")
        void shouldUseReferencedSection() throws IOException {
            SectionStore store = resolver.resolve(root("references = list: a_section"));

            assertThat(store.getOption("loaded", "flag")).contains("on");
        }

        @Test
        @DisplayName("should not see a loaded section the entry does not reference")
        void shouldIgnoreUnreferencedSection() throws IOException {
            Path root = root("");

            assertThatThrownBy(() -> resolver.resolve(root))
                    .isInstanceOf(ImportResolutionException.class)
                    .hasMessageContaining("no option 'value' in section 'a_section'");
        }
    }
}
