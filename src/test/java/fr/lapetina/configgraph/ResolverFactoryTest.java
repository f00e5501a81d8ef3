package fr.lapetina.configgraph;

import fr.lapetina.configgraph.TestTypes.Connection;
import fr.lapetina.configgraph.TestTypes.Person;
import fr.lapetina.configgraph.domain.model.Settings;
import fr.lapetina.configgraph.infrastructure.config.ResolverSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResolverFactoryTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("should resolve types contributed by classpath registrars")
    void shouldResolveRegisteredTypes() throws IOException {
        Path root = write("app.ini", """
                [bob]
                class_name = Person
                first = Bob
                age = 42
                """);

        try (ResolverFactory factory = ResolverFactory.create(root.toString())) {
            assertThat(factory.getBuilder().resolve("bob", Person.class)).isEqualTo(new Person("Bob", 42));
        }
    }

    @Test
    @DisplayName("should reach other applications and their resources")
    void shouldReachApplications() throws IOException {
        Path otherRoot = write("other/other.ini", """
                [alice]
                class_name = Person
                first = Alice
                age = 30
                """);
        Path root = write("app/app.ini", """
                [links]
                friend = application(other): alice
                logo = resource(other): logo.png
                local = resource: data.csv
                """);

        try (ResolverFactory factory = ResolverFactory.create(root.toString(), new ResolverSettings(),
                TestTypes.registry(), Map.of(), Map.of("other", otherRoot))) {
            Settings links = factory.getBuilder().resolve("links", Settings.class);

            assertThat(links.get("friend")).isEqualTo(new Person("Alice", 30));
            assertThat(links.get("logo")).isEqualTo(dir.resolve("other/logo.png"));
            assertThat(links.get("local")).isEqualTo(dir.resolve("app/data.csv"));
        }
    }

    @Test
    @DisplayName("should swap in a new builder on reload and leave the previous one open")
    void shouldRebuildOnReload() throws IOException {
        Path root = write("app.ini", "[conn]\nclass_name = Connection\nurl = db://one\n");

        try (ResolverFactory factory = ResolverFactory.create(root.toString(), new ResolverSettings(),
                TestTypes.registry())) {
            Connection first = factory.getBuilder().resolve("conn", Connection.class);

            Files.writeString(root, "[conn]\nclass_name = Connection\nurl = db://two\n");
            factory.getConfigLoader().reload();

            assertThat(first.isClosed()).isFalse();
            assertThat(factory.getBuilder().resolve("conn", Connection.class).getUrl()).isEqualTo("db://two");

            assertThat(factory.closeRetired()).isEqualTo(1);
            assertThat(first.isClosed()).isTrue();
            assertThat(factory.closeRetired()).isZero();
        }
    }

    @Test
    @DisplayName("should close retired builders on shutdown")
    void shouldCloseRetiredOnShutdown() throws IOException {
        Path root = write("app.ini", "[conn]\nclass_name = Connection\nurl = db://one\n");
        ResolverFactory factory = ResolverFactory.create(root.toString(), new ResolverSettings(),
                TestTypes.registry());
        Connection first = factory.getBuilder().resolve("conn", Connection.class);
        Files.writeString(root, "[conn]\nclass_name = Connection\nurl = db://two\n");
        factory.getConfigLoader().reload();

        factory.close();

        assertThat(first.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should close cached instances on shutdown")
    void shouldCloseInstances() throws IOException {
        Path root = write("app.ini", "[conn]\nclass_name = Connection\nurl = db://one\n");
        ResolverFactory factory = ResolverFactory.create(root.toString(), new ResolverSettings(),
                TestTypes.registry());
        Connection connection = factory.getBuilder().resolve("conn", Connection.class);

        factory.close();

        assertThat(connection.isClosed()).isTrue();
    }
}
