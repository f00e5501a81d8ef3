package fr.lapetina.configgraph.infrastructure.resource;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnerResourceLocatorTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("should resolve paths without owner against the base directory")
    void shouldUseBaseDirectory() {
        OwnerResourceLocator locator = new OwnerResourceLocator(dir, Map.of());

        assertThat(locator.resolve(null, "data/../model.bin")).isEqualTo(dir.resolve("model.bin"));
    }

    @Test
    @DisplayName("should resolve against a registered owner directory")
    void shouldUseOwnerDirectory() {
        Path other = dir.resolve("other");
        OwnerResourceLocator locator = new OwnerResourceLocator(dir, Map.of("other", other));

        assertThat(locator.resolve("other", "logo.png")).isEqualTo(other.resolve("logo.png"));
    }

    @Test
    @DisplayName("should fail for an unknown owner without classpath resource")
    void shouldFailForUnknownOwner() {
        OwnerResourceLocator locator = new OwnerResourceLocator(dir, Map.of());

        assertThatThrownBy(() -> locator.resolve("nobody", "x.txt"))
                .isInstanceOf(ImportResolutionException.class)
                .hasMessageContaining("nobody");
    }
}
