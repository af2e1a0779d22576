package io.chimera.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigPathsTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty(ConfigPaths.HOME_PROPERTY);
    }

    @Test
    void shouldDefaultUnderUserHome() {
        Path home = Path.of(System.getProperty("user.home"));

        assertThat(ConfigPaths.defaultConfigPath()).isEqualTo(home.resolve(".chimera/config.json"));
        assertThat(ConfigPaths.resolveWorkspace("  ")).isEqualTo(home.resolve(".chimera/workspace"));
        assertThat(ConfigPaths.resolveWorkspace("~/notes")).isEqualTo(home.resolve("notes"));
        assertThat(ConfigPaths.resolveWorkspace("~")).isEqualTo(home);
    }

    @Test
    void shouldHonourHomeOverride() {
        System.setProperty(ConfigPaths.HOME_PROPERTY, tempDir.toString());

        assertThat(ConfigPaths.defaultConfigPath()).isEqualTo(tempDir.resolve("config.json"));
        assertThat(ConfigPaths.resolveWorkspace(null)).isEqualTo(tempDir.resolve("workspace"));
        assertThat(ConfigPaths.resolveWorkspace(tempDir.resolve("custom").toString())).isEqualTo(tempDir.resolve("custom"));
    }

    @Test
    void shouldPlaceStoresUnderWorkspaceMemoryDirectory() {
        Path workspace = tempDir.resolve("workspace");

        assertThat(ConfigPaths.memoriesFile(workspace)).isEqualTo(workspace.resolve("memory/memories.json"));
        assertThat(ConfigPaths.conversationsFile(workspace)).isEqualTo(workspace.resolve("memory/conversations.json"));
    }
}
