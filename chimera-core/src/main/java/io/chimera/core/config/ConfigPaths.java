package io.chimera.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String HOME_PROPERTY = "chimera.home";

    private ConfigPaths() {
    }

    public static Path chimeraHome() {
        String override = System.getProperty(HOME_PROPERTY);
        if (override != null && !override.isBlank()) {
            return expandUserHome(override.trim());
        }
        return userHome().resolve(".chimera");
    }

    public static Path defaultConfigPath() {
        return chimeraHome().resolve("config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return chimeraHome().resolve("workspace");
        }
        return expandUserHome(rawPath.trim());
    }

    public static Path memoriesFile(Path workspace) {
        return workspace.resolve("memory").resolve("memories.json");
    }

    public static Path conversationsFile(Path workspace) {
        return workspace.resolve("memory").resolve("conversations.json");
    }

    private static Path expandUserHome(String rawPath) {
        if (rawPath.equals("~")) {
            return userHome();
        }
        if (rawPath.startsWith("~/")) {
            return userHome().resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
