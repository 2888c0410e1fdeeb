package io.reviewmind.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".reviewmind", "config.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".reviewmind", "memory");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
