package com.coderocket.config;

/**
 * Where a settings file lives: the current project or the user's home directory.
 */
public enum ConfigScope {
    PROJECT,
    GLOBAL;

    public static ConfigScope parse(String value) {
        if (value == null || value.isBlank()) return PROJECT;
        return switch (value.trim().toLowerCase()) {
            case "project" -> PROJECT;
            case "global" -> GLOBAL;
            default -> throw new IllegalArgumentException(
                    "Unknown scope \"%s\". Supported: project, global".formatted(value));
        };
    }
}
