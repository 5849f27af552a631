package com.coderocket.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * Recognised configuration keys and their built-in defaults.
 * A {@code null} default means the key has no value unless a file or the environment sets it.
 */
public enum ConfigKey {
    AI_SERVICE("gemini"),
    AI_AUTO_SWITCH("true"),
    AI_TIMEOUT("30"),
    AI_MAX_RETRIES("3"),
    AI_LANGUAGE("zh-CN"),
    GEMINI_API_KEY(null),
    CLAUDE_API_KEY(null),
    GEMINI_MODEL("gemini-1.5-flash"),
    CLAUDE_MODEL("claude-3-sonnet-20240229"),
    GEMINI_BASE_URL("https://generativelanguage.googleapis.com"),
    CLAUDE_BASE_URL("https://api.anthropic.com"),
    FILE_CONTENT_CHAR_LIMIT("5000"),
    DEBUG("false");

    private final String defaultValue;

    ConfigKey(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public String defaultValue() {
        return defaultValue;
    }

    public static Optional<ConfigKey> fromName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.name().equals(name))
                .findFirst();
    }
}
