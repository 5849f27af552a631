package com.coderocket.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of AI backends a review can be sent to. Declaration order is the
 * default priority order.
 */
public enum AiBackend {
    GEMINI("gemini", "Gemini"),
    CLAUDECODE("claudecode", "Claude");

    private final String id;
    private final String displayName;

    AiBackend(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /** Name used in configuration files, CLI options and responses. */
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<AiBackend> fromName(String name) {
        if (name == null) return Optional.empty();
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(b -> b.id.equals(normalized))
                .findFirst();
    }

    /**
     * Resolve a backend name, falling back to the first known backend for anything unknown.
     */
    public static AiBackend normalize(String name) {
        return fromName(name).orElse(values()[0]);
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(AiBackend::id).toList();
    }

    @Override
    public String toString() {
        return id;
    }
}
