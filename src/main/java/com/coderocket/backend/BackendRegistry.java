package com.coderocket.backend;

import com.coderocket.config.ConfigStore;
import com.coderocket.model.AiBackend;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One {@link Backend} per {@link AiBackend}.
 */
public class BackendRegistry {

    private final Map<AiBackend, Backend> backends = new EnumMap<>(AiBackend.class);

    public BackendRegistry(List<Backend> backends) {
        for (Backend backend : backends) {
            this.backends.put(backend.id(), backend);
        }
        for (AiBackend id : AiBackend.values()) {
            if (!this.backends.containsKey(id)) {
                throw new IllegalArgumentException("No backend registered for " + id);
            }
        }
    }

    /**
     * Registry with the HTTP implementation of every backend.
     */
    public static BackendRegistry create(ConfigStore config) {
        return new BackendRegistry(List.of(new GeminiBackend(config), new ClaudeBackend(config)));
    }

    public Backend get(AiBackend id) {
        return backends.get(id);
    }

    /** All backends in priority order. */
    public List<Backend> all() {
        return Arrays.stream(AiBackend.values()).map(backends::get).toList();
    }

    /** Backends that currently have a credential, in priority order. */
    public List<Backend> configured() {
        return all().stream().filter(Backend::isConfigured).toList();
    }
}
