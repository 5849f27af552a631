package com.coderocket.model;

import com.coderocket.config.ConfigScope;

/**
 * Settings to persist for a backend. Null fields are left untouched.
 */
public record ConfigureRequest(
        String service,
        ConfigScope scope,
        String apiKey,
        String language,
        Integer timeout,
        Integer maxRetries
) {
    public ConfigureRequest {
        if (scope == null) scope = ConfigScope.PROJECT;
    }
}
