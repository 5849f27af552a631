package com.coderocket.model;

import java.util.List;

/**
 * Snapshot of the effective configuration and of every backend.
 */
public record ServiceStatus(
        String currentService,
        List<BackendStatus> services,
        boolean autoSwitchEnabled,
        String language,
        int timeout,
        int maxRetries,
        String globalConfigPath,
        String projectConfigPath
) {

    /**
     * @param available null when connectivity was not probed
     */
    public record BackendStatus(String service, boolean configured, Boolean available, String apiKeyVariable) {
    }
}
