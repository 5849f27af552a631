package com.coderocket.model;

import java.util.List;

/**
 * Review of a set of files, paths relative to {@code repositoryPath}.
 */
public record ReviewFilesRequest(
        List<String> files,
        String repositoryPath,
        String aiService,
        String customPrompt
) {
    public ReviewFilesRequest {
        files = files != null ? List.copyOf(files) : List.of();
    }
}
