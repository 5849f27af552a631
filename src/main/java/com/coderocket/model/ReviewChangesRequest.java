package com.coderocket.model;

/**
 * Review of the uncommitted changes of a repository.
 */
public record ReviewChangesRequest(
        String repositoryPath,
        boolean includeStaged,
        boolean includeUnstaged,
        String aiService,
        String customPrompt
) {
}
