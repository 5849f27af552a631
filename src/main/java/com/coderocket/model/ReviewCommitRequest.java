package com.coderocket.model;

/**
 * Review of a single commit; HEAD when {@code commitHash} is null.
 */
public record ReviewCommitRequest(
        String repositoryPath,
        String commitHash,
        String aiService,
        String customPrompt
) {
}
