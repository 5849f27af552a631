package com.coderocket.model;

/**
 * Review of a code snippet. Everything but {@code code} is optional.
 */
public record ReviewCodeRequest(
        String code,
        String language,
        String context,
        String aiService,
        String customPrompt
) {
    public ReviewCodeRequest(String code) {
        this(code, null, null, null, null);
    }
}
