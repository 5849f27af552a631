package com.coderocket.prompts;

/**
 * No prompt file and no built-in text exists for a prompt key.
 */
public class PromptResolutionException extends RuntimeException {

    public PromptResolutionException(String key) {
        super("No prompt found for key \"%s\"".formatted(key));
    }
}
