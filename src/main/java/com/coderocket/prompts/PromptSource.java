package com.coderocket.prompts;

import java.util.Optional;

/**
 * One layer of prompt file lookup.
 */
public interface PromptSource {

    /** Short label used in logs, e.g. "project" or "global". */
    String name();

    /**
     * Read a prompt file from this layer.
     *
     * @return the file content, or empty when this layer does not have the file
     */
    Optional<String> find(String fileName);

    /** Where this layer would look for {@code fileName}. */
    String describe(String fileName);
}
