package com.coderocket.backend;

import com.coderocket.model.AiBackend;

/**
 * A text-generation service a review prompt can be sent to.
 */
public interface Backend {

    AiBackend id();

    /** Name used in logs and reports. */
    default String name() {
        return id().id();
    }

    /**
     * Whether a credential is present. Re-evaluated on every call since credentials can be
     * rewritten while the process runs.
     */
    boolean isConfigured();

    /**
     * Send the prompt and return the generated text.
     *
     * @throws BackendException when the call fails or returns no usable text
     */
    String invoke(String prompt) throws BackendException;
}
