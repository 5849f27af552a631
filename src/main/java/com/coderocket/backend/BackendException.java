package com.coderocket.backend;

import com.coderocket.model.AiBackend;

/**
 * A single backend call failed.
 */
public class BackendException extends Exception {

    private final AiBackend backend;

    public BackendException(AiBackend backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendException(AiBackend backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public AiBackend getBackend() {
        return backend;
    }
}
