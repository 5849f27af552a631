package com.coderocket.orchestrator;

import com.coderocket.model.AiBackend;

/**
 * Outcome of one call to one backend. Kept only for the lifetime of an orchestrated call.
 */
public record AttemptRecord(AiBackend backend, int attempt, boolean success, String message) {

    static AttemptRecord success(AiBackend backend, int attempt) {
        return new AttemptRecord(backend, attempt, true, null);
    }

    static AttemptRecord failure(AiBackend backend, int attempt, String message) {
        return new AttemptRecord(backend, attempt, false, message);
    }
}
