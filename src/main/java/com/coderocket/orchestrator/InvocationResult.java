package com.coderocket.orchestrator;

import com.coderocket.model.AiBackend;

import java.util.List;

/**
 * Generated text and the backend that actually produced it. {@code attempts} includes
 * the failures absorbed on the way, in order.
 */
public record InvocationResult(String text, AiBackend usedBackend, List<AttemptRecord> attempts) {

    public List<AttemptRecord> failedAttempts() {
        return attempts.stream().filter(a -> !a.success()).toList();
    }
}
