package com.coderocket.orchestrator;

import com.coderocket.model.AiBackend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * No eligible backend produced a result. The message names every backend that was tried
 * with its last error, and every backend skipped for lack of a credential.
 */
public class AllBackendsFailedException extends Exception {

    private final Map<AiBackend, String> failures;
    private final List<AiBackend> skipped;
    private final List<AttemptRecord> attempts;

    public AllBackendsFailedException(String message, Map<AiBackend, String> failures,
                                      List<AiBackend> skipped, List<AttemptRecord> attempts) {
        super(message);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.skipped = List.copyOf(skipped);
        this.attempts = List.copyOf(attempts);
    }

    /** Last error per attempted backend, in the order they were tried. */
    public Map<AiBackend, String> getFailures() {
        return failures;
    }

    public List<AiBackend> getSkipped() {
        return skipped;
    }

    public List<AttemptRecord> getAttempts() {
        return attempts;
    }
}
