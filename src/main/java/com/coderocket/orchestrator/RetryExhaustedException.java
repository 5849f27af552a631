package com.coderocket.orchestrator;

/**
 * Every attempt allowed by a {@link Retrier} failed, or a failure was not retryable.
 */
public class RetryExhaustedException extends Exception {

    private final int attempts;

    public RetryExhaustedException(int attempts, Exception lastFailure) {
        super("Failed after %d attempt(s): %s".formatted(attempts, Retrier.describe(lastFailure)), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public Exception getLastFailure() {
        return (Exception) getCause();
    }
}
