package com.coderocket.orchestrator;

import java.util.function.Predicate;

/**
 * Runs a call up to {@code maxAttempts} times, sleeping according to a {@link Backoff}
 * between failed attempts. There is no sleep after the final attempt.
 */
public final class Retrier {

    @FunctionalInterface
    public interface Call<T> {
        /**
         * @param attempt 1-based attempt index
         */
        T call(int attempt) throws Exception;
    }

    @FunctionalInterface
    public interface FailureListener {
        void onFailure(int attempt, Exception error);
    }

    private final int maxAttempts;
    private final Backoff backoff;
    private final Predicate<Exception> retryable;
    private final Sleeper sleeper;

    public Retrier(int maxAttempts, Backoff backoff, Predicate<Exception> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public <T> T execute(Call<T> call) throws RetryExhaustedException, InterruptedException {
        return execute(call, (attempt, error) -> {});
    }

    /**
     * Run {@code call} until it succeeds or attempts run out.
     *
     * @throws RetryExhaustedException carrying the last failure
     * @throws InterruptedException    if interrupted while calling or sleeping; never retried
     */
    public <T> T execute(Call<T> call, FailureListener listener)
            throws RetryExhaustedException, InterruptedException {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call(attempt);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastFailure = e;
                listener.onFailure(attempt, e);
                if (!retryable.test(e)) {
                    throw new RetryExhaustedException(attempt, e);
                }
                if (attempt < maxAttempts) {
                    sleeper.sleep(backoff.delay(attempt));
                }
            }
        }
        throw new RetryExhaustedException(maxAttempts, lastFailure);
    }

    static String describe(Throwable error) {
        if (error == null) return "unknown error";
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
