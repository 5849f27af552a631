package com.coderocket.orchestrator;

import java.time.Duration;

/**
 * Delay before the attempt that follows a failed one.
 */
@FunctionalInterface
public interface Backoff {

    /**
     * @param attempt 1-based index of the attempt that just failed
     */
    Duration delay(int attempt);

    /**
     * {@code min(2^attempt * 1s, 10s)}: 2s, 4s, 8s, then 10s.
     */
    static Backoff exponential() {
        return exponential(Duration.ofSeconds(1), Duration.ofSeconds(10));
    }

    static Backoff exponential(Duration base, Duration max) {
        return attempt -> {
            if (attempt >= 31) return max;
            long millis = (1L << attempt) * base.toMillis();
            return millis >= max.toMillis() ? max : Duration.ofMillis(millis);
        };
    }
}
