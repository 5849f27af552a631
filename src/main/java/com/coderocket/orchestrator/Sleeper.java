package com.coderocket.orchestrator;

import java.time.Duration;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
