package com.parkthrive.crmops.http;

import java.time.Duration;

/**
 * Blocking wait used for backoff and pacing; replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleep, restoring the interrupt flag and failing the caller if interrupted.
     */
    default void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleep(duration);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted during wait", ie);
        }
    }
}
