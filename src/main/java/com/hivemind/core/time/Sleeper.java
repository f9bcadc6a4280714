package com.hivemind.core.time;

import java.time.Duration;

/**
 * Blocking pause used by agent loops and the request router.
 * Tests substitute a recording implementation so nothing actually sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
