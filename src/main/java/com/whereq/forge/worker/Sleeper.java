package com.whereq.forge.worker;

import java.time.Duration;

/**
 * Interruptible pause used for retry backoff and loop error backoff
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
