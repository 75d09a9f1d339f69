package com.fever.resilience.infrastructure.resilience;

import java.time.Duration;

/**
 * Blocking wait between retry attempts
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
