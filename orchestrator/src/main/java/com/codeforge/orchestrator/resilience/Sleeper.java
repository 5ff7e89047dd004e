package com.codeforge.orchestrator.resilience;

import java.time.Duration;

/** Backoff pause. Swapped for a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
