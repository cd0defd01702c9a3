package com.example.burn.service;

import java.time.Duration;

/**
 * Suspends the calling burn thread. Swapped out in tests to observe pacing without waiting.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
