package com.snapback.drop.service;

import java.time.Duration;

/**
 * Blocking wait used by {@link RequestPacer}; swapped for a virtual clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
