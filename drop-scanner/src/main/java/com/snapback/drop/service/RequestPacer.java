package com.snapback.drop.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Keeps at least {@code interval} between the end of one paced call and the
 * start of the next. The first call never waits.
 *
 * One pacer covers one ordered stream of calls; it is not meant to be shared
 * across threads.
 */
public class RequestPacer {

    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastCompletedAt;

    public RequestPacer(Duration interval, Clock clock, Sleeper sleeper) {
        this.interval = interval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T> T pace(Supplier<T> call) {
        awaitTurn();
        try {
            return call.get();
        } finally {
            lastCompletedAt = clock.instant();
        }
    }

    private void awaitTurn() {
        if (lastCompletedAt == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        Duration wait = Duration.between(clock.instant(), lastCompletedAt.plus(interval));
        if (wait.isZero() || wait.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing requests", e);
        }
    }
}
