package com.batrun.core.execution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Start instant and, once stopped, end instant of a timed activity.
 */
public final class TimeInterval {

    private final Clock clock;
    private final Instant startTime;
    private volatile Instant endTime;

    public TimeInterval(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public Duration stop() {
        endTime = clock.instant();
        return Duration.between(startTime, endTime);
    }

    public Instant startTime() {
        return startTime;
    }

    /**
     * Returns the elapsed duration, empty while the interval is still open.
     */
    public Optional<Duration> elapsed() {
        return Optional.ofNullable(endTime).map(end -> Duration.between(startTime, end));
    }

    public boolean isStopped() {
        return endTime != null;
    }
}
