package com.sensorwatch.core.alert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Caps the number of alerts dispatched per rolling hour.
 *
 * <p>
 * Keeps a deque of dispatch instants. Each request evicts instants older than
 * one hour, then admits the alert if fewer than {@code maxPerHour} remain.
 * A {@code maxPerHour} of {@code 0} admits everything and tracks nothing.
 * </p>
 *
 * @since 1.0.0
 */
class AlertBudget {

    static final Duration WINDOW = Duration.ofHours(1);

    private final int maxPerHour;
    private final Clock clock;

    /** Instants of admitted alerts, oldest first. */
    private final Deque<Instant> dispatched = new ArrayDeque<>();

    AlertBudget(int maxPerHour, Clock clock) {
        if (maxPerHour < 0) {
            throw new IllegalArgumentException("maxPerHour must be >= 0, got: " + maxPerHour);
        }
        this.maxPerHour = maxPerHour;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * @return {@code true} if the alert may be dispatched (and is counted),
     *         {@code false} if the hourly budget is exhausted
     */
    boolean tryAcquire() {
        if (maxPerHour == 0) {
            return true;
        }
        Instant now = clock.instant();
        Instant windowStart = now.minus(WINDOW);
        while (!dispatched.isEmpty() && !dispatched.peekFirst().isAfter(windowStart)) {
            dispatched.pollFirst();
        }
        if (dispatched.size() >= maxPerHour) {
            return false;
        }
        dispatched.addLast(now);
        return true;
    }
}
