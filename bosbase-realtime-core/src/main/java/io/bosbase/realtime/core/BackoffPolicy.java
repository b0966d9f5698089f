package io.bosbase.realtime.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reconnect delays taken from a fixed ascending table.
 *
 * <p>The attempt counter is owned by the caller; attempts past the end of the table reuse the last delay.
 */
public final class BackoffPolicy {

    private static final BackoffPolicy DEFAULT = new BackoffPolicy(List.of(
            Duration.ofMillis(200),
            Duration.ofMillis(300),
            Duration.ofMillis(500),
            Duration.ofMillis(1000),
            Duration.ofMillis(1200),
            Duration.ofMillis(1500),
            Duration.ofMillis(2000)
    ));

    private final List<Duration> intervals;

    public BackoffPolicy(List<Duration> intervals) {
        Objects.requireNonNull(intervals, "intervals");
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("intervals must not be empty");
        }
        for (Duration d : intervals) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException("intervals must be non-negative");
            }
        }
        this.intervals = List.copyOf(intervals);
    }

    public static BackoffPolicy defaults() {
        return DEFAULT;
    }

    public static BackoffPolicy of(Duration... intervals) {
        return new BackoffPolicy(List.of(intervals));
    }

    /**
     * @param attempt number of failed attempts so far, starting at 0
     */
    public Duration delay(int attempt) {
        if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0");
        return intervals.get(Math.min(attempt, intervals.size() - 1));
    }

    public List<Duration> intervals() {
        return intervals;
    }
}
