package com.visitrack.intake.infra.metrics;

import java.time.Duration;

/**
 * Latency recorder keeping count, total and maximum.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    default void recordNanos(long nanos) {
        record(Duration.ofNanos(Math.max(0L, nanos)));
    }

    long count();

    /** Sum of all recorded durations. */
    Duration total();

    /** Longest recorded duration, zero before the first recording. */
    Duration max();

    default Duration mean() {
        long count = count();
        return count == 0 ? Duration.ZERO : total().dividedBy(count);
    }
}
