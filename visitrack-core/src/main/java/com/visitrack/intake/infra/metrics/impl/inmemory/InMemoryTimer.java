package com.visitrack.intake.infra.metrics.impl.inmemory;

import com.visitrack.intake.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running count, total and maximum in nanoseconds. Memory use does not grow
 * with the number of recordings.
 */
final class InMemoryTimer implements Timer {

    private final LongAdder count = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();
    private final AtomicLong maxNanos = new AtomicLong();

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        long nanos = duration.toNanos();
        count.increment();
        totalNanos.add(nanos);
        maxNanos.accumulateAndGet(nanos, Math::max);
    }

    @Override
    public long count() {
        return count.sum();
    }

    @Override
    public Duration total() {
        return Duration.ofNanos(totalNanos.sum());
    }

    @Override
    public Duration max() {
        return Duration.ofNanos(maxNanos.get());
    }
}
