package com.visitrack.intake.infra.metrics.internal;

import com.visitrack.intake.infra.metrics.Counter;
import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.infra.metrics.Timer;

import java.time.Duration;

/**
 * Fallback registry that records nothing.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private static final Counter NO_OP_COUNTER = new NoOpCounter();
    private static final Timer NO_OP_TIMER = new NoOpTimer();

    private NoOpMetricsRegistry() {
    }

    @Override
    public Counter counter(String name, String... tags) {
        return NO_OP_COUNTER;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return NO_OP_TIMER;
    }

    private static final class NoOpCounter implements Counter {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    }

    private static final class NoOpTimer implements Timer {
        public void record(Duration duration) {}
        public long count() { return 0L; }
        public Duration total() { return Duration.ZERO; }
        public Duration max() { return Duration.ZERO; }
    }
}
