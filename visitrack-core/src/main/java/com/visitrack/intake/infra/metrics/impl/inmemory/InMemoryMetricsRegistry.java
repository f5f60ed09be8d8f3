package com.visitrack.intake.infra.metrics.impl.inmemory;

import com.visitrack.intake.infra.metrics.Counter;
import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.infra.metrics.Timer;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for tests.
 *
 * <p>Metrics are keyed by name plus tags, so {@code counter("x", "reason", "A")}
 * and {@code counter("x", "reason", "B")} are distinct series. Tag order does
 * not matter.
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * IntakePipeline pipeline = new IntakePipeline(config, metrics);
 * pipeline.process(context);
 * assertThat(metrics.getCounterValue("intake_requests_total")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public long getTimerCount(String name, String... tags) {
        Timer timer = timers.get(key(name, tags));
        return timer != null ? timer.count() : 0L;
    }

    public void reset() {
        counters.clear();
        timers.clear();
    }

    private static String key(String name, String... tags) {
        if (tags == null || tags.length == 0) {
            return name;
        }
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs: " + String.join(",", tags));
        }
        Map<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < tags.length; i += 2) {
            sorted.put(tags[i], tags[i + 1]);
        }
        return name + sorted;
    }
}
