package com.visitrack.intake.infra.metrics;

import com.visitrack.intake.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; see
 * {@link com.visitrack.intake.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("intake_blocked_total", "reason", "STATIC_ASSET").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a latency timer.
     *
     * @param name metric name
     * @param tags optional key-value pairs
     * @return thread-safe timer instance
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry, falling back to a no-op registry when no
     * provider is installed.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.get();
    }
}
