package com.visitrack.intake.infra.metrics.api;

import com.visitrack.intake.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations need a public no-arg constructor and are registered in
 * {@code META-INF/services/com.visitrack.intake.infra.metrics.api.MetricsRegistryProvider}.
 * When several are present the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    /**
     * @return registry instance (must be thread-safe)
     */
    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
