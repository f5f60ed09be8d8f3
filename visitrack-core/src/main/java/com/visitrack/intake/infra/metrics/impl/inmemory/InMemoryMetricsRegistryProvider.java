package com.visitrack.intake.infra.metrics.impl.inmemory;

import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for tests.
 *
 * <p>Enabled by
 * {@code src/test/resources/META-INF/services/com.visitrack.intake.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
