package com.visitrack.intake.infra.metrics.internal;

import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.infra.metrics.api.MetricsRegistryProvider;
import com.visitrack.intake.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryHolderTest {

    private static MetricsRegistryProvider provider(int priority, MetricsRegistry registry) {
        return new MetricsRegistryProvider() {
            @Override
            public MetricsRegistry create() {
                return registry;
            }

            @Override
            public int priority() {
                return priority;
            }
        };
    }

    @Test
    void highestPriorityProviderWins() {
        MetricsRegistry low = new InMemoryMetricsRegistry();
        MetricsRegistry high = new InMemoryMetricsRegistry();

        assertThat(MetricsRegistryHolder.select(List.of(provider(1, low), provider(5, high)))).isSameAs(high);
    }

    @Test
    void firstProviderKeptOnTie() {
        MetricsRegistry first = new InMemoryMetricsRegistry();
        MetricsRegistry second = new InMemoryMetricsRegistry();

        assertThat(MetricsRegistryHolder.select(List.of(provider(0, first), provider(0, second)))).isSameAs(first);
    }

    @Test
    void noProviderFallsBackToNoOp() {
        assertThat(MetricsRegistryHolder.select(List.of())).isSameAs(NoOpMetricsRegistry.INSTANCE);
    }

    @Test
    void processWideRegistryIsResolvedOnce() {
        assertThat(MetricsRegistryHolder.get()).isSameAs(MetricsRegistryHolder.get());
    }
}
