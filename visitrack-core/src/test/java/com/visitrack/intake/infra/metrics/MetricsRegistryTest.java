package com.visitrack.intake.infra.metrics;

import com.visitrack.intake.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.visitrack.intake.infra.metrics.internal.NoOpMetricsRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsRegistryTest {

    @Test
    void serviceLoaderPicksInMemoryProviderOnTestClasspath() {
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    void countersAreKeyedByNameAndTags() {
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

        metrics.counter("intake_blocked_total", "reason", "STATIC_ASSET").increment();
        metrics.counter("intake_blocked_total", "reason", "STATIC_ASSET").increment(2);
        metrics.counter("intake_blocked_total", "reason", "METHOD_EXCLUDED").increment();

        assertThat(metrics.getCounterValue("intake_blocked_total", "reason", "STATIC_ASSET")).isEqualTo(3L);
        assertThat(metrics.getCounterValue("intake_blocked_total", "reason", "METHOD_EXCLUDED")).isEqualTo(1L);
        assertThat(metrics.getCounterValue("intake_blocked_total")).isZero();
    }

    @Test
    void tagOrderDoesNotSplitSeries() {
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

        metrics.counter("intake_blocked_total", "reason", "STATIC_ASSET", "tenant", "acme").increment();
        metrics.counter("intake_blocked_total", "tenant", "acme", "reason", "STATIC_ASSET").increment();

        assertThat(metrics.getCounterValue("intake_blocked_total", "tenant", "acme", "reason", "STATIC_ASSET"))
                .isEqualTo(2L);
    }

    @Test
    void timerKeepsCountTotalAndMax() {
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
        Timer timer = metrics.timer("intake_pipeline_latency");
        for (int i = 1; i <= 100; i++) {
            timer.record(Duration.ofMillis(i));
        }

        assertThat(timer.count()).isEqualTo(100L);
        assertThat(timer.total()).isEqualTo(Duration.ofMillis(5050));
        assertThat(timer.max()).isEqualTo(Duration.ofMillis(100));
        assertThat(timer.mean()).isEqualTo(Duration.ofNanos(50_500_000));
        assertThat(metrics.getTimerCount("intake_pipeline_latency")).isEqualTo(100L);
    }

    @Test
    void emptyTimerReportsZero() {
        Timer timer = new InMemoryMetricsRegistry().timer("intake_pipeline_latency");

        assertThat(timer.max()).isEqualTo(Duration.ZERO);
        assertThat(timer.mean()).isEqualTo(Duration.ZERO);
    }

    @Test
    void oddTagListIsRejected() {
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

        assertThatThrownBy(() -> metrics.counter("intake_blocked_total", "reason"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetClearsEverything() {
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
        metrics.counter("intake_requests_total").increment();

        metrics.reset();

        assertThat(metrics.getCounterValue("intake_requests_total")).isZero();
    }

    @Test
    void noOpRegistryAcceptsEverything() {
        MetricsRegistry noop = NoOpMetricsRegistry.INSTANCE;

        noop.counter("anything", "k", "v").increment();
        noop.timer("anything").recordNanos(10);

        assertThat(noop.counter("anything").count()).isZero();
    }
}
