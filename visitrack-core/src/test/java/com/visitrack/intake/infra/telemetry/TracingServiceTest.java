package com.visitrack.intake.infra.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @Test
    void noopServiceNeverRecords() {
        TracingService service = TracingService.noop();

        Span span = service.getTracer().spanBuilder("compile-rule-set").startSpan();
        try {
            assertThat(service.isEnabled()).isFalse();
            assertThat(span.isRecording()).isFalse();
        } finally {
            span.end();
        }
        service.shutdown();
    }

    @Test
    void singletonIsStable() {
        assertThat(TracingService.getInstance()).isSameAs(TracingService.getInstance());
        assertThat(TracingService.getInstance().getTracer()).isNotNull();
    }
}
