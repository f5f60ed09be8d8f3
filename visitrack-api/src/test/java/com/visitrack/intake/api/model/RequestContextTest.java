package com.visitrack.intake.api.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextTest {

    @Test
    void shouldApplyDefaults() {
        RequestContext context = RequestContext.builder().build();

        assertThat(context.method()).isEqualTo("GET");
        assertThat(context.path()).isEqualTo("/");
        assertThat(context.remoteAddress()).isEmpty();
        assertThat(context.requestFrequency()).isEmpty();
        assertThat(context.userAgent()).isNull();
    }

    @Test
    void shouldUpperCaseMethodAndParseAddress() {
        RequestContext context = RequestContext.builder()
                .method("post")
                .path("/checkout")
                .header("User-Agent", "curl/8.4.0")
                .remoteAddress("2001:db8::1")
                .requestFrequency(12)
                .scheme("HTTPS")
                .build();

        assertThat(context.method()).isEqualTo("POST");
        assertThat(context.userAgent()).isEqualTo("curl/8.4.0");
        assertThat(context.remoteAddress()).isPresent();
        assertThat(context.requestFrequency().getAsDouble()).isEqualTo(12.0);
        assertThat(context.scheme()).contains("https");
    }

    @Test
    void shouldLeaveUnparsableAddressAbsent() {
        RequestContext context = RequestContext.builder()
                .remoteAddress("not-an-address")
                .build();

        assertThat(context.remoteAddress()).isEmpty();
    }

    @Test
    void shouldIgnoreNonFiniteFrequency() {
        RequestContext context = RequestContext.builder()
                .requestFrequency(Double.NaN)
                .build();

        assertThat(context.requestFrequency()).isEmpty();
    }
}
