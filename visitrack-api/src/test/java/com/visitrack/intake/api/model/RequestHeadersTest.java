package com.visitrack.intake.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestHeadersTest {

    @Test
    @DisplayName("Lookups ignore header name case")
    void shouldLookUpCaseInsensitively() {
        RequestHeaders headers = RequestHeaders.of("CF-IPCountry", "DE");

        assertThat(headers.value("cf-ipcountry")).isEqualTo("DE");
        assertThat(headers.first("CF-IPCOUNTRY")).contains("DE");
        assertThat(headers.contains("Cf-IpCountry")).isTrue();
        assertThat(headers.names()).containsExactly("cf-ipcountry");
    }

    @Test
    @DisplayName("First value wins when a header repeats with different case")
    void shouldKeepFirstValue() {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("X-Forwarded-For", "203.0.113.7");
        raw.put("x-forwarded-for", "198.51.100.1");

        RequestHeaders headers = RequestHeaders.of(raw);

        assertThat(headers.value("x-forwarded-for")).isEqualTo("203.0.113.7");
        assertThat(headers.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Blank values read as absent but the header is still present")
    void shouldTreatBlankAsAbsent() {
        RequestHeaders headers = RequestHeaders.of("accept-language", "   ");

        assertThat(headers.first("accept-language")).isEmpty();
        assertThat(headers.contains("accept-language")).isTrue();
    }

    @Test
    @DisplayName("Null names and values are skipped")
    void shouldSkipNulls() {
        RequestHeaders headers = RequestHeaders.builder()
                .add(null, "x")
                .add("via", null)
                .build();

        assertThat(headers.isEmpty()).isTrue();
        assertThat(headers.value(null)).isNull();
    }

    @Test
    void shouldRejectOddNameValueList() {
        assertThatThrownBy(() -> RequestHeaders.of("a", "1", "b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString does not leak header values")
    void shouldNotPrintValues() {
        RequestHeaders headers = RequestHeaders.of("authorization", "Bearer secret");

        assertThat(headers.toString()).doesNotContain("secret");
    }
}
