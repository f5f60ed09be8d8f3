package com.visitrack.intake.runtime.fingerprint;

import com.visitrack.intake.api.model.DeviceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceClassifierTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_1 like Mac OS X) AppleWebKit/605.1.15 Mobile/15E148 | MOBILE",
            "Mozilla/5.0 (Linux; Android 14; Pixel 8) AppleWebKit/537.36 Chrome/120.0 Mobile Safari/537.36 | MOBILE",
            "Mozilla/5.0 (iPad; CPU OS 17_1 like Mac OS X) AppleWebKit/605.1.15 Mobile/15E148 | TABLET",
            "Mozilla/5.0 (Linux; Android 13; SM-X710) AppleWebKit/537.36 Chrome/120.0 Safari/537.36 | TABLET",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 Chrome/120.0 Safari/537.36 | DESKTOP",
            "Mozilla/5.0 (X11; Linux x86_64; rv:121.0) Gecko/20100101 Firefox/121.0 | DESKTOP"
    })
    void detectsFormFactor(String userAgent, DeviceType expected) {
        assertThat(DeviceClassifier.detect(userAgent)).isEqualTo(expected);
    }

    @Test
    void missingAgentIsUnknown() {
        assertThat(DeviceClassifier.detect(null)).isEqualTo(DeviceType.UNKNOWN);
        assertThat(DeviceClassifier.detect("  ")).isEqualTo(DeviceType.UNKNOWN);
    }
}
