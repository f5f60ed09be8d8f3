package com.visitrack.intake.util;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CidrMatcherTest {

    private static InetAddress ip(String literal) {
        return AddressLiterals.parse(literal).orElseThrow();
    }

    @Test
    void shouldMatchIpv4Blocks() {
        CidrMatcher matcher = CidrMatcher.from(List.of("66.249.0.0/16", "69.63.176.0/24"));

        assertThat(matcher.matches(ip("66.249.66.1"))).isTrue();
        assertThat(matcher.matches(ip("69.63.176.200"))).isTrue();
        assertThat(matcher.matches(ip("69.63.177.1"))).isFalse();
        assertThat(matcher.size()).isEqualTo(2);
    }

    @Test
    void shouldMatchNonOctetPrefix() {
        CidrMatcher matcher = CidrMatcher.from(List.of("172.16.0.0/12"));

        assertThat(matcher.matches(ip("172.31.255.255"))).isTrue();
        assertThat(matcher.matches(ip("172.32.0.0"))).isFalse();
    }

    @Test
    void shouldMatchIpv6AndNotCrossFamilies() {
        CidrMatcher matcher = CidrMatcher.from(List.of("2001:db8::/32"));

        assertThat(matcher.matches(ip("2001:db8:1::5"))).isTrue();
        assertThat(matcher.matches(ip("2001:db9::1"))).isFalse();
        assertThat(matcher.matches(ip("32.1.13.184"))).isFalse();
    }

    @Test
    void shouldTreatBareAddressAsSingleHost() {
        CidrMatcher matcher = CidrMatcher.from(List.of("10.0.0.5"));

        assertThat(matcher.matches(ip("10.0.0.5"))).isTrue();
        assertThat(matcher.matches(ip("10.0.0.6"))).isFalse();
    }

    @Test
    void shouldRejectInvalidEntries() {
        assertThatThrownBy(() -> CidrMatcher.from(List.of("10.0.0.0/33")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> CidrMatcher.from(List.of("proxy.internal/8")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyMatcherMatchesNothing() {
        assertThat(CidrMatcher.from(null).isEmpty()).isTrue();
        assertThat(CidrMatcher.empty().matches(ip("1.1.1.1"))).isFalse();
    }
}
