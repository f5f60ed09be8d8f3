package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.model.AnonymizationLevel;
import com.visitrack.intake.api.model.GeoProvider;
import com.visitrack.intake.api.model.GeoResult;
import com.visitrack.intake.api.model.PrecisionLevel;
import com.visitrack.intake.api.model.ProxyType;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.RequestHeaders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyGeoResolverTest {

    private static final RequestHeaders CLOUDFLARE = RequestHeaders.of(
            "CF-IPCountry", "us",
            "CF-Region", "California",
            "CF-IPCity", "San Francisco",
            "CF-IPLatitude", "37.7749",
            "CF-IPLongitude", "-122.4194",
            "CF-Timezone", "America/Los_Angeles",
            "CF-Connecting-IP", "203.0.113.7");

    private final ProxyGeoResolver resolver = new ProxyGeoResolver(IntakeConfig.defaults());

    @Test
    void cloudflareHeadersResolveAtFullPrecision() {
        GeoResult result = resolver.resolve(CLOUDFLARE, PrecisionLevel.FULL, false);

        assertThat(result.provider()).isEqualTo(GeoProvider.CLOUDFLARE);
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.countryCode()).isEqualTo("US");
        assertThat(result.countryName()).isEqualTo("United States");
        assertThat(result.region()).isEqualTo("California");
        assertThat(result.city()).isEqualTo("San Francisco");
        assertThat(result.latitude()).isEqualTo(37.7749);
        assertThat(result.longitude()).isEqualTo(-122.4194);
        assertThat(result.timezone()).isEqualTo("America/Los_Angeles");
        assertThat(result.anonymizedAddress()).isEqualTo("203.0.113.0");
    }

    @Nested
    @DisplayName("Precision")
    class Precision {

        @Test
        void cityDropsCoordinates() {
            GeoResult result = resolver.resolve(CLOUDFLARE, PrecisionLevel.CITY, false);

            assertThat(result.city()).isEqualTo("San Francisco");
            assertThat(result.hasCoordinates()).isFalse();
        }

        @Test
        void regionDropsCity() {
            GeoResult result = resolver.resolve(CLOUDFLARE, PrecisionLevel.REGION, false);

            assertThat(result.region()).isEqualTo("California");
            assertThat(result.city()).isNull();
        }

        @Test
        void countryKeepsOnlyCountry() {
            GeoResult result = resolver.resolve(CLOUDFLARE, PrecisionLevel.COUNTRY, false);

            assertThat(result.countryCode()).isEqualTo("US");
            assertThat(result.region()).isNull();
            assertThat(result.city()).isNull();
            assertThat(result.latitude()).isNull();
        }

        @Test
        @DisplayName("Privacy mode caps at country and anonymizes even when configured not to")
        void privacyModeCapsPrecision() {
            ProxyGeoResolver open = new ProxyGeoResolver(IntakeConfig.builder()
                    .anonymizeAddressLevel(AnonymizationLevel.NONE).build());

            GeoResult result = open.resolve(CLOUDFLARE, PrecisionLevel.FULL, true);

            assertThat(result.countryCode()).isEqualTo("US");
            assertThat(result.city()).isNull();
            assertThat(result.hasCoordinates()).isFalse();
            assertThat(result.anonymizedAddress()).isEqualTo("203.0.113.0");
        }

        @Test
        void anonymizationNoneKeepsAddressOutsidePrivacyMode() {
            ProxyGeoResolver open = new ProxyGeoResolver(IntakeConfig.builder()
                    .anonymizeAddressLevel(AnonymizationLevel.NONE).build());

            assertThat(open.resolve(CLOUDFLARE, PrecisionLevel.COUNTRY, false).anonymizedAddress())
                    .isEqualTo("203.0.113.7");
        }
    }

    @Nested
    @DisplayName("Provider selection")
    class Providers {

        @Test
        void placeholderCountryFallsThroughToNextProvider() {
            RequestHeaders headers = RequestHeaders.of("cf-ipcountry", "XX", "x-country-code", "de");

            GeoResult result = resolver.resolve(headers, PrecisionLevel.CITY, false);

            assertThat(result.provider()).isEqualTo(GeoProvider.GENERIC);
            assertThat(result.confidence()).isEqualTo(0.70);
            assertThat(result.countryCode()).isEqualTo("DE");
            assertThat(result.timezone()).isEqualTo("Europe/Berlin");
        }

        @Test
        void torPlaceholderIsRejected() {
            assertThat(resolver.resolve(RequestHeaders.of("cf-ipcountry", "T1"), PrecisionLevel.CITY, false)
                    .hasLocation()).isFalse();
        }

        @Test
        void configuredPriorityIsRespected() {
            RequestHeaders headers = RequestHeaders.of(
                    "cf-ipcountry", "US",
                    "x-vercel-ip-country", "CA",
                    "x-vercel-ip-city", "Toronto");
            ProxyGeoResolver vercelFirst = new ProxyGeoResolver(IntakeConfig.builder()
                    .providerPriority(List.of(GeoProvider.VERCEL, GeoProvider.CLOUDFLARE)).build());

            GeoResult result = vercelFirst.resolve(headers, PrecisionLevel.CITY, false);

            assertThat(result.provider()).isEqualTo(GeoProvider.VERCEL);
            assertThat(result.countryCode()).isEqualTo("CA");
            assertThat(result.city()).isEqualTo("Toronto");
        }

        @Test
        void providersOutsidePriorityAreIgnored() {
            ProxyGeoResolver fastlyOnly = new ProxyGeoResolver(IntakeConfig.builder()
                    .providerPriority(List.of(GeoProvider.FASTLY)).build());

            assertThat(fastlyOnly.resolve(CLOUDFLARE, PrecisionLevel.CITY, false).provider())
                    .isNotEqualTo(GeoProvider.CLOUDFLARE);
        }

        @Test
        void cloudfrontHeaders() {
            RequestHeaders headers = RequestHeaders.of(
                    "CloudFront-Viewer-Country", "FR",
                    "CloudFront-Viewer-City", "Paris",
                    "CloudFront-Viewer-Time-Zone", "Europe/Paris");

            GeoResult result = resolver.resolve(headers, PrecisionLevel.CITY, false);

            assertThat(result.provider()).isEqualTo(GeoProvider.CLOUDFRONT);
            assertThat(result.city()).isEqualTo("Paris");
            assertThat(result.countryName()).isEqualTo("France");
        }

        @Test
        void flyRegionIsMappedToCountry() {
            RequestHeaders headers = RequestHeaders.of("fly-region", "lhr", "fly-client-ip", "198.51.100.23");

            GeoResult result = resolver.resolve(headers, PrecisionLevel.REGION, false);

            assertThat(result.provider()).isEqualTo(GeoProvider.FLY_IO);
            assertThat(result.countryCode()).isEqualTo("GB");
            assertThat(result.region()).isEqualTo("lhr");
            assertThat(result.anonymizedAddress()).isEqualTo("198.51.100.0");
        }

        @Test
        void unknownFlyRegionDoesNotMatch() {
            assertThat(resolver.resolve(RequestHeaders.of("fly-region", "zzz"), PrecisionLevel.CITY, false)
                    .provider()).isEqualTo(GeoProvider.NONE);
        }

        @Test
        void outOfRangeCoordinatesAreDiscardedTogether() {
            RequestHeaders headers = RequestHeaders.of(
                    "cf-ipcountry", "US", "cf-iplatitude", "95.0", "cf-iplongitude", "10.0");

            GeoResult result = resolver.resolve(headers, PrecisionLevel.FULL, false);

            assertThat(result.latitude()).isNull();
            assertThat(result.longitude()).isNull();
        }

        @ParameterizedTest
        @ValueSource(strings = {"gb", " fr ", "USA", "U1", "12", "", "ÜS"})
        void countryCodeIsAlwaysTwoUppercaseLetters(String raw) {
            GeoResult result = resolver.resolve(RequestHeaders.of("x-country", raw), PrecisionLevel.CITY, false);

            if (result.countryCode() != null) {
                assertThat(result.countryCode()).matches("^[A-Z]{2}$");
            }
        }
    }

    @Nested
    @DisplayName("Address fallback")
    class AddressFallback {

        @Test
        void publicResolverAddressIsLookedUp() {
            RequestContext context = RequestContext.builder().remoteAddress("8.8.8.8").build();

            GeoResult result = resolver.resolve(context, PrecisionLevel.CITY, false);

            assertThat(result.provider()).isEqualTo(GeoProvider.ADDRESS_LOOKUP);
            assertThat(result.confidence()).isEqualTo(0.40);
            assertThat(result.countryCode()).isEqualTo("US");
            assertThat(result.anonymizedAddress()).isEqualTo("8.8.8.0");
        }

        @Test
        void privateAddressNeverResolves() {
            RequestContext context = RequestContext.builder().remoteAddress("10.1.2.3").build();

            GeoResult result = resolver.resolve(context, PrecisionLevel.CITY, false);

            assertThat(result.provider()).isEqualTo(GeoProvider.NONE);
            assertThat(result.confidence()).isZero();
            assertThat(result.hasLocation()).isFalse();
        }

        @Test
        void nothingKnownGivesEmptyResult() {
            assertThat(resolver.resolve(RequestHeaders.EMPTY, PrecisionLevel.FULL, false))
                    .isEqualTo(GeoResult.empty().withProxyType(ProxyType.DIRECT));
        }

        @Test
        void forwardedAddressIsUsedForLookup() {
            RequestContext context = RequestContext.builder()
                    .header("X-Forwarded-For", "1.1.1.1, 10.0.0.1")
                    .remoteAddress("10.0.0.1")
                    .build();

            assertThat(resolver.resolve(context, PrecisionLevel.CITY, false).countryCode()).isEqualTo("AU");
        }
    }

    @Nested
    @DisplayName("Trusted proxies")
    class TrustedProxies {

        private final ProxyGeoResolver guarded = new ProxyGeoResolver(IntakeConfig.builder()
                .trustedProxies(List.of("10.0.0.0/8"))
                .build());

        @Test
        void forwardingHeadersIgnoredFromUntrustedPeer() {
            RequestContext context = RequestContext.builder()
                    .headers(CLOUDFLARE)
                    .remoteAddress("198.51.100.9")
                    .build();

            assertThat(guarded.resolve(context, PrecisionLevel.COUNTRY, false).anonymizedAddress())
                    .isEqualTo("198.51.100.0");
        }

        @Test
        void forwardingHeadersHonouredFromTrustedPeer() {
            RequestContext context = RequestContext.builder()
                    .headers(CLOUDFLARE)
                    .remoteAddress("10.0.0.5")
                    .build();

            assertThat(guarded.resolve(context, PrecisionLevel.COUNTRY, false).anonymizedAddress())
                    .isEqualTo("203.0.113.0");
        }
    }

    @Nested
    @DisplayName("Proxy heuristics")
    class Heuristics {

        @Test
        void viaHeaderSignalsProxy() {
            assertThat(resolver.resolve(RequestHeaders.of("via", "1.1 proxy"), PrecisionLevel.CITY, false)
                    .proxyDetected()).isTrue();
        }

        @Test
        void multiHopForwardingChainSignalsProxy() {
            RequestHeaders headers = RequestHeaders.of("x-forwarded-for", "203.0.113.7, 198.51.100.1");

            assertThat(resolver.resolve(headers, PrecisionLevel.CITY, false).proxyDetected()).isTrue();
        }

        @Test
        void singleHopIsNotAProxy() {
            RequestHeaders headers = RequestHeaders.of("x-forwarded-for", "203.0.113.7");

            assertThat(resolver.resolve(headers, PrecisionLevel.CITY, false).proxyDetected()).isFalse();
        }

        @Test
        void detectionCanBeDisabled() {
            ProxyGeoResolver quiet = new ProxyGeoResolver(IntakeConfig.builder().detectVpn(false).build());

            assertThat(quiet.resolve(RequestHeaders.of("via", "1.1 proxy"), PrecisionLevel.CITY, false)
                    .proxyDetected()).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "cf-ray, 8a1b2c3d4e5f-LHR, CLOUDFLARE",
                "cloudfront-viewer-country, DE, AWS_CLOUDFRONT",
                "x-real-ip, 203.0.113.7, NGINX",
                "x-forwarded-for, 203.0.113.7, GENERIC_PROXY",
                "user-agent, curl/8.0, DIRECT"
        })
        void proxyTypeFollowsTheEdgeHeaders(String header, String value, ProxyType expected) {
            GeoResult result = resolver.resolve(RequestHeaders.of(header, value), PrecisionLevel.CITY, false);

            assertThat(result.proxyType()).isEqualTo(expected);
        }

        @Test
        void forwardedForWithProtoIsLoadBalancer() {
            RequestHeaders headers = RequestHeaders.of(
                    "x-forwarded-for", "203.0.113.7",
                    "x-forwarded-proto", "https",
                    "x-real-ip", "203.0.113.7");

            assertThat(ProxyHeuristics.detectProxyType(headers)).isEqualTo(ProxyType.AWS_ALB);
        }

        @Test
        void cloudflareWinsOverForwardingHeaders() {
            RequestHeaders headers = RequestHeaders.of(
                    "x-forwarded-for", "203.0.113.7",
                    "x-forwarded-proto", "https",
                    "cf-connecting-ip", "203.0.113.7");

            assertThat(ProxyHeuristics.detectProxyType(headers)).isEqualTo(ProxyType.CLOUDFLARE);
        }
    }
}
