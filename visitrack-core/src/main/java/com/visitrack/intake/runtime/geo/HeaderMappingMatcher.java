package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.model.GeoProvider;
import com.visitrack.intake.api.model.GeoResult;
import com.visitrack.intake.api.model.RequestHeaders;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Matcher driven by a fixed header-name mapping. For fields with several
 * candidate headers the first present one is used.
 */
final class HeaderMappingMatcher implements GeoHeaderMatcher {

    // Cloudflare placeholders for unknown and Tor traffic
    private static final Set<String> PLACEHOLDER_COUNTRIES = Set.of("XX", "T1");

    private final GeoProvider provider;
    private final List<String> countryHeaders;
    private final List<String> regionHeaders;
    private final List<String> cityHeaders;
    private final String latitudeHeader;
    private final String longitudeHeader;
    private final String timezoneHeader;
    private final String addressHeader;

    private HeaderMappingMatcher(Builder builder) {
        this.provider = builder.provider;
        this.countryHeaders = builder.countryHeaders;
        this.regionHeaders = builder.regionHeaders;
        this.cityHeaders = builder.cityHeaders;
        this.latitudeHeader = builder.latitudeHeader;
        this.longitudeHeader = builder.longitudeHeader;
        this.timezoneHeader = builder.timezoneHeader;
        this.addressHeader = builder.addressHeader;
    }

    static Builder forProvider(GeoProvider provider) {
        return new Builder(provider);
    }

    @Override
    public GeoProvider provider() {
        return provider;
    }

    @Override
    public Optional<GeoFields> tryExtract(RequestHeaders headers) {
        String country = normalizeCountry(firstPresent(headers, countryHeaders));
        if (country == null) {
            return Optional.empty();
        }
        return Optional.of(new GeoFields(
                country,
                firstPresent(headers, regionHeaders),
                firstPresent(headers, cityHeaders),
                parseCoordinate(value(headers, latitudeHeader)),
                parseCoordinate(value(headers, longitudeHeader)),
                value(headers, timezoneHeader),
                value(headers, addressHeader)));
    }

    static String normalizeCountry(String raw) {
        if (raw == null) {
            return null;
        }
        String code = raw.trim().toUpperCase(Locale.ROOT);
        if (!GeoResult.isValidCountryCode(code) || PLACEHOLDER_COUNTRIES.contains(code)) {
            return null;
        }
        return code;
    }

    private static String firstPresent(RequestHeaders headers, List<String> names) {
        for (String name : names) {
            String value = headers.value(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String value(RequestHeaders headers, String name) {
        return name == null ? null : headers.value(name);
    }

    private static Double parseCoordinate(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static final class Builder {
        private final GeoProvider provider;
        private List<String> countryHeaders = List.of();
        private List<String> regionHeaders = List.of();
        private List<String> cityHeaders = List.of();
        private String latitudeHeader;
        private String longitudeHeader;
        private String timezoneHeader;
        private String addressHeader;

        private Builder(GeoProvider provider) {
            this.provider = provider;
        }

        Builder country(String... names) {
            this.countryHeaders = List.of(names);
            return this;
        }

        Builder region(String... names) {
            this.regionHeaders = List.of(names);
            return this;
        }

        Builder city(String... names) {
            this.cityHeaders = List.of(names);
            return this;
        }

        Builder coordinates(String latitude, String longitude) {
            this.latitudeHeader = latitude;
            this.longitudeHeader = longitude;
            return this;
        }

        Builder timezone(String name) {
            this.timezoneHeader = name;
            return this;
        }

        Builder address(String name) {
            this.addressHeader = name;
            return this;
        }

        HeaderMappingMatcher build() {
            return new HeaderMappingMatcher(this);
        }
    }
}
