/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Privacy-bounded location of a request.
 *
 * <p>All descriptive fields are nullable. The canonical constructor enforces the
 * result invariants instead of rejecting input:
 * <ul>
 *   <li>{@code countryCode} is either null or two uppercase ASCII letters; anything
 *       else is dropped</li>
 *   <li>coordinates are kept only as a valid pair; one missing or out-of-range
 *       value discards both</li>
 *   <li>{@code confidence} is clamped to [0, 0.99]</li>
 * </ul>
 * {@code proxyType} names the edge layer the headers point to; it is null when
 * resolution did not get that far.
 */
public record GeoResult(
        String countryCode,
        String countryName,
        String region,
        String city,
        Double latitude,
        Double longitude,
        String timezone,
        GeoProvider provider,
        double confidence,
        String anonymizedAddress,
        boolean proxyDetected,
        ProxyType proxyType
) {
    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Z]{2}$");

    private static final GeoResult EMPTY =
            new GeoResult(null, null, null, null, null, null, null, GeoProvider.NONE, 0.0, null, false, null);

    public GeoResult {
        countryCode = normalizeCountryCode(countryCode);
        countryName = blankToNull(countryName);
        region = blankToNull(region);
        city = blankToNull(city);
        timezone = blankToNull(timezone);
        if (!validCoordinates(latitude, longitude)) {
            latitude = null;
            longitude = null;
        }
        if (provider == null) {
            provider = GeoProvider.NONE;
        }
        confidence = ClassificationResult.clamp(confidence);
    }

    /**
     * No location, provider {@link GeoProvider#NONE}, confidence 0.
     */
    public static GeoResult empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasLocation() {
        return countryCode != null;
    }

    public boolean hasCoordinates() {
        return latitude != null;
    }

    /**
     * Clears the fields the given level does not permit.
     */
    public GeoResult withPrecision(PrecisionLevel level) {
        boolean keepRegion = level.includesRegion();
        boolean keepCity = level.includesCity();
        boolean keepCoordinates = level.includesCoordinates();
        return new GeoResult(countryCode, countryName,
                keepRegion ? region : null,
                keepCity ? city : null,
                keepCoordinates ? latitude : null,
                keepCoordinates ? longitude : null,
                timezone, provider, confidence, anonymizedAddress, proxyDetected, proxyType);
    }

    public GeoResult withAnonymizedAddress(String address) {
        return new GeoResult(countryCode, countryName, region, city, latitude, longitude,
                timezone, provider, confidence, address, proxyDetected, proxyType);
    }

    public GeoResult withProxyDetected(boolean detected) {
        return new GeoResult(countryCode, countryName, region, city, latitude, longitude,
                timezone, provider, confidence, anonymizedAddress, detected, proxyType);
    }

    public GeoResult withProxyType(ProxyType type) {
        return new GeoResult(countryCode, countryName, region, city, latitude, longitude,
                timezone, provider, confidence, anonymizedAddress, proxyDetected, type);
    }

    public static boolean isValidCountryCode(String code) {
        return code != null && COUNTRY_CODE.matcher(code).matches();
    }

    static String normalizeCountryCode(String raw) {
        if (raw == null) {
            return null;
        }
        String code = raw.trim().toUpperCase(Locale.ROOT);
        return isValidCountryCode(code) ? code : null;
    }

    private static boolean validCoordinates(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return false;
        }
        return latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private String countryCode;
        private String countryName;
        private String region;
        private String city;
        private Double latitude;
        private Double longitude;
        private String timezone;
        private GeoProvider provider = GeoProvider.NONE;
        private double confidence;
        private String anonymizedAddress;
        private boolean proxyDetected;
        private ProxyType proxyType;

        private Builder() {
        }

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Builder countryName(String countryName) {
            this.countryName = countryName;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder coordinates(Double latitude, Double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        /**
         * Sets the provider and its fixed confidence.
         */
        public Builder provider(GeoProvider provider) {
            this.provider = provider;
            this.confidence = provider.confidence();
            return this;
        }

        public Builder anonymizedAddress(String anonymizedAddress) {
            this.anonymizedAddress = anonymizedAddress;
            return this;
        }

        public Builder proxyDetected(boolean proxyDetected) {
            this.proxyDetected = proxyDetected;
            return this;
        }

        public Builder proxyType(ProxyType proxyType) {
            this.proxyType = proxyType;
            return this;
        }

        public GeoResult build() {
            return new GeoResult(countryCode, countryName, region, city, latitude, longitude,
                    timezone, provider, confidence, anonymizedAddress, proxyDetected, proxyType);
        }
    }
}
