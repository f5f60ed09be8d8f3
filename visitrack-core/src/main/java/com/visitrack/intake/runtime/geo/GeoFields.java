package com.visitrack.intake.runtime.geo;

/**
 * Raw values one provider's headers yielded, before normalization and precision.
 *
 * @param countryCode   upper-cased two-letter code, always present
 * @param clientAddress the provider's view of the client address, may be null
 */
public record GeoFields(
        String countryCode,
        String region,
        String city,
        Double latitude,
        Double longitude,
        String timezone,
        String clientAddress
) {
}
