package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.model.GeoProvider;
import com.visitrack.intake.api.model.RequestHeaders;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fly.io only reports the edge region the request entered through; the
 * country is derived from that region code.
 */
final class FlyIoRegionMatcher implements GeoHeaderMatcher {

    static final Map<String, String> REGION_COUNTRIES = Map.ofEntries(
            Map.entry("lax", "US"),
            Map.entry("ord", "US"),
            Map.entry("iad", "US"),
            Map.entry("sjc", "US"),
            Map.entry("ewr", "US"),
            Map.entry("dfw", "US"),
            Map.entry("sea", "US"),
            Map.entry("yyz", "CA"),
            Map.entry("lhr", "GB"),
            Map.entry("ams", "NL"),
            Map.entry("fra", "DE"),
            Map.entry("cdg", "FR"),
            Map.entry("nrt", "JP"),
            Map.entry("syd", "AU"),
            Map.entry("sin", "SG"),
            Map.entry("gru", "BR")
    );

    @Override
    public GeoProvider provider() {
        return GeoProvider.FLY_IO;
    }

    @Override
    public Optional<GeoFields> tryExtract(RequestHeaders headers) {
        String region = headers.value("fly-region");
        if (region == null) {
            return Optional.empty();
        }
        String regionCode = region.toLowerCase(Locale.ROOT);
        String country = REGION_COUNTRIES.get(regionCode);
        if (country == null) {
            return Optional.empty();
        }
        return Optional.of(new GeoFields(country, regionCode, null, null, null, null,
                headers.value("fly-client-ip")));
    }
}
