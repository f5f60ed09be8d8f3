package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.model.GeoProvider;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in header matchers per provider.
 */
public final class GeoMatchers {

    private static final Map<GeoProvider, GeoHeaderMatcher> BUILT_IN = new EnumMap<>(GeoProvider.class);

    static {
        register(HeaderMappingMatcher.forProvider(GeoProvider.CLOUDFLARE)
                .country("cf-ipcountry")
                .region("cf-region")
                .city("cf-ipcity", "cf-city")
                .coordinates("cf-iplatitude", "cf-iplongitude")
                .timezone("cf-timezone")
                .address("cf-connecting-ip")
                .build());
        register(HeaderMappingMatcher.forProvider(GeoProvider.FASTLY)
                .country("fastly-geoip-country-code")
                .region("fastly-geoip-region")
                .city("fastly-geoip-city")
                .address("fastly-client-ip")
                .build());
        register(HeaderMappingMatcher.forProvider(GeoProvider.CLOUDFRONT)
                .country("cloudfront-viewer-country")
                .region("cloudfront-viewer-country-region")
                .city("cloudfront-viewer-city")
                .coordinates("cloudfront-viewer-latitude", "cloudfront-viewer-longitude")
                .timezone("cloudfront-viewer-time-zone")
                .build());
        register(HeaderMappingMatcher.forProvider(GeoProvider.VERCEL)
                .country("x-vercel-ip-country")
                .region("x-vercel-ip-country-region")
                .city("x-vercel-ip-city")
                .coordinates("x-vercel-ip-latitude", "x-vercel-ip-longitude")
                .timezone("x-vercel-ip-timezone")
                .address("x-real-ip")
                .build());
        register(new FlyIoRegionMatcher());
        register(HeaderMappingMatcher.forProvider(GeoProvider.GENERIC)
                .country("x-country-code", "x-country")
                .region("x-region", "x-state")
                .city("x-city")
                .build());
    }

    private GeoMatchers() {
    }

    private static void register(GeoHeaderMatcher matcher) {
        BUILT_IN.put(matcher.provider(), matcher);
    }

    /**
     * Matchers in the given order. Providers without header matchers
     * ({@link GeoProvider#ADDRESS_LOOKUP}, {@link GeoProvider#NONE}) and
     * duplicates are skipped.
     */
    public static List<GeoHeaderMatcher> forPriority(List<GeoProvider> priority) {
        List<GeoHeaderMatcher> matchers = new ArrayList<>(priority.size());
        for (GeoProvider provider : priority) {
            GeoHeaderMatcher matcher = BUILT_IN.get(provider);
            if (matcher != null && !matchers.contains(matcher)) {
                matchers.add(matcher);
            }
        }
        return List.copyOf(matchers);
    }
}
