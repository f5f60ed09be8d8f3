package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.runtime.privacy.PrivacyEngine;
import com.visitrack.intake.util.CidrMatcher;

import java.net.InetAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Last-resort country lookup over a small table of well-known public ranges.
 */
final class StaticAddressLocator {

    private static final Map<CidrMatcher, String> RANGES = new LinkedHashMap<>();

    static {
        RANGES.put(CidrMatcher.from(List.of("8.8.8.0/24", "8.8.4.0/24", "208.67.222.0/24")), "US");
        RANGES.put(CidrMatcher.from(List.of("1.1.1.0/24", "1.0.0.0/24")), "AU");
        RANGES.put(CidrMatcher.from(List.of("9.9.9.0/24")), "CH");
    }

    private StaticAddressLocator() {
    }

    static Optional<String> countryOf(InetAddress address) {
        if (address == null || PrivacyEngine.isPrivateAddress(address)) {
            return Optional.empty();
        }
        for (Map.Entry<CidrMatcher, String> entry : RANGES.entrySet()) {
            if (entry.getKey().matches(address)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
