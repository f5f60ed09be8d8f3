package com.visitrack.intake.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Maximum geographic granularity allowed in a result, coarsest first.
 */
public enum PrecisionLevel {
    COUNTRY,
    REGION,
    CITY,
    FULL;

    public boolean includesRegion() {
        return this.compareTo(REGION) >= 0;
    }

    public boolean includesCity() {
        return this.compareTo(CITY) >= 0;
    }

    public boolean includesCoordinates() {
        return this == FULL;
    }

    /**
     * The coarser of this level and {@code cap}.
     */
    public PrecisionLevel atMost(PrecisionLevel cap) {
        return this.compareTo(cap) <= 0 ? this : cap;
    }

    public static Optional<PrecisionLevel> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
