package com.visitrack.intake.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How much of a client address is zeroed before it leaves the pipeline.
 */
public enum AnonymizationLevel {
    /** Address kept as is */
    NONE,
    /** v4: last octet; v6: last 80 bits */
    PARTIAL,
    /** v4: last two octets; v6: last 112 bits */
    FULL;

    public AnonymizationLevel atLeast(AnonymizationLevel floor) {
        return this.compareTo(floor) >= 0 ? this : floor;
    }

    public static Optional<AnonymizationLevel> fromString(String value) {
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
