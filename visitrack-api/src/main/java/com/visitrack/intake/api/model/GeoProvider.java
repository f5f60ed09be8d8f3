/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Source of a geographic result, each with a fixed confidence.
 */
public enum GeoProvider {
    CLOUDFLARE(0.95),
    FASTLY(0.90),
    CLOUDFRONT(0.90),
    VERCEL(0.85),
    FLY_IO(0.80),
    GENERIC(0.70),
    /** Static address table fallback */
    ADDRESS_LOOKUP(0.40),
    NONE(0.0);

    private final double confidence;

    GeoProvider(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }

    /**
     * Lenient lookup accepting {@code fly_io}, {@code fly-io} and {@code Fly.io} style names.
     */
    public static Optional<GeoProvider> fromString(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_');
        for (GeoProvider provider : values()) {
            if (provider.name().equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
