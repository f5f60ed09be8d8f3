package com.visitrack.intake.runtime.admission;

import com.google.common.base.Utf8;
import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.model.BlockReason;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that run before any configured rule and cannot be overridden by one.
 */
final class BuiltInExclusions {

    static final List<String> STATIC_ASSET_PREFIXES = List.of("/assets/", "/images/", "/_live/");

    static final Set<String> HEALTH_PATHS = Set.of(
            "/health", "/healthz", "/ping", "/status", "/ready", "/live");

    static final Set<String> METRICS_PATHS = Set.of("/metrics", "/stats", "/telemetry");

    private final Set<String> excludeMethods;
    private final int maxPathLength;
    private final boolean excludeStaticAssets;
    private final List<String> excludeExtensions;

    BuiltInExclusions(IntakeConfig config) {
        this.excludeMethods = config.getExcludeMethods();
        this.maxPathLength = config.getMaxPathLength();
        this.excludeStaticAssets = config.isExcludeStaticAssets();
        this.excludeExtensions = config.getExcludeExtensions();
    }

    /**
     * @param method upper-cased method
     * @param path   request path without query string
     * @return the first exclusion that applies, or null
     */
    BlockReason check(String method, String path) {
        if (excludeMethods.contains(method)) {
            return BlockReason.METHOD_EXCLUDED;
        }
        if (byteLength(path) > maxPathLength) {
            return BlockReason.PATH_TOO_LONG;
        }
        if (excludeStaticAssets && isStaticAsset(path)) {
            return BlockReason.STATIC_ASSET;
        }
        if (HEALTH_PATHS.contains(path) || METRICS_PATHS.contains(path)) {
            return BlockReason.BUILT_IN_EXCLUSION;
        }
        return null;
    }

    private boolean isStaticAsset(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String extension : excludeExtensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        for (String prefix : STATIC_ASSET_PREFIXES) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private int byteLength(String path) {
        // Cheap exits: every char is at least one byte, at most three
        if (path.length() > maxPathLength) {
            return path.length();
        }
        if (path.length() * 3 <= maxPathLength) {
            return path.length();
        }
        try {
            return Utf8.encodedLength(path);
        } catch (IllegalArgumentException e) {
            // Unpaired surrogate
            return path.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
