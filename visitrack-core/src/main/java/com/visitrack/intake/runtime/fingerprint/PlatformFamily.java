package com.visitrack.intake.runtime.fingerprint;

/**
 * Coarse operating-system family derived from a user agent.
 */
public enum PlatformFamily {
    IOS("iOS"),
    ANDROID("Android"),
    WINDOWS("Windows"),
    MACOS("macOS"),
    LINUX("Linux"),
    UNKNOWN("Unknown");

    private final String label;

    PlatformFamily(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Mobile platforms are checked first: their agents also contain
     * {@code Linux} or {@code Mac OS X}.
     */
    public static PlatformFamily detect(String userAgent) {
        if (userAgent == null || userAgent.isEmpty()) {
            return UNKNOWN;
        }
        if (userAgent.contains("iPhone") || userAgent.contains("iPad") || userAgent.contains("iPod")) {
            return IOS;
        }
        if (userAgent.contains("Android")) {
            return ANDROID;
        }
        if (userAgent.contains("Windows")) {
            return WINDOWS;
        }
        if (userAgent.contains("Mac OS") || userAgent.contains("Macintosh") || userAgent.contains("macOS")) {
            return MACOS;
        }
        if (userAgent.contains("Linux")) {
            return LINUX;
        }
        return UNKNOWN;
    }
}
