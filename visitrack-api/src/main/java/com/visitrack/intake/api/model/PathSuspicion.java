package com.visitrack.intake.api.model;

/**
 * Reasons a requested path looks like probing or automation rather than browsing.
 */
public enum PathSuspicion {
    /** Traversal, admin or config probing, script or SQL injection fragments */
    SECURITY_SCAN,
    /** Crawler-oriented endpoints such as sitemaps and feeds */
    BOT_BEHAVIOR,
    /** Double slashes, whitespace, control characters, oversized or badly encoded paths */
    MALFORMED,
    /** Paths produced by broken client code, e.g. {@code /undefined} or {@code /null} */
    ERROR_PRONE
}
