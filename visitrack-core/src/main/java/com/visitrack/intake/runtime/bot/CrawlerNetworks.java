package com.visitrack.intake.runtime.bot;

import com.visitrack.intake.util.CidrMatcher;

import java.util.List;

/**
 * Address ranges operated by well-known crawlers.
 */
public final class CrawlerNetworks {

    public static final List<String> DEFAULT_RANGES = List.of(
            "66.249.0.0/16",   // Google
            "207.46.0.0/16",   // Microsoft
            "69.63.176.0/24",  // Facebook
            "69.171.0.0/16"    // Facebook
    );

    private static final CidrMatcher DEFAULT = CidrMatcher.from(DEFAULT_RANGES);

    private CrawlerNetworks() {
    }

    public static CidrMatcher defaults() {
        return DEFAULT;
    }
}
