package com.visitrack.intake.runtime.privacy;

/**
 * Ways a visit record can break the privacy rules before it is stored.
 */
public enum PrivacyViolation {
    /** An address is present but no salted hash accompanies it. */
    RAW_ADDRESS,
    /** The user agent carries personal data. */
    PII_IN_USER_AGENT,
    /** The path targets a known tracking pixel or beacon. */
    TRACKING_PIXEL
}
