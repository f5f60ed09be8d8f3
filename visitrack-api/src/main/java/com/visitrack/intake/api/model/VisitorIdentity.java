package com.visitrack.intake.api.model;

import java.util.regex.Pattern;

/**
 * Cookie-free visitor identity: {@code fp_} followed by 16 lowercase hex characters.
 */
public record VisitorIdentity(String value) {

    public static final String PREFIX = "fp_";
    private static final Pattern FORMAT = Pattern.compile("^fp_[0-9a-f]{16}$");

    public VisitorIdentity {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Malformed visitor identity: " + value);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
