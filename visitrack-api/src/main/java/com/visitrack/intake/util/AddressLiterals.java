/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.util;

import com.google.common.net.InetAddresses;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Parses textual IP literals without ever touching DNS.
 *
 * <p>Accepts plain v4/v6 literals, bracketed v6 ({@code [2001:db8::1]}), and
 * v4/bracketed-v6 literals with a trailing port as found in forwarding headers.
 */
public final class AddressLiterals {

    private AddressLiterals() {
        throw new AssertionError("No instances");
    }

    /**
     * Parses an address literal.
     *
     * @param literal raw header or config value, may be null
     * @return parsed address, or empty when the value is not an IP literal
     */
    public static Optional<InetAddress> parse(String literal) {
        if (literal == null) {
            return Optional.empty();
        }
        String value = literal.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0) {
                return Optional.empty();
            }
            value = value.substring(1, close);
        } else if (value.indexOf(':') > 0 && value.indexOf(':') == value.lastIndexOf(':')
                && value.indexOf('.') > 0) {
            // v4 with port, e.g. 203.0.113.7:443
            value = value.substring(0, value.indexOf(':'));
        }

        // Zone ids (fe80::1%eth0) are not meaningful outside the host
        int zone = value.indexOf('%');
        if (zone > 0) {
            value = value.substring(0, zone);
        }

        if (!InetAddresses.isInetAddress(value)) {
            return Optional.empty();
        }
        return Optional.of(InetAddresses.forString(value));
    }

    /**
     * Canonical text form: dotted quad for v4, RFC 5952 compressed form for v6.
     */
    public static String format(InetAddress address) {
        return InetAddresses.toAddrString(address);
    }

    public static boolean isIpv6(InetAddress address) {
        return address instanceof Inet6Address;
    }
}
