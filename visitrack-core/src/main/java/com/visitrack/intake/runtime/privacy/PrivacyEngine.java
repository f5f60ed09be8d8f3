/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.privacy;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.visitrack.intake.api.model.AnonymizationLevel;
import com.visitrack.intake.api.model.PiiCategory;
import com.visitrack.intake.util.AddressLiterals;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Address anonymization, salted hashing, PII scrubbing and the storage
 * compliance check.
 *
 * <p>Stateless; every method is a pure function of its arguments apart from
 * salt generation.
 */
public final class PrivacyEngine {

    public static final int DEFAULT_SALT_LENGTH = 32;
    static final int HASH_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final Pattern EMAIL =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE =
            Pattern.compile("(\\+\\d{1,3}\\s?)?\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}");
    private static final Pattern NATIONAL_ID = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern PAYMENT_CARD =
            Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b");
    private static final Pattern IP_ADDRESS =
            Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b");

    private static final Map<PiiCategory, Pattern> PII_PATTERNS = new EnumMap<>(PiiCategory.class);

    static {
        PII_PATTERNS.put(PiiCategory.EMAIL, EMAIL);
        PII_PATTERNS.put(PiiCategory.PHONE, PHONE);
        PII_PATTERNS.put(PiiCategory.NATIONAL_ID, NATIONAL_ID);
        PII_PATTERNS.put(PiiCategory.PAYMENT_CARD, PAYMENT_CARD);
        PII_PATTERNS.put(PiiCategory.IP_ADDRESS, IP_ADDRESS);
    }

    private static final List<String> TRACKING_PIXELS = List.of("pixel.gif", "beacon.png", "track.gif");

    private static final Pattern UA_VERSION = Pattern.compile("\\b\\d+\\.\\d+\\.\\d+(\\.\\d+)?\\b");
    private static final Pattern UA_LONG_TOKEN = Pattern.compile("\\b[A-Z0-9]{8,}\\b");
    private static final Pattern UA_DETAILS = Pattern.compile("\\(.+?\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PrivacyEngine() {
    }

    // ========================================================================
    // ADDRESSES
    // ========================================================================

    /**
     * Zeroes the host part of an address.
     *
     * <p>IPv4: PARTIAL clears the last octet, FULL the last two. IPv6: PARTIAL
     * clears the last 80 bits, FULL the last 112. Applying the same level twice
     * yields the same address.
     */
    public static InetAddress anonymizeAddress(InetAddress address, AnonymizationLevel level) {
        if (address == null || level == AnonymizationLevel.NONE) {
            return address;
        }
        byte[] bytes = address.getAddress();
        int keepBytes;
        if (address instanceof Inet4Address) {
            keepBytes = level == AnonymizationLevel.FULL ? 2 : 3;
        } else {
            keepBytes = level == AnonymizationLevel.FULL ? 2 : 6;
        }
        Arrays.fill(bytes, keepBytes, bytes.length, (byte) 0);
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            // Only thrown for an illegal length, which getAddress() never returns
            throw new IllegalStateException(e);
        }
    }

    /**
     * Text variant; returns canonical form, or the input unchanged when it is
     * not an IP literal or the level is NONE.
     */
    public static String anonymizeAddress(String address, AnonymizationLevel level) {
        if (address == null || level == AnonymizationLevel.NONE) {
            return address;
        }
        return AddressLiterals.parse(address)
                .map(parsed -> AddressLiterals.format(anonymizeAddress(parsed, level)))
                .orElse(address);
    }

    /**
     * One-way, salted hash of an address: SHA-256 over salt plus canonical
     * address text, Base64, first 16 characters.
     *
     * @param salt per-deployment salt; a random one is generated when null
     */
    public static String hashAddress(String address, String salt) {
        String effectiveSalt = salt == null ? generateSalt(DEFAULT_SALT_LENGTH) : salt;
        String canonical = AddressLiterals.parse(address)
                .map(AddressLiterals::format)
                .orElse(address == null ? "" : address.trim());
        byte[] digest = Hashing.sha256()
                .hashString(effectiveSalt + canonical, StandardCharsets.UTF_8)
                .asBytes();
        return BaseEncoding.base64().encode(digest).substring(0, HASH_LENGTH);
    }

    public static String hashAddress(InetAddress address, String salt) {
        return hashAddress(AddressLiterals.format(address), salt);
    }

    /**
     * Random Base64 salt of exactly {@code length} characters.
     */
    public static String generateSalt(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Salt length must be positive: " + length);
        }
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return BaseEncoding.base64().encode(bytes).substring(0, length);
    }

    /**
     * Loopback, RFC 1918, IPv6 link-local and unique-local addresses.
     */
    public static boolean isPrivateAddress(InetAddress address) {
        if (address == null) {
            return false;
        }
        byte[] b = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = b[0] & 0xff;
            int second = b[1] & 0xff;
            return first == 10
                    || first == 127
                    || (first == 172 && second >= 16 && second <= 31)
                    || (first == 192 && second == 168);
        }
        int first = b[0] & 0xff;
        int second = b[1] & 0xff;
        if (first == 0xfe && (second & 0xc0) == 0x80) {
            return true;
        }
        if ((first & 0xfe) == 0xfc) {
            return true;
        }
        return address.isLoopbackAddress();
    }

    public static boolean isPrivateAddress(String address) {
        return AddressLiterals.parse(address).map(PrivacyEngine::isPrivateAddress).orElse(false);
    }

    // ========================================================================
    // TEXT
    // ========================================================================

    /**
     * Categories of personal data found in the text, in declaration order.
     *
     * <p>A phone match lying wholly inside a payment card number is not
     * reported as a phone number.
     */
    public static Set<PiiCategory> detectPii(String text) {
        Set<PiiCategory> found = EnumSet.noneOf(PiiCategory.class);
        if (text == null || text.isEmpty()) {
            return found;
        }
        List<int[]> cardSpans = spans(PAYMENT_CARD, text);
        for (Map.Entry<PiiCategory, Pattern> entry : PII_PATTERNS.entrySet()) {
            if (entry.getKey() == PiiCategory.PHONE) {
                if (hasSpanOutside(spans(PHONE, text), cardSpans)) {
                    found.add(PiiCategory.PHONE);
                }
            } else if (entry.getValue().matcher(text).find()) {
                found.add(entry.getKey());
            }
        }
        return found;
    }

    private static List<int[]> spans(Pattern pattern, String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            spans.add(new int[]{matcher.start(), matcher.end()});
        }
        return spans;
    }

    private static boolean hasSpanOutside(List<int[]> spans, List<int[]> enclosing) {
        for (int[] span : spans) {
            boolean contained = false;
            for (int[] outer : enclosing) {
                if (outer[0] <= span[0] && span[1] <= outer[1]) {
                    contained = true;
                    break;
                }
            }
            if (!contained) {
                return true;
            }
        }
        return false;
    }

    // ========================================================================
    // COMPLIANCE
    // ========================================================================

    /**
     * Checks a visit against the storage rules. An empty set means the record
     * may be stored as is.
     */
    public static Set<PrivacyViolation> validateCompliance(VisitRecord record) {
        Set<PrivacyViolation> violations = EnumSet.noneOf(PrivacyViolation.class);
        if (record == null) {
            return violations;
        }
        if (record.address() != null && record.addressHash() == null) {
            violations.add(PrivacyViolation.RAW_ADDRESS);
        }
        if (!detectPii(record.userAgent()).isEmpty()) {
            violations.add(PrivacyViolation.PII_IN_USER_AGENT);
        }
        String path = record.path();
        if (path != null && TRACKING_PIXELS.stream().anyMatch(path::contains)) {
            violations.add(PrivacyViolation.TRACKING_PIXEL);
        }
        return violations;
    }

    public static String sanitize(String text) {
        return sanitize(text, '*', false);
    }

    /**
     * Masks every detected span character for character, so length and
     * surrounding text are preserved. Spans are collected from the original
     * text across all categories and merged where they overlap.
     *
     * @param preserveDomain mask only the local part of e-mail addresses
     */
    public static String sanitize(String text, char maskChar, boolean preserveDomain) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        List<int[]> spans = new ArrayList<>();
        for (Map.Entry<PiiCategory, Pattern> entry : PII_PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(text);
            while (matcher.find()) {
                int end = matcher.end();
                if (preserveDomain && entry.getKey() == PiiCategory.EMAIL) {
                    end = text.indexOf('@', matcher.start());
                }
                if (end > matcher.start()) {
                    spans.add(new int[]{matcher.start(), end});
                }
            }
        }
        if (spans.isEmpty()) {
            return text;
        }

        spans.sort(Comparator.comparingInt(span -> span[0]));
        char[] chars = text.toCharArray();
        int maskedUpTo = 0;
        for (int[] span : spans) {
            int from = Math.max(span[0], maskedUpTo);
            if (from < span[1]) {
                Arrays.fill(chars, from, span[1], maskChar);
                maskedUpTo = span[1];
            }
        }
        return new String(chars);
    }

    /**
     * Strips identifying detail from a user agent: version numbers become
     * {@code x.x.x}, long upper-case tokens {@code XXXXXXXX}, parenthesised
     * platform details are emptied and whitespace is collapsed.
     */
    public static String sanitizeUserAgent(String userAgent) {
        if (userAgent == null) {
            return null;
        }
        String sanitized = UA_VERSION.matcher(userAgent).replaceAll("x.x.x");
        sanitized = UA_LONG_TOKEN.matcher(sanitized).replaceAll("XXXXXXXX");
        sanitized = UA_DETAILS.matcher(sanitized).replaceAll("()");
        return WHITESPACE.matcher(sanitized).replaceAll(" ").trim();
    }
}
