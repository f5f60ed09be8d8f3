/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, case-insensitive view of request headers.
 *
 * <p>Names are normalized to lower case ({@link Locale#ROOT}). When a header
 * occurs more than once only the first value is kept; later duplicates are
 * ignored rather than merged.
 */
public final class RequestHeaders {

    public static final RequestHeaders EMPTY = new RequestHeaders(Collections.emptyMap());

    private final Map<String, String> values;

    private RequestHeaders(Map<String, String> values) {
        this.values = values;
    }

    public static RequestHeaders of(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        headers.forEach(builder::add);
        return builder.build();
    }

    public static RequestHeaders of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " strings");
        }
        Builder builder = builder();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            builder.add(namesAndValues[i], namesAndValues[i + 1]);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the first value of the header, trimmed; blank values count as absent.
     */
    public Optional<String> first(String name) {
        return Optional.ofNullable(value(name));
    }

    /**
     * Nullable variant of {@link #first(String)}.
     */
    public String value(String name) {
        if (name == null) {
            return null;
        }
        String raw = values.get(normalize(name));
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public boolean contains(String name) {
        return name != null && values.containsKey(normalize(name));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        // Values may carry addresses or tokens; names only
        return "RequestHeaders" + values.keySet();
    }

    public static final class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a header unless one with the same (case-insensitive) name was already added.
         */
        public Builder add(String name, String value) {
            if (name == null || name.isBlank() || value == null) {
                return this;
            }
            values.putIfAbsent(normalize(name), value);
            return this;
        }

        public RequestHeaders build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new RequestHeaders(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
