/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A raw route rule as configured: a pattern and an optional method restriction.
 *
 * <p>In JSON either a bare string ({@code "/admin/*"}) or an object
 * ({@code {"pattern": "/api/*", "methods": ["POST"]}}).
 */
public final class RoutePatternDefinition {

    private static final Set<String> FIELDS = Set.of("pattern", "methods");

    private final String pattern;
    private final List<String> methods;

    public RoutePatternDefinition(String pattern, List<String> methods) {
        this.pattern = pattern;
        this.methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public static RoutePatternDefinition of(String pattern) {
        return new RoutePatternDefinition(pattern, null);
    }

    /**
     * Accepts the bound JSON value: a string or an object with {@code pattern}
     * and optional {@code methods}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RoutePatternDefinition fromJson(Object raw) {
        if (raw instanceof String pattern) {
            return of(pattern);
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Route rule must be a string or an object, got: " + raw);
        }
        for (Object key : map.keySet()) {
            if (!FIELDS.contains(key)) {
                throw new IllegalArgumentException("Unknown route rule field: " + key);
            }
        }
        Object pattern = map.get("pattern");
        if (pattern != null && !(pattern instanceof String)) {
            throw new IllegalArgumentException("Route rule 'pattern' must be a string");
        }
        Object methods = map.get("methods");
        if (methods == null) {
            return new RoutePatternDefinition((String) pattern, null);
        }
        if (!(methods instanceof List<?> list)) {
            throw new IllegalArgumentException("Route rule 'methods' must be a list");
        }
        List<String> names = new ArrayList<>(list.size());
        for (Object method : list) {
            if (!(method instanceof String name)) {
                throw new IllegalArgumentException("Route rule methods must be strings, got: " + method);
            }
            names.add(name);
        }
        return new RoutePatternDefinition((String) pattern, names);
    }

    public static RoutePatternDefinition of(String pattern, String... methods) {
        return new RoutePatternDefinition(pattern, List.of(methods));
    }

    @JsonProperty("pattern")
    public String pattern() {
        return pattern;
    }

    /**
     * Methods as written; empty means any method.
     */
    @JsonProperty("methods")
    public List<String> methods() {
        return methods;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoutePatternDefinition that)) return false;
        return Objects.equals(pattern, that.pattern) && methods.equals(that.methods);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, methods);
    }

    @Override
    public String toString() {
        return methods.isEmpty() ? pattern : pattern + " " + methods;
    }
}
