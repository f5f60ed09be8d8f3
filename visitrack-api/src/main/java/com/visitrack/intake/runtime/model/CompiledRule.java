/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One compiled route rule. Immutable and safe to share across threads.
 *
 * <p>For {@link MatchKind#PREFIX} and {@link MatchKind#SUFFIX} the stored
 * {@code pattern} is the literal remainder with the wildcard removed. For
 * {@link MatchKind#REGEX} it is the source pattern and {@code regex} holds the
 * compiled, anchored expression.
 */
public final class CompiledRule {

    public enum MatchKind {
        EXACT,
        PREFIX,
        SUFFIX,
        REGEX
    }

    private final MatchKind kind;
    private final String pattern;
    private final Pattern regex;
    private final Set<String> methods;

    private CompiledRule(MatchKind kind, String pattern, Pattern regex, Set<String> methods) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.regex = regex;
        this.methods = methods == null ? Set.of() : Set.copyOf(methods);
    }

    public static CompiledRule exact(String path, Set<String> methods) {
        return new CompiledRule(MatchKind.EXACT, path, null, methods);
    }

    public static CompiledRule prefix(String prefix, Set<String> methods) {
        return new CompiledRule(MatchKind.PREFIX, prefix, null, methods);
    }

    public static CompiledRule suffix(String suffix, Set<String> methods) {
        return new CompiledRule(MatchKind.SUFFIX, suffix, null, methods);
    }

    public static CompiledRule regex(String source, Pattern regex, Set<String> methods) {
        return new CompiledRule(MatchKind.REGEX, source, Objects.requireNonNull(regex, "regex"), methods);
    }

    /**
     * Tests a request against this rule. A rule with no methods applies to every method.
     *
     * @param path   request path, never null
     * @param method upper-cased HTTP method
     */
    public boolean matches(String path, String method) {
        if (!methods.isEmpty() && (method == null || !methods.contains(method.toUpperCase(Locale.ROOT)))) {
            return false;
        }
        return switch (kind) {
            case EXACT -> pattern.equals(path);
            case PREFIX -> path.startsWith(pattern);
            case SUFFIX -> path.endsWith(pattern);
            case REGEX -> regex.matcher(path).matches();
        };
    }

    public MatchKind kind() {
        return kind;
    }

    public String pattern() {
        return pattern;
    }

    public Pattern regex() {
        return regex;
    }

    public Set<String> methods() {
        return methods;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledRule that)) return false;
        return kind == that.kind
                && pattern.equals(that.pattern)
                && methods.equals(that.methods)
                && (regex == null ? that.regex == null
                    : that.regex != null && regex.pattern().equals(that.regex.pattern()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, pattern, methods, regex == null ? null : regex.pattern());
    }

    @Override
    public String toString() {
        String source = kind == MatchKind.REGEX ? regex.pattern() : pattern;
        return kind + "(" + source + (methods.isEmpty() ? "" : " " + methods) + ")";
    }
}
