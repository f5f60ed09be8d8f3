/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.model;

import java.util.List;

/**
 * The compiled rules of one scope.
 *
 * <p>A non-empty {@code includeOnly} list turns the scope into an allowlist that
 * settles the decision for the scope: a match admits the request without
 * consulting lower-precedence scopes, a miss blocks it. Instances are immutable;
 * a configuration change always produces a new rule set.
 */
public record RuleSet(List<CompiledRule> includeOnly, List<CompiledRule> exclude) {

    public static final RuleSet EMPTY = new RuleSet(List.of(), List.of());

    public RuleSet {
        includeOnly = includeOnly == null ? List.of() : List.copyOf(includeOnly);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public boolean isEmpty() {
        return includeOnly.isEmpty() && exclude.isEmpty();
    }

    public boolean isAllowlist() {
        return !includeOnly.isEmpty();
    }

    public boolean excludes(String path, String method) {
        return anyMatch(exclude, path, method);
    }

    /**
     * True when the request matches an {@code includeOnly} rule.
     */
    public boolean includes(String path, String method) {
        return anyMatch(includeOnly, path, method);
    }

    public int size() {
        return includeOnly.size() + exclude.size();
    }

    private static boolean anyMatch(List<CompiledRule> rules, String path, String method) {
        for (CompiledRule rule : rules) {
            if (rule.matches(path, method)) {
                return true;
            }
        }
        return false;
    }
}
