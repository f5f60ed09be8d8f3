/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import java.util.Objects;

/**
 * Key of a rule set: the global scope or one tenant.
 *
 * @param tenant tenant key, {@code null} for the global scope
 */
public record RuleScope(String tenant) {

    public static final RuleScope GLOBAL = new RuleScope(null);

    public RuleScope {
        if (tenant != null && tenant.isBlank()) {
            throw new IllegalArgumentException("Tenant key cannot be blank");
        }
    }

    public static RuleScope tenant(String tenant) {
        Objects.requireNonNull(tenant, "tenant");
        return new RuleScope(tenant);
    }

    /**
     * Null-tolerant factory used by hosts that may not resolve a tenant.
     */
    public static RuleScope ofNullable(String tenant) {
        return tenant == null || tenant.isBlank() ? GLOBAL : new RuleScope(tenant);
    }

    public boolean isGlobal() {
        return tenant == null;
    }

    @Override
    public String toString() {
        return isGlobal() ? "global" : "tenant:" + tenant;
    }
}
