/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

/**
 * Why a request was not admitted for tracking.
 */
public enum BlockReason {
    METHOD_EXCLUDED,
    PATH_TOO_LONG,
    STATIC_ASSET,
    BUILT_IN_EXCLUSION,
    TENANT_BLOCKLIST,
    NOT_IN_TENANT_ALLOWLIST,
    GLOBAL_BLOCKLIST,
    NOT_IN_GLOBAL_ALLOWLIST;

    /**
     * True for the checks that run before any configured rule.
     */
    public boolean isBuiltIn() {
        return this == METHOD_EXCLUDED || this == PATH_TOO_LONG
                || this == STATIC_ASSET || this == BUILT_IN_EXCLUSION;
    }
}
