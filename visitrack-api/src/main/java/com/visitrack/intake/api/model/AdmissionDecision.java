/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of route admission: {@link #ALLOW} or a block with its reason.
 *
 * @param allowed whether the request should be tracked
 * @param reason  block reason, {@code null} when allowed
 */
public record AdmissionDecision(boolean allowed, BlockReason reason) {

    public static final AdmissionDecision ALLOW = new AdmissionDecision(true, null);

    private static final Map<BlockReason, AdmissionDecision> BLOCKS = new EnumMap<>(BlockReason.class);

    static {
        for (BlockReason reason : BlockReason.values()) {
            BLOCKS.put(reason, new AdmissionDecision(false, reason));
        }
    }

    public AdmissionDecision {
        if (allowed && reason != null) {
            throw new IllegalArgumentException("An allow decision carries no reason");
        }
        if (!allowed && reason == null) {
            throw new IllegalArgumentException("A block decision needs a reason");
        }
    }

    public static AdmissionDecision block(BlockReason reason) {
        AdmissionDecision decision = BLOCKS.get(reason);
        if (decision == null) {
            throw new IllegalArgumentException("A block decision needs a reason");
        }
        return decision;
    }

    public boolean blocked() {
        return !allowed;
    }

    @Override
    public String toString() {
        return allowed ? "Allow" : "Block(" + reason + ")";
    }
}
