/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import java.util.Objects;

/**
 * Everything the pipeline produced for one request.
 *
 * <p>For a blocked request only {@code decision} is populated. For an admitted
 * request every other field is non-null; a stage that was switched off or failed
 * contributes its default value ({@link ClassificationResult#UNCLASSIFIED},
 * {@link GeoResult#empty()}).
 *
 * @param decision       route admission outcome
 * @param classification bot verdict, null when blocked
 * @param geo            location, null when blocked
 * @param identity       visitor identity, null when blocked or fingerprinting is off
 * @param addressHash    salted client address hash, null when blocked or no address is known
 * @param route          normalized path, category and suspicion flags, null when blocked or the stage failed
 * @param deviceType     device form factor from the user agent, null when blocked
 */
public record IntakeResult(
        AdmissionDecision decision,
        ClassificationResult classification,
        GeoResult geo,
        VisitorIdentity identity,
        String addressHash,
        RouteInfo route,
        DeviceType deviceType
) {
    public IntakeResult {
        Objects.requireNonNull(decision, "decision");
    }

    public static IntakeResult blocked(AdmissionDecision decision) {
        if (decision.allowed()) {
            throw new IllegalArgumentException("Not a block decision: " + decision);
        }
        return new IntakeResult(decision, null, null, null, null, null, null);
    }

    public boolean admitted() {
        return decision.allowed();
    }

    /**
     * True when the request was admitted and is not classified as a bot.
     */
    public boolean trackable() {
        return admitted() && classification != null && !classification.bot();
    }
}
