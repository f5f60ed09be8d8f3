/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Bot-or-human verdict for one request.
 *
 * @param bot        whether the request is considered automated
 * @param botType    category; {@link BotType#HUMAN} when {@code bot} is false
 * @param botName    name of the matched signature, {@code null} when unknown
 * @param confidence confidence in the verdict, clamped to [0, 0.99]
 * @param signals    signals that fired, in evaluation order
 */
public record ClassificationResult(
        boolean bot,
        BotType botType,
        String botName,
        double confidence,
        List<BotSignal> signals
) {
    public static final double MAX_CONFIDENCE = 0.99;

    /**
     * Returned when classification is disabled or fails.
     */
    public static final ClassificationResult UNCLASSIFIED =
            new ClassificationResult(false, BotType.HUMAN, null, 0.0, List.of());

    public ClassificationResult {
        Objects.requireNonNull(botType, "botType");
        if (bot == (botType == BotType.HUMAN)) {
            throw new IllegalArgumentException("botType " + botType + " contradicts bot=" + bot);
        }
        confidence = clamp(confidence);
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static ClassificationResult human(double confidence) {
        return new ClassificationResult(false, BotType.HUMAN, null, confidence, List.of());
    }

    public static double clamp(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0) {
            return 0.0;
        }
        return Math.min(confidence, MAX_CONFIDENCE);
    }
}
