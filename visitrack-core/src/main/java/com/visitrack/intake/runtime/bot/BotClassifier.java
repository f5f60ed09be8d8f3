/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.bot;

import com.visitrack.intake.api.IBotClassifier;
import com.visitrack.intake.api.model.BotSignal;
import com.visitrack.intake.api.model.BotType;
import com.visitrack.intake.api.model.ClassificationResult;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.util.CidrMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies a request as bot or human from three independent signals: the
 * user-agent signature table, crawler address ranges and the caller-supplied
 * request rate.
 *
 * <p>Confidence starts at {@value #BOT_BASE} for a bot and {@value #HUMAN_BASE}
 * for a human, and each signal that fired adds its weight, capped at
 * {@link ClassificationResult#MAX_CONFIDENCE}.
 */
public class BotClassifier implements IBotClassifier {
    private static final Logger logger = Logger.getLogger(BotClassifier.class.getName());

    static final double BOT_BASE = 0.6;
    static final double HUMAN_BASE = 0.8;
    static final double USER_AGENT_WEIGHT = 0.3;
    static final double ADDRESS_WEIGHT = 0.2;
    static final double FREQUENCY_WEIGHT = 0.1;

    /** Requests per minute above which a client is treated as automated */
    public static final double FREQUENCY_THRESHOLD = 60.0;

    private final List<BotSignature> signatures;
    private final CidrMatcher crawlerNetworks;

    public BotClassifier() {
        this(BotSignatures.DEFAULT, CrawlerNetworks.defaults());
    }

    public BotClassifier(List<BotSignature> signatures, CidrMatcher crawlerNetworks) {
        this.signatures = List.copyOf(signatures);
        this.crawlerNetworks = crawlerNetworks;
    }

    @Override
    public ClassificationResult classify(RequestContext context) {
        List<BotSignal> signals = new ArrayList<>(3);

        Optional<BotSignature> signature = BotSignatures.match(signatures, context.userAgent());
        if (signature.isPresent()) {
            signals.add(BotSignal.USER_AGENT);
        }
        if (context.remoteAddress().map(crawlerNetworks::matches).orElse(false)) {
            signals.add(BotSignal.ADDRESS);
        }
        OptionalDouble frequency = context.requestFrequency();
        if (frequency.isPresent() && frequency.getAsDouble() > FREQUENCY_THRESHOLD) {
            signals.add(BotSignal.FREQUENCY);
        }

        if (signals.isEmpty()) {
            return ClassificationResult.human(HUMAN_BASE);
        }

        double confidence = BOT_BASE + weight(signals);
        ClassificationResult result = signature
                .map(s -> new ClassificationResult(true, s.type(), s.name(), confidence, signals))
                .orElseGet(() -> new ClassificationResult(true, BotType.UNKNOWN_BOT, null, confidence, signals));
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Classified " + context.path() + " as " + result.botType() + " " + signals);
        }
        return result;
    }

    private static double weight(List<BotSignal> signals) {
        double weight = 0.0;
        for (BotSignal signal : signals) {
            switch (signal) {
                case USER_AGENT -> weight += USER_AGENT_WEIGHT;
                case ADDRESS -> weight += ADDRESS_WEIGHT;
                case FREQUENCY -> weight += FREQUENCY_WEIGHT;
            }
        }
        return weight;
    }
}
