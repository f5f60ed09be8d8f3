/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.pipeline;

import com.visitrack.intake.api.IBotClassifier;
import com.visitrack.intake.api.IGeoResolver;
import com.visitrack.intake.api.IRouteAdmission;
import com.visitrack.intake.api.IVisitorFingerprinter;
import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.model.AdmissionDecision;
import com.visitrack.intake.api.model.ClassificationResult;
import com.visitrack.intake.api.model.DeviceType;
import com.visitrack.intake.api.model.GeoResult;
import com.visitrack.intake.api.model.IntakeResult;
import com.visitrack.intake.api.model.PathSuspicion;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.RouteInfo;
import com.visitrack.intake.api.model.RuleScope;
import com.visitrack.intake.api.model.VisitorIdentity;
import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.runtime.admission.RouteAdmissionEngine;
import com.visitrack.intake.runtime.admission.RouteAnalysis;
import com.visitrack.intake.runtime.bot.BotClassifier;
import com.visitrack.intake.runtime.fingerprint.DeviceClassifier;
import com.visitrack.intake.runtime.fingerprint.VisitorFingerprinter;
import com.visitrack.intake.runtime.geo.ClientAddressResolver;
import com.visitrack.intake.runtime.geo.ProxyGeoResolver;
import com.visitrack.intake.runtime.privacy.PrivacyEngine;
import com.visitrack.intake.runtime.privacy.PrivacyViolation;
import com.visitrack.intake.runtime.privacy.VisitRecord;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point the host calls once per request.
 *
 * <p>Runs admission, and for admitted requests bot classification, geo
 * resolution, fingerprinting, address hashing and route description. The
 * assembled visit is checked against the privacy rules and violations are
 * counted, not enforced. Every stage is guarded: an
 * unexpected runtime error is logged, counted and replaced by the stage's
 * default, so {@link #process} never throws for a well-formed context. A
 * failing admission stage admits the request.
 *
 * <p>Thread-safe. Performs no blocking I/O.
 */
public class IntakePipeline {
    private static final Logger logger = Logger.getLogger(IntakePipeline.class.getName());

    private final IntakeConfig config;
    private final IRouteAdmission admission;
    private final IBotClassifier classifier;
    private final IGeoResolver geoResolver;
    private final IVisitorFingerprinter fingerprinter;
    private final ClientAddressResolver addressResolver;
    private final RouteAnalysis routeAnalysis;
    private final MetricsRegistry metrics;
    private final String addressSalt;

    public IntakePipeline(IntakeConfig config) {
        this(config, MetricsRegistry.getInstance());
    }

    public IntakePipeline(IntakeConfig config, MetricsRegistry metrics) {
        this(config, new RouteAdmissionEngine(config), new BotClassifier(),
                new ProxyGeoResolver(config), new VisitorFingerprinter(), metrics);
    }

    public IntakePipeline(IntakeConfig config, IRouteAdmission admission, IBotClassifier classifier,
                          IGeoResolver geoResolver, IVisitorFingerprinter fingerprinter,
                          MetricsRegistry metrics) {
        this.config = config;
        this.admission = admission;
        this.classifier = classifier;
        this.geoResolver = geoResolver;
        this.fingerprinter = fingerprinter;
        this.addressResolver = new ClientAddressResolver(config.getTrustedProxyMatcher());
        this.routeAnalysis = new RouteAnalysis(config.getMaxPathLength());
        this.metrics = metrics;
        this.addressSalt = config.getAddressHashSalt()
                .orElseGet(() -> PrivacyEngine.generateSalt(PrivacyEngine.DEFAULT_SALT_LENGTH));
        logger.info("Intake pipeline ready: " + config);
    }

    public IntakeResult process(RequestContext context) {
        return process(context, RuleScope.GLOBAL);
    }

    public IntakeResult process(RequestContext context, RuleScope scope) {
        long start = System.nanoTime();
        metrics.counter("intake_requests_total").increment();
        try {
            AdmissionDecision decision = guard("admission",
                    () -> admission.admit(context, scope), AdmissionDecision.ALLOW);
            if (!decision.allowed()) {
                metrics.counter("intake_blocked_total", "reason", decision.reason().name()).increment();
                return IntakeResult.blocked(decision);
            }
            metrics.counter("intake_admitted_total").increment();

            ClassificationResult classification = config.isBotDetection()
                    ? guard("classification", () -> classifier.classify(context), ClassificationResult.UNCLASSIFIED)
                    : ClassificationResult.UNCLASSIFIED;
            if (classification.bot()) {
                metrics.counter("intake_bots_total", "type", classification.botType().name()).increment();
            }

            GeoResult geo = config.isGeographicData()
                    ? guard("geo", () -> geoResolver.resolve(context, config.getPrecisionLevel(),
                    config.isPrivacyMode()), GeoResult.empty())
                    : GeoResult.empty();

            VisitorIdentity identity = config.isFingerprinting()
                    ? guard("fingerprint", () -> fingerprinter.fingerprint(context, config.isPrivacyMode()), null)
                    : null;

            String addressHash = guard("address-hash", () -> hashClientAddress(context), null);

            RouteInfo route = guard("route", () -> routeAnalysis.describe(context.path()), null);
            if (route != null) {
                for (PathSuspicion suspicion : route.suspicions()) {
                    metrics.counter("intake_suspicious_paths_total", "category", suspicion.name()).increment();
                }
            }
            DeviceType deviceType = DeviceClassifier.detect(context.userAgent());

            checkCompliance(context, geo, addressHash);
            return new IntakeResult(decision, classification, geo, identity, addressHash, route, deviceType);
        } finally {
            metrics.timer("intake_pipeline_latency").recordNanos(System.nanoTime() - start);
        }
    }

    private String hashClientAddress(RequestContext context) {
        return addressResolver.resolve(context.headers(), context.remoteAddress().orElse(null))
                .map(address -> PrivacyEngine.hashAddress(address, addressSalt))
                .orElse(null);
    }

    private void checkCompliance(RequestContext context, GeoResult geo, String addressHash) {
        VisitRecord record = new VisitRecord(context.path(), context.userAgent(), geo.anonymizedAddress(), addressHash);
        for (PrivacyViolation violation : PrivacyEngine.validateCompliance(record)) {
            metrics.counter("intake_privacy_violations_total", "violation", violation.name()).increment();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Privacy check flagged " + violation + " for " + context);
            }
        }
    }

    private <T> T guard(String stage, Supplier<T> body, T fallback) {
        try {
            T value = body.get();
            return value != null ? value : fallback;
        } catch (RuntimeException e) {
            metrics.counter("intake_stage_errors_total", "stage", stage).increment();
            logger.log(Level.WARNING, "Intake stage '" + stage + "' failed, using default", e);
            return fallback;
        }
    }
}
