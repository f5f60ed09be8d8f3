/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.compiler.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.config.RouteFilterConfig;
import com.visitrack.intake.api.exceptions.ConfigurationException;
import com.visitrack.intake.api.model.AnonymizationLevel;
import com.visitrack.intake.api.model.GeoProvider;
import com.visitrack.intake.api.model.PrecisionLevel;
import com.visitrack.intake.api.model.RuleValidationError;
import com.visitrack.intake.compiler.RuleSetCompiler;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Loads {@link IntakeConfig} from JSON.
 *
 * <p>Loading is strict: unreadable files, malformed JSON, unknown keys, invalid
 * limits, invalid trusted-proxy CIDRs and invalid route rules all raise
 * {@link ConfigurationException}. Unknown enum names are the exception: an
 * unknown precision level becomes COUNTRY, an unknown anonymization level
 * becomes FULL and an unknown provider is skipped, each with a warning.
 *
 * <p>Environment overrides ({@code VISITRACK_*}) are applied on top of the file.
 */
public class ConfigLoader {
    private static final Logger logger = Logger.getLogger(ConfigLoader.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    private final Tracer tracer;
    private final RuleSetCompiler ruleSetCompiler;
    private final Function<String, String> overrides;

    public ConfigLoader() {
        this(OpenTelemetry.noop().getTracer("visitrack-compiler"));
    }

    public ConfigLoader(Tracer tracer) {
        this(tracer, null);
    }

    /**
     * @param overrides lookup for {@code VISITRACK_*} override values, null to read the
     *                  process environment
     */
    public ConfigLoader(Tracer tracer, Function<String, String> overrides) {
        this.tracer = tracer;
        this.ruleSetCompiler = new RuleSetCompiler(tracer);
        this.overrides = overrides;
    }

    public IntakeConfig load(Path configPath) {
        Span span = tracer.spanBuilder("load-config").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("configFilePath", configPath.toString());
            String content;
            try {
                content = Files.readString(configPath);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read configuration file " + configPath, e);
            }
            IntakeConfig config = parse(content);
            logger.info("Loaded intake configuration from " + configPath + ": " + config);
            return config;
        } catch (ConfigurationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public IntakeConfig load(String json) {
        Span span = tracer.spanBuilder("load-config").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return parse(json);
        } catch (ConfigurationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private IntakeConfig parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationException("Configuration cannot be empty");
        }
        IntakeConfigDefinition definition;
        try {
            definition = objectMapper.readValue(json, IntakeConfigDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new ConfigurationException("Configuration cannot be null");
        }

        validateRules("route_filters", definition.routeFilters());
        if (definition.tenantRouteFilters() != null) {
            for (Map.Entry<String, RouteFilterConfig> entry : definition.tenantRouteFilters().entrySet()) {
                validateRules("tenant_route_filters." + entry.getKey(), entry.getValue());
            }
        }

        try {
            IntakeConfig.Builder builder = toBuilder(definition);
            if (overrides == null) {
                builder.applyEnvironment();
            } else {
                builder.applyOverrides(overrides);
            }
            return builder.build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private IntakeConfig.Builder toBuilder(IntakeConfigDefinition def) {
        IntakeConfig.Builder builder = IntakeConfig.builder();

        if (def.providerPriority() != null) {
            builder.providerPriority(parseProviders(def.providerPriority()));
        }
        if (def.precisionLevel() != null) {
            builder.precisionLevel(PrecisionLevel.fromString(def.precisionLevel()).orElseGet(() -> {
                logger.warning("Unknown precision_level '" + def.precisionLevel() + "', using COUNTRY");
                return PrecisionLevel.COUNTRY;
            }));
        }
        if (def.anonymizeAddressLevel() != null) {
            builder.anonymizeAddressLevel(AnonymizationLevel.fromString(def.anonymizeAddressLevel()).orElseGet(() -> {
                logger.warning("Unknown anonymize_address_level '" + def.anonymizeAddressLevel() + "', using FULL");
                return AnonymizationLevel.FULL;
            }));
        }
        if (def.privacyMode() != null) builder.privacyMode(def.privacyMode());
        if (def.detectVpn() != null) builder.detectVpn(def.detectVpn());
        if (def.cacheTtlSeconds() != null) builder.cacheTtl(Duration.ofSeconds(def.cacheTtlSeconds()));
        if (def.excludeMethods() != null) builder.excludeMethods(def.excludeMethods());
        if (def.excludeExtensions() != null) builder.excludeExtensions(def.excludeExtensions());
        if (def.excludeStaticAssets() != null) builder.excludeStaticAssets(def.excludeStaticAssets());
        if (def.maxPathLength() != null) builder.maxPathLength(def.maxPathLength());
        if (def.trustedProxies() != null) builder.trustedProxies(def.trustedProxies());
        if (def.botDetection() != null) builder.botDetection(def.botDetection());
        if (def.geographicData() != null) builder.geographicData(def.geographicData());
        if (def.fingerprinting() != null) builder.fingerprinting(def.fingerprinting());
        if (def.addressHashSalt() != null) builder.addressHashSalt(def.addressHashSalt());
        if (def.routeFilters() != null) builder.globalRules(def.routeFilters());
        if (def.tenantRouteFilters() != null) builder.tenantRules(def.tenantRouteFilters());

        return builder;
    }

    private static List<GeoProvider> parseProviders(List<String> names) {
        List<GeoProvider> providers = new ArrayList<>();
        for (String name : names) {
            GeoProvider.fromString(name).ifPresentOrElse(providers::add,
                    () -> logger.warning("Unknown geo provider '" + name + "' in provider_priority, skipping"));
        }
        return providers;
    }

    private void validateRules(String scope, RouteFilterConfig rules) {
        if (rules == null) {
            return;
        }
        List<RuleValidationError> errors = ruleSetCompiler.validate(rules);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid route rules in " + scope + ": " + errors);
        }
    }
}
