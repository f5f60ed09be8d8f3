/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.compiler;

import com.visitrack.intake.api.IRuleSetCompiler;
import com.visitrack.intake.api.config.RouteFilterConfig;
import com.visitrack.intake.api.config.RoutePatternDefinition;
import com.visitrack.intake.api.model.RuleValidationError;
import com.visitrack.intake.runtime.model.CompiledRule;
import com.visitrack.intake.runtime.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Compiles the raw rules of one scope into an immutable {@link RuleSet}.
 */
public class RuleSetCompiler implements IRuleSetCompiler {
    private static final Logger logger = Logger.getLogger(RuleSetCompiler.class.getName());

    public static final Set<String> KNOWN_METHODS = Set.of(
            "GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS", "TRACE", "CONNECT");

    static final String INCLUDE_ONLY = "include_only";
    static final String EXCLUDE = "exclude";

    private final PatternCompiler patternCompiler = new PatternCompiler();
    private volatile Tracer tracer;

    public RuleSetCompiler() {
        this(OpenTelemetry.noop().getTracer("visitrack-compiler"));
    }

    public RuleSetCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Compiles both lists. Blank entries are skipped with a warning; use
     * {@link #validate(RouteFilterConfig)} at load time to reject them instead.
     */
    @Override
    public RuleSet compile(RouteFilterConfig config) {
        if (config == null) {
            return RuleSet.EMPTY;
        }
        Span span = tracer.spanBuilder("compile-rule-set").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();

            List<CompiledRule> includeOnly = compileAll(INCLUDE_ONLY, config.includeOnly());
            List<CompiledRule> exclude = compileAll(EXCLUDE, config.exclude());
            RuleSet ruleSet = new RuleSet(includeOnly, exclude);

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("includeOnlyCount", includeOnly.size());
            span.setAttribute("excludeCount", exclude.size());
            span.setAttribute("compilationTimeMicros", TimeUnit.NANOSECONDS.toMicros(compilationTime));
            logger.fine("Compiled rule set: " + includeOnly.size() + " include_only, "
                    + exclude.size() + " exclude");
            return ruleSet;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public List<RuleValidationError> validate(RouteFilterConfig config) {
        List<RuleValidationError> errors = new ArrayList<>();
        if (config == null) {
            return errors;
        }
        validateList(INCLUDE_ONLY, config.includeOnly(), errors);
        validateList(EXCLUDE, config.exclude(), errors);
        return errors;
    }

    private List<CompiledRule> compileAll(String list, List<RoutePatternDefinition> definitions) {
        List<CompiledRule> compiled = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            RoutePatternDefinition definition = definitions.get(i);
            if (definition == null || definition.pattern() == null || definition.pattern().isBlank()) {
                logger.warning("Skipping blank route pattern at " + list + "[" + i + "]");
                continue;
            }
            compiled.add(patternCompiler.compile(definition));
        }
        return compiled;
    }

    private static void validateList(String list, List<RoutePatternDefinition> definitions,
                                     List<RuleValidationError> errors) {
        for (int i = 0; i < definitions.size(); i++) {
            RoutePatternDefinition definition = definitions.get(i);
            String pattern = definition == null ? null : definition.pattern();
            if (pattern == null || pattern.isBlank()) {
                errors.add(new RuleValidationError(list, i, pattern, "pattern cannot be blank"));
                continue;
            }
            if (pattern.trim().equals(PatternCompiler.REGEX_PREFIX)) {
                errors.add(new RuleValidationError(list, i, pattern, "regex body cannot be empty"));
            }
            for (String method : definition.methods()) {
                if (method == null || !KNOWN_METHODS.contains(method.trim().toUpperCase(Locale.ROOT))) {
                    errors.add(new RuleValidationError(list, i, pattern, "unknown HTTP method: " + method));
                }
            }
        }
    }
}
