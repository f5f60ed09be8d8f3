/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.visitrack.intake.api.model.RuleScope;
import com.visitrack.intake.infra.metrics.Counter;
import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.runtime.model.RuleSet;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Compiled rule sets per scope, with time-to-live expiry.
 *
 * <p>An entry is stale once {@code now - compiledAt >= ttl}. Stale entries are
 * recompiled lazily on the next lookup; nothing is refreshed in the background.
 * Compilation for a key runs at most once at a time and publishes a complete,
 * immutable {@link RuleSet}, so readers never see a partially built value.
 *
 * <p>Backed by Caffeine: reads are lock-free and hit/miss/load statistics are
 * recorded.
 */
public final class RuleSetCache {
    private static final Logger logger = Logger.getLogger(RuleSetCache.class.getName());

    private final Cache<RuleScope, RuleSet> cache;
    private final Function<RuleScope, RuleSet> compiler;
    private final Counter compilations;

    public RuleSetCache(Duration ttl, Function<RuleScope, RuleSet> compiler, MetricsRegistry metrics) {
        this(ttl, Ticker.systemTicker(), compiler, metrics);
    }

    /**
     * @param ticker time source; tests pass a fake ticker to cross the TTL boundary
     */
    public RuleSetCache(Duration ttl, Ticker ticker, Function<RuleScope, RuleSet> compiler,
                        MetricsRegistry metrics) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.compilations = metrics.counter("rule_set_compilations_total");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
        logger.info("Rule set cache created: ttl=" + ttl);
    }

    /**
     * Returns the rule set of a scope, compiling it when absent or stale.
     */
    public RuleSet get(RuleScope scope) {
        return cache.get(scope, this::compile);
    }

    public void invalidate(RuleScope scope) {
        cache.invalidate(scope);
        logger.fine("Invalidated rule set for " + scope);
    }

    public void invalidateAll() {
        cache.invalidateAll();
        logger.fine("Invalidated all rule sets");
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private RuleSet compile(RuleScope scope) {
        RuleSet ruleSet = compiler.apply(scope);
        compilations.increment();
        logger.fine("Compiled " + ruleSet.size() + " rules for " + scope);
        return ruleSet;
    }
}
