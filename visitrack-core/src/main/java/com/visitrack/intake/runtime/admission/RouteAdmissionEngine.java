/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.admission;

import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.visitrack.intake.api.IRouteAdmission;
import com.visitrack.intake.api.IRuleSetCompiler;
import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.config.RouteFilterConfig;
import com.visitrack.intake.api.exceptions.ConfigurationException;
import com.visitrack.intake.api.model.AdmissionDecision;
import com.visitrack.intake.api.model.BlockReason;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.RuleScope;
import com.visitrack.intake.api.model.RuleValidationError;
import com.visitrack.intake.compiler.RuleSetCompiler;
import com.visitrack.intake.infra.cache.RuleSetCache;
import com.visitrack.intake.infra.management.InMemoryRouteRuleRepository;
import com.visitrack.intake.infra.management.RouteRuleRepository;
import com.visitrack.intake.infra.metrics.MetricsRegistry;
import com.visitrack.intake.infra.telemetry.TracingService;
import com.visitrack.intake.runtime.model.CompiledRule;
import com.visitrack.intake.runtime.model.RuleSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Route admission: built-in exclusions first, then configured rules.
 *
 * <p>Rule precedence, first decisive step wins:
 * <ol>
 *   <li>tenant exclude match: block</li>
 *   <li>tenant include_only non-empty: allow on match, block otherwise</li>
 *   <li>global exclude match: block</li>
 *   <li>global include_only non-empty: allow on match, block otherwise</li>
 *   <li>allow</li>
 * </ol>
 * The tenant steps are skipped for {@link RuleScope#GLOBAL}.
 *
 * <p>The decision is a pure function of the request and the compiled rule sets;
 * the cache only affects how quickly those rule sets are available.
 */
public class RouteAdmissionEngine implements IRouteAdmission {
    private static final Logger logger = Logger.getLogger(RouteAdmissionEngine.class.getName());

    private final BuiltInExclusions exclusions;
    private final RouteRuleRepository repository;
    private final IRuleSetCompiler compiler;
    private final RuleSetCache cache;
    private final RouteAnalysis analysis;

    public RouteAdmissionEngine(IntakeConfig config) {
        this(config, InMemoryRouteRuleRepository.from(config),
                new RuleSetCompiler(TracingService.getInstance().getTracer()),
                MetricsRegistry.getInstance(), Ticker.systemTicker());
    }

    public RouteAdmissionEngine(IntakeConfig config, RouteRuleRepository repository,
                                IRuleSetCompiler compiler, MetricsRegistry metrics, Ticker ticker) {
        this.exclusions = new BuiltInExclusions(config);
        this.analysis = new RouteAnalysis(config.getMaxPathLength());
        this.repository = repository;
        this.compiler = compiler;
        this.cache = new RuleSetCache(config.getCacheTtl(), ticker,
                scope -> compiler.compile(repository.rulesFor(scope)), metrics);
        repository.addChangeListener(cache::invalidate);
    }

    @Override
    public AdmissionDecision admit(RequestContext context, RuleScope scope) {
        return decide(context.method(), stripQuery(context.path()), scope);
    }

    @Override
    public List<String> filterPaths(Collection<String> paths, String method, RuleScope scope) {
        if (paths == null || paths.isEmpty()) {
            return List.of();
        }
        String normalizedMethod = method == null || method.isBlank()
                ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        List<String> admitted = new ArrayList<>(paths.size());
        for (String path : paths) {
            if (path != null && decide(normalizedMethod, stripQuery(path), scope).allowed()) {
                admitted.add(path);
            }
        }
        return admitted;
    }

    private AdmissionDecision decide(String method, String path, RuleScope scope) {
        BlockReason builtIn = exclusions.check(method, path);
        if (builtIn != null) {
            return AdmissionDecision.block(builtIn);
        }

        if (!scope.isGlobal()) {
            RuleSet tenant = ruleSet(scope);
            if (tenant.excludes(path, method)) {
                return AdmissionDecision.block(BlockReason.TENANT_BLOCKLIST);
            }
            if (tenant.isAllowlist()) {
                return tenant.includes(path, method)
                        ? AdmissionDecision.ALLOW
                        : AdmissionDecision.block(BlockReason.NOT_IN_TENANT_ALLOWLIST);
            }
        }

        RuleSet global = ruleSet(RuleScope.GLOBAL);
        if (global.excludes(path, method)) {
            return AdmissionDecision.block(BlockReason.GLOBAL_BLOCKLIST);
        }
        if (global.isAllowlist()) {
            return global.includes(path, method)
                    ? AdmissionDecision.ALLOW
                    : AdmissionDecision.block(BlockReason.NOT_IN_GLOBAL_ALLOWLIST);
        }
        return AdmissionDecision.ALLOW;
    }

    private RuleSet ruleSet(RuleScope scope) {
        try {
            return cache.get(scope);
        } catch (RuntimeException e) {
            // Not cached, so the next request retries the compilation
            logger.log(Level.WARNING, "Could not compile route rules for " + scope + ", applying none", e);
            return RuleSet.EMPTY;
        }
    }

    /**
     * Validates and installs new rules for a scope; the cached rule set is
     * invalidated through the repository's change listener.
     *
     * @throws ConfigurationException if any rule is invalid
     */
    public void reconfigure(RuleScope scope, RouteFilterConfig rules) {
        List<RuleValidationError> errors = compiler.validate(rules);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid route rules for " + scope + ": " + errors);
        }
        repository.reconfigure(scope, rules);
    }

    @Override
    public void invalidate(RuleScope scope) {
        cache.invalidate(scope);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    public FilterStats filterStats(RuleScope scope) {
        RuleSet ruleSet = ruleSet(scope);
        int regex = 0;
        for (CompiledRule rule : ruleSet.includeOnly()) {
            if (rule.kind() == CompiledRule.MatchKind.REGEX) regex++;
        }
        for (CompiledRule rule : ruleSet.exclude()) {
            if (rule.kind() == CompiledRule.MatchKind.REGEX) regex++;
        }
        CacheStats stats = cache.stats();
        return new FilterStats(scope, stats.hitCount(), stats.missCount(),
                ruleSet.includeOnly().size(), ruleSet.exclude().size(), regex);
    }

    /**
     * Flags probing and malformed paths among the given ones, using the
     * configured path length limit. Admission is not consulted.
     */
    public SuspiciousPathReport detectSuspiciousPaths(Collection<String> paths) {
        return analysis.detectSuspiciousPaths(paths);
    }

    RuleSetCache cache() {
        return cache;
    }

    private static String stripQuery(String path) {
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }
}
