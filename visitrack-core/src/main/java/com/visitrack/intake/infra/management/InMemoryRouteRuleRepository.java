/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.infra.management;

import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.config.RouteFilterConfig;
import com.visitrack.intake.api.model.RuleScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory rule repository: one global rule list plus per-tenant lists.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe. Readers see either
 * the old or the new rules of a scope, never a mix.
 */
public class InMemoryRouteRuleRepository implements RouteRuleRepository {
    private static final Logger logger = Logger.getLogger(InMemoryRouteRuleRepository.class.getName());

    private final AtomicReference<RouteFilterConfig> globalRules;
    private final ConcurrentMap<String, RouteFilterConfig> tenantRules = new ConcurrentHashMap<>();
    private final List<Consumer<RuleScope>> listeners = new CopyOnWriteArrayList<>();

    public InMemoryRouteRuleRepository() {
        this(RouteFilterConfig.EMPTY, Map.of());
    }

    public InMemoryRouteRuleRepository(RouteFilterConfig globalRules, Map<String, RouteFilterConfig> tenantRules) {
        this.globalRules = new AtomicReference<>(Objects.requireNonNull(globalRules, "globalRules"));
        this.tenantRules.putAll(tenantRules);
    }

    public static InMemoryRouteRuleRepository from(IntakeConfig config) {
        return new InMemoryRouteRuleRepository(config.getGlobalRules(), config.getTenantRules());
    }

    @Override
    public RouteFilterConfig rulesFor(RuleScope scope) {
        if (scope.isGlobal()) {
            return globalRules.get();
        }
        return tenantRules.getOrDefault(scope.tenant(), RouteFilterConfig.EMPTY);
    }

    @Override
    public void reconfigure(RuleScope scope, RouteFilterConfig rules) {
        Objects.requireNonNull(rules, "rules");
        if (scope.isGlobal()) {
            globalRules.set(rules);
        } else {
            tenantRules.put(scope.tenant(), rules);
        }
        logger.info("Route rules reconfigured for " + scope + ": "
                + rules.includeOnly().size() + " include_only, " + rules.exclude().size() + " exclude");
        notifyListeners(scope);
    }

    @Override
    public void removeTenant(String tenant) {
        if (tenantRules.remove(tenant) != null) {
            logger.info("Route rules removed for tenant " + tenant);
            notifyListeners(RuleScope.tenant(tenant));
        }
    }

    @Override
    public Set<String> tenants() {
        return Set.copyOf(tenantRules.keySet());
    }

    @Override
    public void addChangeListener(Consumer<RuleScope> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void notifyListeners(RuleScope scope) {
        for (Consumer<RuleScope> listener : listeners) {
            try {
                listener.accept(scope);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Rule change listener failed for " + scope, e);
            }
        }
    }
}
