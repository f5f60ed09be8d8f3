package com.visitrack.intake.infra.management;

import com.visitrack.intake.api.config.RouteFilterConfig;
import com.visitrack.intake.api.model.RuleScope;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Source of the raw route rules per scope.
 */
public interface RouteRuleRepository {

    /**
     * Returns the rules of a scope; an unknown tenant has no rules.
     */
    RouteFilterConfig rulesFor(RuleScope scope);

    /**
     * Replaces the rules of a scope and notifies listeners.
     */
    void reconfigure(RuleScope scope, RouteFilterConfig rules);

    /**
     * Drops a tenant's rules and notifies listeners.
     */
    void removeTenant(String tenant);

    Set<String> tenants();

    /**
     * Registers a callback invoked with the scope after every change.
     */
    void addChangeListener(Consumer<RuleScope> listener);
}
