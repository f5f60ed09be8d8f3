package com.visitrack.intake.api;

import com.visitrack.intake.api.config.RouteFilterConfig;
import com.visitrack.intake.api.model.RuleValidationError;
import com.visitrack.intake.runtime.model.RuleSet;

import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Contract for compiling configured route rules into an immutable {@link RuleSet}.
 */
public interface IRuleSetCompiler {

    /**
     * Compiles the rules of one scope. Never fails on a bad pattern; such a
     * pattern degrades to an exact match.
     *
     * @param config raw rules
     * @return compiled rule set
     */
    RuleSet compile(RouteFilterConfig config);

    /**
     * Checks raw rules without compiling them.
     *
     * @return problems found, empty when the rules are valid
     */
    List<RuleValidationError> validate(RouteFilterConfig config);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
