package com.visitrack.intake.api;

import com.visitrack.intake.api.model.AdmissionDecision;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.RuleScope;

import java.util.Collection;
import java.util.List;

/**
 * Decides whether a request should be tracked at all.
 */
public interface IRouteAdmission {

    /**
     * Runs the built-in exclusions, then the tenant and global rules.
     *
     * @param context the request
     * @param scope   tenant whose rules apply, or {@link RuleScope#GLOBAL}
     */
    AdmissionDecision admit(RequestContext context, RuleScope scope);

    default AdmissionDecision admit(RequestContext context) {
        return admit(context, RuleScope.GLOBAL);
    }

    /**
     * Returns the paths, in input order, that would be admitted for the given method.
     * A null or empty collection gives an empty list; null entries are dropped.
     */
    List<String> filterPaths(Collection<String> paths, String method, RuleScope scope);

    /**
     * Drops the compiled rules of one scope; they are recompiled on next use.
     */
    void invalidate(RuleScope scope);

    void invalidateAll();
}
