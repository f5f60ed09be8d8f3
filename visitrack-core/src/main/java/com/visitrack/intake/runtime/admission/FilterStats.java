package com.visitrack.intake.runtime.admission;

import com.visitrack.intake.api.model.RuleScope;

/**
 * Snapshot of rule usage for one scope.
 *
 * @param scope          the scope described
 * @param cacheHits      rule-set cache hits across all scopes
 * @param cacheMisses    rule-set cache misses across all scopes
 * @param includePatterns number of include_only rules in the scope
 * @param excludePatterns number of exclude rules in the scope
 * @param regexPatterns  how many of those compiled to regular expressions
 */
public record FilterStats(
        RuleScope scope,
        long cacheHits,
        long cacheMisses,
        int includePatterns,
        int excludePatterns,
        int regexPatterns
) {
}
