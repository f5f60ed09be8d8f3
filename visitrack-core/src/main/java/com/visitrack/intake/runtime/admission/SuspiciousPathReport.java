package com.visitrack.intake.runtime.admission;

import com.visitrack.intake.api.model.PathSuspicion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Result of scanning a batch of paths for probing patterns.
 *
 * @param totalPaths            paths examined
 * @param suspiciousPaths       paths with at least one finding
 * @param suspiciousPercentage  share of suspicious paths, 0 for an empty batch
 * @param details               findings per distinct suspicious path, in input order
 */
public record SuspiciousPathReport(
        int totalPaths,
        int suspiciousPaths,
        double suspiciousPercentage,
        Map<String, Set<PathSuspicion>> details
) {
    static SuspiciousPathReport of(int total, int suspicious, Map<String, Set<PathSuspicion>> details) {
        double percentage = total == 0 ? 0.0 : suspicious * 100.0 / total;
        return new SuspiciousPathReport(total, suspicious, percentage,
                Collections.unmodifiableMap(new LinkedHashMap<>(details)));
    }
}
