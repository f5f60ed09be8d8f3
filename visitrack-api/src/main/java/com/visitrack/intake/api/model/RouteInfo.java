package com.visitrack.intake.api.model;

import java.util.Objects;
import java.util.Set;

/**
 * What the pipeline learned about the requested route itself.
 *
 * @param normalizedPath path with dynamic segments replaced by {@code :id} or {@code :file}
 * @param category       site section the path belongs to
 * @param suspicions     reasons the path looks like probing; empty for ordinary pages
 */
public record RouteInfo(String normalizedPath, RouteCategory category, Set<PathSuspicion> suspicions) {

    public RouteInfo {
        Objects.requireNonNull(normalizedPath, "normalizedPath");
        Objects.requireNonNull(category, "category");
        suspicions = suspicions == null ? Set.of() : Set.copyOf(suspicions);
    }

    public boolean suspicious() {
        return !suspicions.isEmpty();
    }
}
