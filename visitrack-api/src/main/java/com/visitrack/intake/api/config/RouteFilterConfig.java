package com.visitrack.intake.api.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Raw rules of one scope.
 *
 * @param includeOnly allowlist patterns; empty means no allowlist
 * @param exclude     blocklist patterns
 */
public record RouteFilterConfig(
        @JsonProperty("include_only") List<RoutePatternDefinition> includeOnly,
        @JsonProperty("exclude") List<RoutePatternDefinition> exclude
) {
    public static final RouteFilterConfig EMPTY = new RouteFilterConfig(List.of(), List.of());

    public RouteFilterConfig {
        includeOnly = includeOnly == null ? List.of() : List.copyOf(includeOnly);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public static RouteFilterConfig excluding(String... patterns) {
        return new RouteFilterConfig(List.of(), definitions(patterns));
    }

    public static RouteFilterConfig includingOnly(String... patterns) {
        return new RouteFilterConfig(definitions(patterns), List.of());
    }

    public RouteFilterConfig withExclude(String... patterns) {
        return new RouteFilterConfig(includeOnly, definitions(patterns));
    }

    private static List<RoutePatternDefinition> definitions(String... patterns) {
        return Arrays.stream(patterns).map(RoutePatternDefinition::of).toList();
    }
}
