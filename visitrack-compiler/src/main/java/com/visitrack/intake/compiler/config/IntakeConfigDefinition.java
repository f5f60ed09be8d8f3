package com.visitrack.intake.compiler.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.visitrack.intake.api.config.RouteFilterConfig;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of an intake configuration file. Every field is optional;
 * absent fields keep their defaults.
 */
public record IntakeConfigDefinition(
        @JsonProperty("provider_priority") List<String> providerPriority,
        @JsonProperty("precision_level") String precisionLevel,
        @JsonProperty("privacy_mode") Boolean privacyMode,
        @JsonProperty("detect_vpn") Boolean detectVpn,
        @JsonProperty("anonymize_address_level") String anonymizeAddressLevel,
        @JsonProperty("cache_ttl_seconds") Long cacheTtlSeconds,
        @JsonProperty("exclude_methods") List<String> excludeMethods,
        @JsonProperty("exclude_extensions") List<String> excludeExtensions,
        @JsonProperty("exclude_static_assets") Boolean excludeStaticAssets,
        @JsonProperty("max_path_length") Integer maxPathLength,
        @JsonProperty("trusted_proxies") List<String> trustedProxies,
        @JsonProperty("bot_detection") Boolean botDetection,
        @JsonProperty("geographic_data") Boolean geographicData,
        @JsonProperty("fingerprinting") Boolean fingerprinting,
        @JsonProperty("address_hash_salt") String addressHashSalt,
        @JsonProperty("route_filters") RouteFilterConfig routeFilters,
        @JsonProperty("tenant_route_filters") Map<String, RouteFilterConfig> tenantRouteFilters
) {
}
