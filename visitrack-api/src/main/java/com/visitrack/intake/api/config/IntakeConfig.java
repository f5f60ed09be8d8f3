/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.config;

import com.visitrack.intake.api.model.AnonymizationLevel;
import com.visitrack.intake.api.model.GeoProvider;
import com.visitrack.intake.api.model.PrecisionLevel;
import com.visitrack.intake.util.CidrMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration of the intake pipeline.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #fromEnvironment()} and {@link Builder#applyEnvironment()} read the
 * following variables (falling back to system properties of the same name):
 * <pre>
 * VISITRACK_PRECISION_LEVEL=COUNTRY|REGION|CITY|FULL
 * VISITRACK_PRIVACY_MODE=true
 * VISITRACK_DETECT_VPN=false
 * VISITRACK_ANONYMIZE_ADDRESS_LEVEL=NONE|PARTIAL|FULL
 * VISITRACK_CACHE_TTL_SECONDS=600
 * VISITRACK_MAX_PATH_LENGTH=1024
 * VISITRACK_ADDRESS_HASH_SALT=...
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * IntakeConfig config = IntakeConfig.builder()
 *     .precisionLevel(PrecisionLevel.REGION)
 *     .trustedProxies(List.of("10.0.0.0/8"))
 *     .globalRules(RouteFilterConfig.excluding("/admin/*"))
 *     .build();
 * }</pre>
 */
public final class IntakeConfig {

    private static final Logger logger = Logger.getLogger(IntakeConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_PRECISION_LEVEL = "VISITRACK_PRECISION_LEVEL";
    static final String ENV_PRIVACY_MODE = "VISITRACK_PRIVACY_MODE";
    static final String ENV_DETECT_VPN = "VISITRACK_DETECT_VPN";
    static final String ENV_ANONYMIZE_ADDRESS_LEVEL = "VISITRACK_ANONYMIZE_ADDRESS_LEVEL";
    static final String ENV_CACHE_TTL_SECONDS = "VISITRACK_CACHE_TTL_SECONDS";
    static final String ENV_MAX_PATH_LENGTH = "VISITRACK_MAX_PATH_LENGTH";
    static final String ENV_ADDRESS_HASH_SALT = "VISITRACK_ADDRESS_HASH_SALT";

    // ========================================================================
    // DEFAULTS
    // ========================================================================

    public static final List<GeoProvider> DEFAULT_PROVIDER_PRIORITY = List.of(
            GeoProvider.CLOUDFLARE, GeoProvider.FASTLY, GeoProvider.CLOUDFRONT,
            GeoProvider.VERCEL, GeoProvider.FLY_IO, GeoProvider.GENERIC);

    public static final Set<String> DEFAULT_EXCLUDE_METHODS = Set.of("OPTIONS", "HEAD", "TRACE");

    public static final List<String> DEFAULT_EXCLUDE_EXTENSIONS = List.of(
            ".css", ".js", ".png", ".jpg", ".jpeg", ".gif", ".svg", ".ico",
            ".woff", ".woff2", ".ttf", ".eot", ".map", ".webp", ".avif",
            ".pdf", ".txt", ".xml", ".json");

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(3600);
    public static final int DEFAULT_MAX_PATH_LENGTH = 2000;

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final List<GeoProvider> providerPriority;
    private final PrecisionLevel precisionLevel;
    private final boolean privacyMode;
    private final boolean detectVpn;
    private final AnonymizationLevel anonymizeAddressLevel;
    private final Duration cacheTtl;
    private final Set<String> excludeMethods;
    private final List<String> excludeExtensions;
    private final boolean excludeStaticAssets;
    private final int maxPathLength;
    private final List<String> trustedProxies;
    private final CidrMatcher trustedProxyMatcher;
    private final boolean botDetection;
    private final boolean geographicData;
    private final boolean fingerprinting;
    private final String addressHashSalt;
    private final RouteFilterConfig globalRules;
    private final Map<String, RouteFilterConfig> tenantRules;

    private IntakeConfig(Builder builder) {
        this.providerPriority = List.copyOf(new LinkedHashSet<>(builder.providerPriority));
        this.precisionLevel = builder.precisionLevel;
        this.privacyMode = builder.privacyMode;
        this.detectVpn = builder.detectVpn;
        this.anonymizeAddressLevel = builder.anonymizeAddressLevel;
        this.cacheTtl = builder.cacheTtl;
        this.excludeMethods = normalizeMethods(builder.excludeMethods);
        this.excludeExtensions = normalizeExtensions(builder.excludeExtensions);
        this.excludeStaticAssets = builder.excludeStaticAssets;
        this.maxPathLength = builder.maxPathLength;
        this.trustedProxies = List.copyOf(builder.trustedProxies);
        this.botDetection = builder.botDetection;
        this.geographicData = builder.geographicData;
        this.fingerprinting = builder.fingerprinting;
        this.addressHashSalt = builder.addressHashSalt;
        this.globalRules = builder.globalRules;
        this.tenantRules = Map.copyOf(builder.tenantRules);

        validate();
        this.trustedProxyMatcher = CidrMatcher.from(trustedProxies);
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static IntakeConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults with environment overrides applied.
     */
    public static IntakeConfig fromEnvironment() {
        return builder().applyEnvironment().build();
    }

    /**
     * Country precision, privacy mode on and full address anonymization.
     */
    public static IntakeConfig privacyFirst() {
        return builder()
                .privacyMode(true)
                .precisionLevel(PrecisionLevel.COUNTRY)
                .anonymizeAddressLevel(AnonymizationLevel.FULL)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.providerPriority = new ArrayList<>(providerPriority);
        builder.precisionLevel = precisionLevel;
        builder.privacyMode = privacyMode;
        builder.detectVpn = detectVpn;
        builder.anonymizeAddressLevel = anonymizeAddressLevel;
        builder.cacheTtl = cacheTtl;
        builder.excludeMethods = new ArrayList<>(excludeMethods);
        builder.excludeExtensions = new ArrayList<>(excludeExtensions);
        builder.excludeStaticAssets = excludeStaticAssets;
        builder.maxPathLength = maxPathLength;
        builder.trustedProxies = new ArrayList<>(trustedProxies);
        builder.botDetection = botDetection;
        builder.geographicData = geographicData;
        builder.fingerprinting = fingerprinting;
        builder.addressHashSalt = addressHashSalt;
        builder.globalRules = globalRules;
        builder.tenantRules = new LinkedHashMap<>(tenantRules);
        return builder;
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public List<GeoProvider> getProviderPriority() {
        return providerPriority;
    }

    public PrecisionLevel getPrecisionLevel() {
        return precisionLevel;
    }

    public boolean isPrivacyMode() {
        return privacyMode;
    }

    public boolean isDetectVpn() {
        return detectVpn;
    }

    public AnonymizationLevel getAnonymizeAddressLevel() {
        return anonymizeAddressLevel;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public Set<String> getExcludeMethods() {
        return excludeMethods;
    }

    public List<String> getExcludeExtensions() {
        return excludeExtensions;
    }

    public boolean isExcludeStaticAssets() {
        return excludeStaticAssets;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }

    public List<String> getTrustedProxies() {
        return trustedProxies;
    }

    public CidrMatcher getTrustedProxyMatcher() {
        return trustedProxyMatcher;
    }

    public boolean isBotDetection() {
        return botDetection;
    }

    public boolean isGeographicData() {
        return geographicData;
    }

    public boolean isFingerprinting() {
        return fingerprinting;
    }

    public Optional<String> getAddressHashSalt() {
        return Optional.ofNullable(addressHashSalt);
    }

    public RouteFilterConfig getGlobalRules() {
        return globalRules;
    }

    public Map<String, RouteFilterConfig> getTenantRules() {
        return tenantRules;
    }

    /**
     * Precision actually applied: privacy mode caps it at COUNTRY.
     */
    public PrecisionLevel effectivePrecision() {
        return privacyMode ? precisionLevel.atMost(PrecisionLevel.COUNTRY) : precisionLevel;
    }

    /**
     * Anonymization actually applied: privacy mode raises it to at least PARTIAL.
     */
    public AnonymizationLevel effectiveAnonymization() {
        return privacyMode ? anonymizeAddressLevel.atLeast(AnonymizationLevel.PARTIAL) : anonymizeAddressLevel;
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must be positive: " + cacheTtl);
        }
        if (maxPathLength <= 0) {
            throw new IllegalArgumentException("maxPathLength must be positive: " + maxPathLength);
        }
        if (precisionLevel == null || anonymizeAddressLevel == null) {
            throw new IllegalArgumentException("precisionLevel and anonymizeAddressLevel are required");
        }
        if (globalRules == null) {
            throw new IllegalArgumentException("globalRules cannot be null");
        }
        for (Map.Entry<String, RouteFilterConfig> entry : tenantRules.entrySet()) {
            if (entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Tenant key cannot be blank");
            }
        }
        if (addressHashSalt != null && addressHashSalt.isEmpty()) {
            throw new IllegalArgumentException("addressHashSalt cannot be empty");
        }
    }

    private static Set<String> normalizeMethods(List<String> methods) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String method : methods) {
            if (method != null && !method.isBlank()) {
                normalized.add(method.trim().toUpperCase(Locale.ROOT));
            }
        }
        return Set.copyOf(normalized);
    }

    private static List<String> normalizeExtensions(List<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String extension : extensions) {
            if (extension == null || extension.isBlank()) {
                continue;
            }
            String value = extension.trim().toLowerCase(Locale.ROOT);
            normalized.add(value.startsWith(".") ? value : "." + value);
        }
        return List.copyOf(normalized);
    }

    @Override
    public String toString() {
        return "IntakeConfig{" +
                "providerPriority=" + providerPriority +
                ", precisionLevel=" + precisionLevel +
                ", privacyMode=" + privacyMode +
                ", detectVpn=" + detectVpn +
                ", anonymizeAddressLevel=" + anonymizeAddressLevel +
                ", cacheTtl=" + cacheTtl +
                ", excludeMethods=" + excludeMethods +
                ", maxPathLength=" + maxPathLength +
                ", trustedProxies=" + trustedProxies.size() +
                ", addressHashSalt=" + (addressHashSalt == null ? "random" : "***REDACTED***") +
                ", tenants=" + tenantRules.keySet() +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {

        private List<GeoProvider> providerPriority = new ArrayList<>(DEFAULT_PROVIDER_PRIORITY);
        private PrecisionLevel precisionLevel = PrecisionLevel.CITY;
        private boolean privacyMode = false;
        private boolean detectVpn = true;
        private AnonymizationLevel anonymizeAddressLevel = AnonymizationLevel.PARTIAL;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private List<String> excludeMethods = new ArrayList<>(DEFAULT_EXCLUDE_METHODS);
        private List<String> excludeExtensions = new ArrayList<>(DEFAULT_EXCLUDE_EXTENSIONS);
        private boolean excludeStaticAssets = true;
        private int maxPathLength = DEFAULT_MAX_PATH_LENGTH;
        private List<String> trustedProxies = new ArrayList<>();
        private boolean botDetection = true;
        private boolean geographicData = true;
        private boolean fingerprinting = true;
        private String addressHashSalt;
        private RouteFilterConfig globalRules = RouteFilterConfig.EMPTY;
        private Map<String, RouteFilterConfig> tenantRules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder providerPriority(List<GeoProvider> providerPriority) {
            this.providerPriority = new ArrayList<>(providerPriority);
            return this;
        }

        public Builder precisionLevel(PrecisionLevel precisionLevel) {
            this.precisionLevel = precisionLevel;
            return this;
        }

        public Builder privacyMode(boolean privacyMode) {
            this.privacyMode = privacyMode;
            return this;
        }

        public Builder detectVpn(boolean detectVpn) {
            this.detectVpn = detectVpn;
            return this;
        }

        public Builder anonymizeAddressLevel(AnonymizationLevel anonymizeAddressLevel) {
            this.anonymizeAddressLevel = anonymizeAddressLevel;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder excludeMethods(List<String> excludeMethods) {
            this.excludeMethods = new ArrayList<>(excludeMethods);
            return this;
        }

        public Builder excludeExtensions(List<String> excludeExtensions) {
            this.excludeExtensions = new ArrayList<>(excludeExtensions);
            return this;
        }

        public Builder excludeStaticAssets(boolean excludeStaticAssets) {
            this.excludeStaticAssets = excludeStaticAssets;
            return this;
        }

        public Builder maxPathLength(int maxPathLength) {
            this.maxPathLength = maxPathLength;
            return this;
        }

        public Builder trustedProxies(List<String> trustedProxies) {
            this.trustedProxies = new ArrayList<>(trustedProxies);
            return this;
        }

        public Builder botDetection(boolean botDetection) {
            this.botDetection = botDetection;
            return this;
        }

        public Builder geographicData(boolean geographicData) {
            this.geographicData = geographicData;
            return this;
        }

        public Builder fingerprinting(boolean fingerprinting) {
            this.fingerprinting = fingerprinting;
            return this;
        }

        public Builder addressHashSalt(String addressHashSalt) {
            this.addressHashSalt = addressHashSalt;
            return this;
        }

        public Builder globalRules(RouteFilterConfig globalRules) {
            this.globalRules = globalRules;
            return this;
        }

        public Builder tenantRules(Map<String, RouteFilterConfig> tenantRules) {
            this.tenantRules = new LinkedHashMap<>(tenantRules);
            return this;
        }

        public Builder tenantRules(String tenant, RouteFilterConfig rules) {
            this.tenantRules.put(tenant, rules);
            return this;
        }

        /**
         * Applies {@code VISITRACK_*} overrides from environment variables or system properties.
         */
        public Builder applyEnvironment() {
            return applyOverrides(IntakeConfig::getEnvOrProperty);
        }

        /**
         * Applies overrides looked up by environment variable name.
         * Malformed values are logged and ignored; unknown enum names fall back
         * to the most restrictive level.
         */
        public Builder applyOverrides(Function<String, String> source) {
            lookup(source, ENV_PRECISION_LEVEL).ifPresent(val ->
                    this.precisionLevel = PrecisionLevel.fromString(val).orElseGet(() -> {
                        logger.warning("Unknown " + ENV_PRECISION_LEVEL + ": " + val + ", using COUNTRY");
                        return PrecisionLevel.COUNTRY;
                    }));
            lookup(source, ENV_PRIVACY_MODE).ifPresent(val -> this.privacyMode = parseBoolean(val));
            lookup(source, ENV_DETECT_VPN).ifPresent(val -> this.detectVpn = parseBoolean(val));
            lookup(source, ENV_ANONYMIZE_ADDRESS_LEVEL).ifPresent(val ->
                    this.anonymizeAddressLevel = AnonymizationLevel.fromString(val).orElseGet(() -> {
                        logger.warning("Unknown " + ENV_ANONYMIZE_ADDRESS_LEVEL + ": " + val + ", using FULL");
                        return AnonymizationLevel.FULL;
                    }));
            lookupPositiveLong(source, ENV_CACHE_TTL_SECONDS).ifPresent(val -> this.cacheTtl = Duration.ofSeconds(val));
            lookupPositiveLong(source, ENV_MAX_PATH_LENGTH).ifPresent(val -> {
                try {
                    this.maxPathLength = Math.toIntExact(val);
                } catch (ArithmeticException e) {
                    logger.warning(ENV_MAX_PATH_LENGTH + " out of range: " + val + ", keeping " + maxPathLength);
                }
            });
            lookup(source, ENV_ADDRESS_HASH_SALT).ifPresent(val -> this.addressHashSalt = val);
            return this;
        }

        public IntakeConfig build() {
            return new IntakeConfig(this);
        }

        private static Optional<String> lookup(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            logger.fine("Override " + key + "=" + (key.contains("SALT") ? "***REDACTED***" : value));
            return Optional.of(value.trim());
        }

        private static Optional<Long> lookupPositiveLong(Function<String, String> source, String key) {
            return lookup(source, key).map(val -> {
                try {
                    long parsed = Long.parseLong(val);
                    if (parsed > 0) {
                        return parsed;
                    }
                    logger.warning("Non-positive value for " + key + ": " + val + ", keeping default");
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                }
                return null;
            });
        }

        private static boolean parseBoolean(String val) {
            String normalized = val.toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }
}
