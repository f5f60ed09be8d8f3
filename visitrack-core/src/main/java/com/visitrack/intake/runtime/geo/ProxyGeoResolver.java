/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.IGeoResolver;
import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.model.AnonymizationLevel;
import com.visitrack.intake.api.model.GeoProvider;
import com.visitrack.intake.api.model.GeoResult;
import com.visitrack.intake.api.model.PrecisionLevel;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.RequestHeaders;
import com.visitrack.intake.runtime.privacy.PrivacyEngine;
import com.visitrack.intake.util.AddressLiterals;
import com.visitrack.intake.util.CidrMatcher;

import java.net.InetAddress;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves location from the geo headers CDNs and edge platforms inject.
 *
 * <p>Providers are tried in priority order and the first one with a valid
 * country code wins. When none matches, the client address is looked up in a
 * small static table. Precision and address anonymization are applied last, so
 * nothing finer than allowed ever leaves this class.
 */
public class ProxyGeoResolver implements IGeoResolver {
    private static final Logger logger = Logger.getLogger(ProxyGeoResolver.class.getName());

    private final List<GeoHeaderMatcher> matchers;
    private final ClientAddressResolver addressResolver;
    private final boolean detectVpn;
    private final AnonymizationLevel anonymization;

    public ProxyGeoResolver(IntakeConfig config) {
        this(config.getProviderPriority(), config.isDetectVpn(),
                config.getAnonymizeAddressLevel(), config.getTrustedProxyMatcher());
    }

    public ProxyGeoResolver(List<GeoProvider> providerPriority, boolean detectVpn,
                            AnonymizationLevel anonymization, CidrMatcher trustedProxies) {
        this.matchers = GeoMatchers.forPriority(providerPriority);
        this.addressResolver = new ClientAddressResolver(trustedProxies);
        this.detectVpn = detectVpn;
        this.anonymization = anonymization;
    }

    @Override
    public GeoResult resolve(RequestHeaders headers, PrecisionLevel precision, boolean privacyMode) {
        return resolve(headers, null, precision, privacyMode);
    }

    @Override
    public GeoResult resolve(RequestContext context, PrecisionLevel precision, boolean privacyMode) {
        return resolve(context.headers(), context.remoteAddress().orElse(null), precision, privacyMode);
    }

    private GeoResult resolve(RequestHeaders headers, InetAddress remoteAddress,
                              PrecisionLevel precision, boolean privacyMode) {
        try {
            return doResolve(headers, remoteAddress, precision, privacyMode);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Geo resolution failed, returning empty result", e);
            return GeoResult.empty();
        }
    }

    private GeoResult doResolve(RequestHeaders headers, InetAddress remoteAddress,
                                PrecisionLevel precision, boolean privacyMode) {
        GeoProvider provider = GeoProvider.NONE;
        GeoFields fields = null;
        for (GeoHeaderMatcher matcher : matchers) {
            Optional<GeoFields> extracted = matcher.tryExtract(headers);
            if (extracted.isPresent()) {
                provider = matcher.provider();
                fields = extracted.get();
                break;
            }
        }

        InetAddress clientAddress = clientAddress(headers, remoteAddress, fields);

        GeoResult.Builder builder = GeoResult.builder();
        if (fields != null) {
            builder.provider(provider)
                    .countryCode(fields.countryCode())
                    .region(fields.region())
                    .city(fields.city())
                    .coordinates(fields.latitude(), fields.longitude())
                    .timezone(fields.timezone());
        } else {
            Optional<String> country = StaticAddressLocator.countryOf(clientAddress);
            if (country.isPresent()) {
                builder.provider(GeoProvider.ADDRESS_LOOKUP).countryCode(country.get());
            }
        }

        GeoResult result = builder.build();
        if (result.hasLocation()) {
            result = enrich(result);
        }

        PrecisionLevel effectivePrecision = privacyMode ? precision.atMost(PrecisionLevel.COUNTRY) : precision;
        AnonymizationLevel effectiveAnonymization =
                privacyMode ? anonymization.atLeast(AnonymizationLevel.PARTIAL) : anonymization;

        result = result.withPrecision(effectivePrecision);
        if (clientAddress != null) {
            result = result.withAnonymizedAddress(
                    AddressLiterals.format(PrivacyEngine.anonymizeAddress(clientAddress, effectiveAnonymization)));
        }
        if (detectVpn && ProxyHeuristics.looksProxied(headers)) {
            result = result.withProxyDetected(true);
        }
        result = result.withProxyType(ProxyHeuristics.detectProxyType(headers));

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Resolved geo via " + result.provider() + ": " + result.countryCode());
        }
        return result;
    }

    private InetAddress clientAddress(RequestHeaders headers, InetAddress remoteAddress, GeoFields fields) {
        if (fields != null && fields.clientAddress() != null && addressResolver.trustsForwarding(remoteAddress)) {
            Optional<InetAddress> provided = AddressLiterals.parse(fields.clientAddress());
            if (provided.isPresent()) {
                return provided.get();
            }
        }
        return addressResolver.resolve(headers, remoteAddress).orElse(null);
    }

    private static GeoResult enrich(GeoResult result) {
        GeoResult.Builder builder = GeoResult.builder()
                .provider(result.provider())
                .countryCode(result.countryCode())
                .countryName(result.countryName() != null
                        ? result.countryName()
                        : CountryCatalog.name(result.countryCode()).orElse(null))
                .region(result.region())
                .city(result.city())
                .coordinates(result.latitude(), result.longitude())
                .timezone(result.timezone() != null
                        ? result.timezone()
                        : CountryCatalog.timezone(result.countryCode()).orElse(null));
        return builder.build();
    }
}
