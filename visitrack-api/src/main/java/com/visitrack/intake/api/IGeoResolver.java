package com.visitrack.intake.api;

import com.visitrack.intake.api.model.GeoResult;
import com.visitrack.intake.api.model.PrecisionLevel;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.RequestHeaders;

/**
 * Resolves a privacy-bounded location from proxy and CDN headers.
 */
public interface IGeoResolver {

    /**
     * Resolves from headers alone.
     *
     * @param headers     request headers
     * @param precision   requested precision
     * @param privacyMode caps precision at COUNTRY and forces address anonymization
     * @return the result, {@link GeoResult#empty()} when nothing matched; never null
     */
    GeoResult resolve(RequestHeaders headers, PrecisionLevel precision, boolean privacyMode);

    /**
     * Resolves from headers and the connection's remote address.
     */
    GeoResult resolve(RequestContext context, PrecisionLevel precision, boolean privacyMode);
}
