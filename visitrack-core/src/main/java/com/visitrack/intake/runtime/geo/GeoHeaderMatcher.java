package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.model.GeoProvider;
import com.visitrack.intake.api.model.RequestHeaders;

import java.util.Optional;

/**
 * Recognizes one provider's geo headers.
 */
public interface GeoHeaderMatcher {

    GeoProvider provider();

    /**
     * @return the extracted fields, or empty when the provider's headers are
     * absent or carry no valid country code
     */
    Optional<GeoFields> tryExtract(RequestHeaders headers);
}
