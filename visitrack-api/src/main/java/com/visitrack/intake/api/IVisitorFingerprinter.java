package com.visitrack.intake.api;

import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.VisitorIdentity;

public interface IVisitorFingerprinter {

    /**
     * Derives a deterministic, cookie-free identity. Total: missing headers
     * are simply left out.
     *
     * @param privacyMode when true, scheme and viewport hints are not used
     */
    VisitorIdentity fingerprint(RequestContext context, boolean privacyMode);
}
