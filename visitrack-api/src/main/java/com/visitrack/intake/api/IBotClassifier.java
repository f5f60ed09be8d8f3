package com.visitrack.intake.api;

import com.visitrack.intake.api.model.ClassificationResult;
import com.visitrack.intake.api.model.RequestContext;

public interface IBotClassifier {

    /**
     * Scores a request as bot or human. Never throws.
     */
    ClassificationResult classify(RequestContext context);
}
