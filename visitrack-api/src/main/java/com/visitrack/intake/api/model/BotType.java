package com.visitrack.intake.api.model;

/**
 * Category of automated agent. {@link #HUMAN} marks a non-bot classification.
 */
public enum BotType {
    SEARCH_ENGINE,
    SOCIAL_MEDIA,
    SECURITY,
    SEO,
    MONITORING,
    UNKNOWN_BOT,
    HUMAN
}
