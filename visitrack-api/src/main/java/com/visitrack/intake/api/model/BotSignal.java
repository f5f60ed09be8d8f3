package com.visitrack.intake.api.model;

/**
 * Evidence sources that can mark a request as automated.
 */
public enum BotSignal {
    /** User agent matched the signature table */
    USER_AGENT,
    /** Client address inside a known crawler network */
    ADDRESS,
    /** Caller-supplied request rate above the threshold */
    FREQUENCY
}
