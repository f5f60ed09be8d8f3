package com.visitrack.intake.api.exceptions;

/**
 * Thrown when intake configuration cannot be loaded or fails validation.
 *
 * Only raised while loading or reconfiguring, never from a per-request call.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
