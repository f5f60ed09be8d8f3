package com.visitrack.intake.api.model;

/**
 * Form factor of the visitor's device as far as the user agent tells.
 */
public enum DeviceType {
    MOBILE,
    TABLET,
    DESKTOP,
    UNKNOWN
}
