package com.visitrack.intake.runtime.fingerprint;

import com.visitrack.intake.api.model.DeviceType;

/**
 * Form factor from user-agent tokens.
 */
public final class DeviceClassifier {

    private DeviceClassifier() {
    }

    /**
     * Tablets are checked first: iPad agents carry {@code Mobile} as well, and
     * Android tablets are the Android agents without it.
     */
    public static DeviceType detect(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DeviceType.UNKNOWN;
        }
        if (userAgent.contains("iPad") || userAgent.contains("Tablet")
                || (userAgent.contains("Android") && !userAgent.contains("Mobile"))) {
            return DeviceType.TABLET;
        }
        if (userAgent.contains("Mobile") || userAgent.contains("iPhone") || userAgent.contains("Android")) {
            return DeviceType.MOBILE;
        }
        return DeviceType.DESKTOP;
    }
}
