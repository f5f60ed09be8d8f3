package com.visitrack.intake.api.model;

public enum PiiCategory {
    EMAIL,
    PHONE,
    NATIONAL_ID,
    PAYMENT_CARD,
    IP_ADDRESS
}
