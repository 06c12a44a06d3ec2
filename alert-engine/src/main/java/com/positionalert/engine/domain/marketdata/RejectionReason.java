package com.positionalert.engine.domain.marketdata;

public enum RejectionReason {
    MISSING_CURRENT_PRICE,
    NON_POSITIVE_CURRENT_PRICE,
    MISSING_PREVIOUS_CLOSE,
    NON_POSITIVE_PREVIOUS_CLOSE,
    MISSING_VOLUME,
    NON_POSITIVE_VOLUME
}
