package com.positionalert.engine.domain.marketdata;

/** Spacing of the close prices a signal measures movement over. */
public enum Sampling {
    /** Previous close to current price. */
    DAILY,
    MINUTE,
    SECOND
}
