package com.positionalert.engine.domain.marketdata;

public enum InstrumentKind {
    EQUITY,
    /** Index such as {@code $SPX}: no traded volume and no intraday bars. */
    INDEX
}
