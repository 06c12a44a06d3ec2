package com.positionalert.engine.domain.marketdata;

/** Provider fields a current price can be read from. */
public enum PriceSource {
    MINUTE_CLOSE,
    LAST_TRADE,
    /** Bid/ask midpoint, or whichever side is quoted. */
    LAST_QUOTE,
    DAY_CLOSE,
    INDEX_VALUE
}
