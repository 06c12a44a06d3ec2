package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Raw quote values as reported by the provider for one ticker. Price fields the provider
 * left out are absent from {@code prices}; zero values are kept, nulls are not allowed, so the caller can tell a
 * zero primary field from a missing one.
 */
public record QuoteFields(
        String ticker, Map<PriceSource, BigDecimal> prices, BigDecimal previousClose, Long volume) {

    public QuoteFields {
        prices = prices == null ? Map.of() : Map.copyOf(prices);
    }
}
