package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered list of price fields. The first entry is the primary field; any later entry
 * that supplies the price is reported as a fallback.
 */
public record PricePrecedence(List<PriceSource> order) {

    public static final List<PriceSource> DEFAULT_ORDER = List.of(
            PriceSource.MINUTE_CLOSE, PriceSource.LAST_QUOTE, PriceSource.LAST_TRADE, PriceSource.DAY_CLOSE);

    public PricePrecedence {
        if (order == null || order.isEmpty()) {
            throw new IllegalArgumentException("Price precedence needs at least one field");
        }
        order = List.copyOf(order);
    }

    public static PricePrecedence defaults() {
        return new PricePrecedence(DEFAULT_ORDER);
    }

    public PriceSource primary() {
        return order.get(0);
    }

    /** First strictly positive price in precedence order. */
    public Optional<ResolvedPrice> resolve(Map<PriceSource, BigDecimal> prices) {
        for (int i = 0; i < order.size(); i++) {
            var source = order.get(i);
            var price = prices.get(source);
            if (price != null && price.signum() > 0) {
                return Optional.of(new ResolvedPrice(price, source, i > 0));
            }
        }
        return Optional.empty();
    }

    public record ResolvedPrice(BigDecimal price, PriceSource source, boolean fallback) {}
}
