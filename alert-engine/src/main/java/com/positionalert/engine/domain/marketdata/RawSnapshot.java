package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;

/** Snapshot as fetched, before validation. Any price or volume field may be null or zero. */
@Builder(toBuilder = true)
public record RawSnapshot(
        String ticker,
        InstrumentKind kind,
        BigDecimal currentPrice,
        PriceSource priceSource,
        boolean priceFallback,
        BigDecimal previousClose,
        Long volume,
        Long averageVolume,
        List<PriceBar> minuteBars,
        List<PriceBar> secondBars) {

    public RawSnapshot {
        minuteBars = minuteBars == null ? List.of() : List.copyOf(minuteBars);
        secondBars = secondBars == null ? List.of() : List.copyOf(secondBars);
    }
}
