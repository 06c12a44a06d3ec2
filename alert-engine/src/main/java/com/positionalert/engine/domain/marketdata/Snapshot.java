package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import lombok.Builder;

/**
 * A validated snapshot: current price and previous close are positive, and volume is
 * positive for equities. Only validated snapshots reach the alert engine.
 */
@Builder(toBuilder = true)
public record Snapshot(
        String ticker,
        InstrumentKind kind,
        BigDecimal currentPrice,
        BigDecimal previousClose,
        long volume,
        Long averageVolume,
        PriceSource priceSource,
        boolean priceFallback,
        List<PriceBar> minuteBars,
        List<PriceBar> secondBars) {

    public Snapshot {
        minuteBars = minuteBars == null ? List.of() : List.copyOf(minuteBars);
        secondBars = secondBars == null ? List.of() : List.copyOf(secondBars);
    }

    public List<PriceBar> bars(Sampling sampling) {
        return switch (sampling) {
            case MINUTE -> minuteBars;
            case SECOND -> secondBars;
            case DAILY -> List.of();
        };
    }

    /** Current volume over average volume, or null when no average is known. */
    public BigDecimal volumeRatio() {
        if (averageVolume == null || averageVolume <= 0 || volume <= 0) {
            return null;
        }
        return BigDecimal.valueOf(volume)
                .divide(BigDecimal.valueOf(averageVolume), 2, RoundingMode.HALF_UP);
    }
}
