package com.positionalert.engine.domain.marketdata;

import java.math.BigDecimal;
import java.util.EnumSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Admits a snapshot only when current price, previous close and current volume are all
 * strictly positive. Indices report no traded volume, so volume is not required for them.
 */
@Slf4j
@Component
public class DataValidator {

    public ValidationResult validate(RawSnapshot raw) {
        var reasons = EnumSet.noneOf(RejectionReason.class);

        checkPrice(raw.currentPrice(), reasons,
                RejectionReason.MISSING_CURRENT_PRICE, RejectionReason.NON_POSITIVE_CURRENT_PRICE);
        checkPrice(raw.previousClose(), reasons,
                RejectionReason.MISSING_PREVIOUS_CLOSE, RejectionReason.NON_POSITIVE_PREVIOUS_CLOSE);

        if (raw.kind() != InstrumentKind.INDEX) {
            if (raw.volume() == null) {
                reasons.add(RejectionReason.MISSING_VOLUME);
            } else if (raw.volume() <= 0) {
                reasons.add(RejectionReason.NON_POSITIVE_VOLUME);
            }
        }

        if (!reasons.isEmpty()) {
            log.warn("Rejected snapshot for {}: {} (price={}, prevClose={}, volume={})",
                    raw.ticker(), reasons, raw.currentPrice(), raw.previousClose(), raw.volume());
            return ValidationResult.rejected(raw.ticker(), reasons);
        }

        return ValidationResult.valid(Snapshot.builder()
                .ticker(raw.ticker())
                .kind(raw.kind())
                .currentPrice(raw.currentPrice())
                .previousClose(raw.previousClose())
                .volume(raw.volume() == null ? 0L : raw.volume())
                .averageVolume(raw.averageVolume())
                .priceSource(raw.priceSource())
                .priceFallback(raw.priceFallback())
                .minuteBars(raw.minuteBars())
                .secondBars(raw.secondBars())
                .build());
    }

    private static void checkPrice(
            BigDecimal value, EnumSet<RejectionReason> reasons,
            RejectionReason missing, RejectionReason nonPositive) {
        if (value == null) {
            reasons.add(missing);
        } else if (value.signum() <= 0) {
            reasons.add(nonPositive);
        }
    }
}
