package com.positionalert.engine.domain.marketdata;

import java.time.Duration;
import lombok.Builder;

/**
 * @param minuteBarLimit latest minute bars to load per ticker, 0 to skip them
 * @param secondBarLimit latest second bars to load per ticker, 0 to skip them
 */
@Builder(toBuilder = true)
public record FetchSettings(
        Duration fetchTimeout,
        PricePrecedence pricePrecedence,
        int averageVolumeDays,
        int minuteBarLimit,
        int secondBarLimit) {}
