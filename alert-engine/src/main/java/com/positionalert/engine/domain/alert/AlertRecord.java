package com.positionalert.engine.domain.alert;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;

@Builder(toBuilder = true)
public record AlertRecord(
        String ticker,
        LocalDate tradingDate,
        String signal,
        BigDecimal lastAlertedPercent,
        int alertCount,
        Instant alertedAt,
        Instant expiresAt) {

    public AlertKey key() {
        return new AlertKey(ticker, tradingDate, signal);
    }
}
