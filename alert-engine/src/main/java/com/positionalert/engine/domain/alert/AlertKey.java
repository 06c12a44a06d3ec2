package com.positionalert.engine.domain.alert;

import java.time.LocalDate;

/** Dedup key: one ledger entry per ticker, New York trading date and signal. */
public record AlertKey(String ticker, LocalDate tradingDate, String signal) {

    @Override
    public String toString() {
        return ticker + "#" + tradingDate + "#" + signal;
    }
}
