package com.positionalert.engine.domain.marketdata;

public record FetchError(String ticker, String reason) {

    @Override
    public String toString() {
        return ticker + ": " + reason;
    }
}
