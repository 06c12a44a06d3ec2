package com.positionalert.engine.domain.marketdata;

/** Either a fetched snapshot or the error that prevented it. */
public record FetchOutcome(String ticker, RawSnapshot snapshot, FetchError error) {

    public static FetchOutcome success(RawSnapshot snapshot) {
        return new FetchOutcome(snapshot.ticker(), snapshot, null);
    }

    public static FetchOutcome failure(String ticker, String reason) {
        return new FetchOutcome(ticker, null, new FetchError(ticker, reason));
    }

    public boolean isSuccess() {
        return snapshot != null;
    }
}
