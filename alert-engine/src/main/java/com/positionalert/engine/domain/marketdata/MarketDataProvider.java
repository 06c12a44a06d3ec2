package com.positionalert.engine.domain.marketdata;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Outbound port to the market-data provider. Implementations throw
 * {@link com.positionalert.engine.domain.exceptions.FetchException} on provider or network
 * failure. Callers are responsible for rate limiting.
 */
public interface MarketDataProvider {

    QuoteFields fetchTickerSnapshot(String ticker);

    /** Snapshot for an index ticker in its marker form, e.g. {@code $SPX}. */
    QuoteFields fetchIndexSnapshot(String ticker);

    /** Mean daily volume over the trading days in the {@code days} before {@code asOf}. */
    Optional<Long> fetchAverageVolume(String ticker, int days, LocalDate asOf);

    /** Intraday bars for {@code date} in chronological order, at most {@code limit} of the latest. */
    List<PriceBar> fetchBars(String ticker, Sampling sampling, LocalDate date, int limit);
}
