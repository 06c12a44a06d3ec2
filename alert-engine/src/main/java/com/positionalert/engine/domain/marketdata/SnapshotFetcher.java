package com.positionalert.engine.domain.marketdata;

import com.positionalert.engine.domain.exceptions.FetchException;
import com.positionalert.engine.domain.exceptions.RateLimitTimeoutException;
import com.positionalert.engine.domain.position.TickerSymbols;
import com.positionalert.engine.domain.run.RunDeadline;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches raw snapshots for a run's tickers.
 *
 * <p>Equities run on the bounded fetch executor, one task per ticker, each task taking a
 * rate limiter slot before every provider call. Indices go through a sequential path on the
 * calling thread. A failure, a per-ticker timeout or the run deadline turns into a
 * {@link FetchError} for that ticker only.
 */
@Slf4j
@RequiredArgsConstructor
public class SnapshotFetcher {

    static final String DEADLINE_REACHED = "run deadline reached";

    private static final ZoneId NY_ZONE = ZoneId.of("America/New_York");

    private final MarketDataProvider provider;
    private final RateLimiter rateLimiter;
    private final Executor executor;
    private final FetchSettings settings;
    private final Clock clock;

    public Map<String, FetchOutcome> fetch(Collection<String> tickers, RunDeadline deadline) {
        var equities = new ArrayList<String>();
        var indices = new ArrayList<String>();
        for (var ticker : tickers) {
            (TickerSymbols.isIndex(ticker) ? indices : equities).add(ticker);
        }
        log.info("Fetching snapshots for {} equities and {} indices", equities.size(), indices.size());

        var tradingDate = LocalDate.ofInstant(clock.instant(), NY_ZONE);
        var pending = new LinkedHashMap<String, CompletableFuture<FetchOutcome>>();
        for (var ticker : equities) {
            pending.put(ticker, submitEquity(ticker, tradingDate, deadline));
        }

        var results = new LinkedHashMap<String, FetchOutcome>();
        for (var ticker : indices) {
            results.put(ticker, fetchIndex(ticker, deadline));
        }
        pending.forEach((ticker, future) -> results.put(ticker, await(ticker, future, deadline)));

        long failed = results.values().stream().filter(o -> !o.isSuccess()).count();
        log.info("Snapshot fetch finished: {} ok, {} failed", results.size() - failed, failed);
        return results;
    }

    /**
     * The fetch timeout starts when a worker picks the task up, so queueing behind other tickers
     * does not count against it. Once the result is settled, by timeout or abandonment, the task
     * takes no further rate limiter slots.
     */
    private CompletableFuture<FetchOutcome> submitEquity(String ticker, LocalDate tradingDate, RunDeadline deadline) {
        var result = new CompletableFuture<FetchOutcome>();
        executor.execute(() -> {
            if (result.isDone()) {
                return;
            }
            if (deadline.isExpired()) {
                result.complete(FetchOutcome.failure(ticker, DEADLINE_REACHED));
                return;
            }
            result.orTimeout(settings.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(fetchEquity(ticker, tradingDate, result));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private FetchOutcome fetchEquity(String ticker, LocalDate tradingDate, CompletableFuture<FetchOutcome> result) {
        acquire(ticker, result);
        var quote = provider.fetchTickerSnapshot(ticker);

        var precedence = settings.pricePrecedence();
        var builder = RawSnapshot.builder()
                .ticker(ticker)
                .kind(InstrumentKind.EQUITY)
                .previousClose(quote.previousClose())
                .volume(quote.volume());

        precedence.resolve(quote.prices()).ifPresentOrElse(
                resolved -> {
                    if (resolved.fallback()) {
                        log.info("{}: {} unavailable, using {} price {}",
                                ticker, precedence.primary(), resolved.source(), resolved.price());
                    }
                    builder.currentPrice(resolved.price())
                            .priceSource(resolved.source())
                            .priceFallback(resolved.fallback());
                },
                () -> builder.currentPrice(quote.prices().get(precedence.primary()))
                        .priceSource(precedence.primary()));

        builder.averageVolume(averageVolume(ticker, tradingDate, result));
        if (settings.minuteBarLimit() > 0) {
            builder.minuteBars(bars(ticker, Sampling.MINUTE, tradingDate, settings.minuteBarLimit(), result));
        }
        if (settings.secondBarLimit() > 0) {
            builder.secondBars(bars(ticker, Sampling.SECOND, tradingDate, settings.secondBarLimit(), result));
        }
        return FetchOutcome.success(builder.build());
    }

    private FetchOutcome fetchIndex(String ticker, RunDeadline deadline) {
        if (deadline.isExpired()) {
            return FetchOutcome.failure(ticker, DEADLINE_REACHED);
        }
        try {
            rateLimiter.acquire();
            var quote = provider.fetchIndexSnapshot(ticker);
            return FetchOutcome.success(RawSnapshot.builder()
                    .ticker(ticker)
                    .kind(InstrumentKind.INDEX)
                    .currentPrice(quote.prices().get(PriceSource.INDEX_VALUE))
                    .priceSource(PriceSource.INDEX_VALUE)
                    .previousClose(quote.previousClose())
                    .build());
        } catch (FetchException | RateLimitTimeoutException e) {
            return failure(ticker, e);
        }
    }

    private Long averageVolume(String ticker, LocalDate tradingDate, CompletableFuture<FetchOutcome> result) {
        try {
            acquire(ticker, result);
            return provider.fetchAverageVolume(ticker, settings.averageVolumeDays(), tradingDate)
                    .orElse(null);
        } catch (FetchException | RateLimitTimeoutException e) {
            log.warn("{}: average volume unavailable, continuing without it: {}", ticker, e.getMessage());
            return null;
        }
    }

    private List<PriceBar> bars(
            String ticker, Sampling sampling, LocalDate date, int limit, CompletableFuture<FetchOutcome> result) {
        try {
            acquire(ticker, result);
            return provider.fetchBars(ticker, sampling, date, limit);
        } catch (FetchException | RateLimitTimeoutException e) {
            log.warn("{}: {} bars unavailable: {}", ticker, sampling, e.getMessage());
            return List.of();
        }
    }

    private void acquire(String ticker, CompletableFuture<FetchOutcome> result) {
        if (result.isDone()) {
            throw new CancellationException(ticker + ": fetch already settled");
        }
        rateLimiter.acquire();
    }

    private FetchOutcome await(String ticker, CompletableFuture<FetchOutcome> future, RunDeadline deadline) {
        try {
            return future.get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{}: abandoned, {}", ticker, DEADLINE_REACHED);
            return FetchOutcome.failure(ticker, DEADLINE_REACHED);
        } catch (ExecutionException e) {
            return failure(ticker, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return FetchOutcome.failure(ticker, "interrupted");
        }
    }

    private FetchOutcome failure(String ticker, Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        var reason = cause instanceof TimeoutException
                ? "fetch timed out after " + settings.fetchTimeout().toMillis() + " ms"
                : Objects.requireNonNullElse(cause.getMessage(), cause.getClass().getSimpleName());
        log.warn("Fetch failed for {}: {}", ticker, reason);
        return FetchOutcome.failure(ticker, reason);
    }
}
