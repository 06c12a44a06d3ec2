package com.positionalert.engine.domain.marketdata;

import com.positionalert.engine.domain.exceptions.FetchException;
import com.positionalert.engine.domain.run.RunDeadline;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.positionalert.engine.test.fixtures.MarketFixtures.SOME_INSTANT;
import static com.positionalert.engine.test.fixtures.MarketFixtures.SOME_TRADING_DATE;
import static com.positionalert.engine.test.fixtures.MarketFixtures.bars;
import static com.positionalert.engine.test.fixtures.MarketFixtures.fixedClock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class SnapshotFetcherTest {

    private static final FetchSettings SETTINGS = FetchSettings.builder()
            .fetchTimeout(Duration.ofMillis(200))
            .pricePrecedence(PricePrecedence.defaults())
            .averageVolumeDays(30)
            .minuteBarLimit(0)
            .secondBarLimit(0)
            .build();

    @Mock
    private MarketDataProvider provider;

    private ExecutorService executor;
    private SnapshotFetcher fetcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        fetcher = fetcher(SETTINGS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SnapshotFetcher fetcher(FetchSettings settings) {
        return new SnapshotFetcher(
                provider, new RateLimiter(1000, Duration.ofSeconds(5)), executor, settings, fixedClock());
    }

    private static RunDeadline generousDeadline() {
        return RunDeadline.after(Duration.ofSeconds(10), Clock.systemUTC());
    }

    private static QuoteFields quote(String ticker, Map<PriceSource, BigDecimal> prices) {
        return new QuoteFields(ticker, prices, new BigDecimal("100.00"), 1_000_000L);
    }

    private static QuoteFields minuteQuote(String ticker, String price) {
        return quote(ticker, Map.of(PriceSource.MINUTE_CLOSE, new BigDecimal(price)));
    }

    @Test
    void fetch_oneTickerTimesOut_onlyThatTickerFails() throws InterruptedException {
        // given
        given(provider.fetchTickerSnapshot("AAPL")).willReturn(minuteQuote("AAPL", "105.00"));
        given(provider.fetchTickerSnapshot("MSFT")).willReturn(minuteQuote("MSFT", "310.00"));
        given(provider.fetchTickerSnapshot("SLOW")).willAnswer(invocation -> {
            Thread.sleep(2_000);
            return minuteQuote("SLOW", "10.00");
        });
        given(provider.fetchAverageVolume(anyString(), eq(30), eq(SOME_TRADING_DATE)))
                .willReturn(Optional.of(500_000L));

        // when
        var outcomes = fetcher.fetch(List.of("AAPL", "MSFT", "SLOW"), generousDeadline());

        // then
        assertThat(outcomes).containsOnlyKeys("AAPL", "MSFT", "SLOW");
        assertThat(outcomes.values()).filteredOn(o -> !o.isSuccess()).singleElement()
                .satisfies(o -> assertThat(o.error().reason()).isEqualTo("fetch timed out after 200 ms"));
        assertThat(outcomes.get("AAPL").snapshot().currentPrice()).isEqualByComparingTo("105.00");
        assertThat(outcomes.get("AAPL").snapshot().averageVolume()).isEqualTo(500_000L);
        assertThat(outcomes.get("MSFT").isSuccess()).isTrue();

        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        then(provider).should(never()).fetchAverageVolume(eq("SLOW"), eq(30), eq(SOME_TRADING_DATE));
    }

    @Test
    void fetch_tickersQueuedBehindRateLimiter_timeoutStartsWhenWorkerPicksThemUp() {
        // given
        var tickers = IntStream.range(0, 10).mapToObj(i -> "T" + i).toList();
        var settings = SETTINGS.toBuilder().fetchTimeout(Duration.ofSeconds(1)).build();
        var pool = Executors.newFixedThreadPool(2);
        var throttled = new SnapshotFetcher(
                provider, new RateLimiter(10, Duration.ofSeconds(30)), pool, settings, fixedClock());
        given(provider.fetchTickerSnapshot(anyString()))
                .willAnswer(invocation -> minuteQuote(invocation.getArgument(0), "105.00"));
        given(provider.fetchAverageVolume(anyString(), eq(30), eq(SOME_TRADING_DATE))).willReturn(Optional.empty());

        try {
            // when
            var outcomes = throttled.fetch(tickers, generousDeadline());

            // then
            assertThat(outcomes).containsOnlyKeys(tickers);
            assertThat(outcomes.values()).allMatch(FetchOutcome::isSuccess);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void fetch_primaryPriceZero_fallsBackAndRecordsSource() {
        // given
        given(provider.fetchTickerSnapshot("AAPL")).willReturn(quote("AAPL", Map.of(
                PriceSource.MINUTE_CLOSE, BigDecimal.ZERO,
                PriceSource.LAST_QUOTE, new BigDecimal("101.20"),
                PriceSource.DAY_CLOSE, new BigDecimal("100.80"))));
        given(provider.fetchAverageVolume("AAPL", 30, SOME_TRADING_DATE)).willReturn(Optional.empty());

        // when
        var snapshot = fetcher.fetch(List.of("AAPL"), generousDeadline()).get("AAPL").snapshot();

        // then
        assertThat(snapshot.currentPrice()).isEqualByComparingTo("101.20");
        assertThat(snapshot.priceSource()).isEqualTo(PriceSource.LAST_QUOTE);
        assertThat(snapshot.priceFallback()).isTrue();
        assertThat(snapshot.averageVolume()).isNull();
    }

    @Test
    void fetch_noPositivePrice_keepsPrimaryValueForValidation() {
        // given
        given(provider.fetchTickerSnapshot("AAPL"))
                .willReturn(quote("AAPL", Map.of(PriceSource.MINUTE_CLOSE, BigDecimal.ZERO)));
        given(provider.fetchAverageVolume("AAPL", 30, SOME_TRADING_DATE)).willReturn(Optional.empty());

        // when
        var snapshot = fetcher.fetch(List.of("AAPL"), generousDeadline()).get("AAPL").snapshot();

        // then
        assertThat(snapshot.currentPrice()).isEqualByComparingTo("0");
        assertThat(snapshot.priceSource()).isEqualTo(PriceSource.MINUTE_CLOSE);
        assertThat(new DataValidator().validate(snapshot).isValid()).isFalse();
    }

    @Test
    void fetch_averageVolumeFails_snapshotStillSucceeds() {
        // given
        given(provider.fetchTickerSnapshot("AAPL")).willReturn(minuteQuote("AAPL", "105.00"));
        given(provider.fetchAverageVolume("AAPL", 30, SOME_TRADING_DATE))
                .willThrow(FetchException.forStatus("AAPL", 429));

        // when
        var outcome = fetcher.fetch(List.of("AAPL"), generousDeadline()).get("AAPL");

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.snapshot().averageVolume()).isNull();
    }

    @Test
    void fetch_providerError_becomesFetchError() {
        // given
        given(provider.fetchTickerSnapshot("AAPL")).willThrow(FetchException.forStatus("AAPL", 403));

        // when
        var outcome = fetcher.fetch(List.of("AAPL"), generousDeadline()).get("AAPL");

        // then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.error().reason()).contains("authentication failed");
    }

    @Test
    void fetch_indexTicker_usesIndexPath() {
        // given
        given(provider.fetchIndexSnapshot("$SPX")).willReturn(new QuoteFields(
                "$SPX", Map.of(PriceSource.INDEX_VALUE, new BigDecimal("5712.4")), new BigDecimal("5600.1"), null));

        // when
        var outcome = fetcher.fetch(List.of("$SPX"), generousDeadline()).get("$SPX");

        // then
        assertThat(outcome.snapshot().kind()).isEqualTo(InstrumentKind.INDEX);
        assertThat(outcome.snapshot().priceSource()).isEqualTo(PriceSource.INDEX_VALUE);
        assertThat(outcome.snapshot().currentPrice()).isEqualByComparingTo("5712.4");
        then(provider).should(never()).fetchTickerSnapshot(anyString());
    }

    @Test
    void fetch_deadlineReached_abandonsOutstandingWork() {
        // given
        var expired = new RunDeadline(SOME_INSTANT, fixedClock());
        lenient().when(provider.fetchTickerSnapshot("AAPL")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return minuteQuote("AAPL", "105.00");
        });

        // when
        var outcomes = fetcher(SETTINGS.toBuilder().fetchTimeout(Duration.ofSeconds(5)).build())
                .fetch(List.of("$SPX", "AAPL"), expired);

        // then
        assertThat(outcomes.values()).extracting(o -> o.error().reason())
                .containsOnly(SnapshotFetcher.DEADLINE_REACHED);
        then(provider).should(never()).fetchIndexSnapshot(anyString());
    }

    @Test
    void fetch_barsEnabled_loadsOnlyEnabledSampling() {
        // given
        var minuteBars = bars("100", "101", "102");
        given(provider.fetchTickerSnapshot("AAPL")).willReturn(minuteQuote("AAPL", "105.00"));
        given(provider.fetchAverageVolume("AAPL", 30, SOME_TRADING_DATE)).willReturn(Optional.of(500_000L));
        given(provider.fetchBars("AAPL", Sampling.MINUTE, SOME_TRADING_DATE, 390)).willReturn(minuteBars);

        // when
        var snapshot = fetcher(SETTINGS.toBuilder().minuteBarLimit(390).build())
                .fetch(List.of("AAPL"), generousDeadline()).get("AAPL").snapshot();

        // then
        assertThat(snapshot.minuteBars()).isEqualTo(minuteBars);
        assertThat(snapshot.secondBars()).isEmpty();
        then(provider).should(never()).fetchBars(anyString(), eq(Sampling.SECOND), eq(SOME_TRADING_DATE), eq(390));
    }
}
