package com.positionalert.engine.domain.alert;

import com.positionalert.common.event.AlertEvent;
import com.positionalert.common.event.AlertKind;
import com.positionalert.common.event.Direction;
import com.positionalert.common.id.UlidGenerator;
import com.positionalert.common.position.Position;
import com.positionalert.engine.domain.exceptions.StoreException;
import com.positionalert.engine.domain.marketdata.InstrumentKind;
import com.positionalert.engine.domain.marketdata.Sampling;
import com.positionalert.engine.domain.marketdata.Snapshot;
import com.positionalert.engine.domain.position.PositionIndex;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns validated snapshots into alert decisions against the dedup ledger.
 *
 * <p>Per ticker and watched direction, signals are tried in priority order. A signal that
 * crosses its threshold with no ledger record gives an initial alert; with a record, it gives
 * an incremental alert once the move has grown by at least the signal's step since the last
 * alert, and is suppressed otherwise. The first signal that emits ends the search for that
 * direction. The ledger is written before the event is released. Intraday windows are only
 * tried once the daily move in that direction has reached the daily threshold.
 *
 * <p>Tickers are evaluated concurrently; within one {@link #evaluateAll} call each ticker's
 * read-modify-write runs under its own lock.
 */
@Slf4j
public class AlertEngine {

    private static final ZoneId NY_ZONE = ZoneId.of("America/New_York");

    private final AlertStateStore store;
    private final List<SignalWindow> signals;
    private final StoreFailurePolicy failurePolicy;
    private final Duration recordTtl;
    private final Executor executor;
    private final Clock clock;

    public AlertEngine(
            AlertStateStore store,
            List<SignalWindow> signals,
            StoreFailurePolicy failurePolicy,
            Duration recordTtl,
            Executor executor,
            Clock clock) {
        if (signals.isEmpty()) {
            throw new IllegalArgumentException("At least one signal is required");
        }
        this.store = store;
        this.signals = List.copyOf(signals);
        this.failurePolicy = failurePolicy;
        this.recordTtl = recordTtl;
        this.executor = executor;
        this.clock = clock;
    }

    public EngineResult evaluateAll(Collection<Snapshot> snapshots, PositionIndex index) {
        var tickerLocks = new ConcurrentHashMap<String, ReentrantLock>();
        var futures = snapshots.stream()
                .map(snapshot -> CompletableFuture
                        .supplyAsync(() -> evaluate(snapshot, index, tickerLocks), executor)
                        .exceptionally(ex -> {
                            log.error("Alert evaluation failed for {}", snapshot.ticker(), ex);
                            return List.of(AlertDecision.failed(snapshot.ticker(),
                                    snapshot.ticker() + ": evaluation failed: " + ex.getMessage()));
                        }))
                .toList();

        var decisions = new ArrayList<AlertDecision>();
        futures.forEach(future -> decisions.addAll(future.join()));
        var result = EngineResult.of(decisions);
        log.info("Alert evaluation: {} tickers, {} initial, {} incremental, {} suppressed, {} errors",
                snapshots.size(), result.initialAlerts(), result.incrementalAlerts(),
                result.suppressedAlerts(), result.errors().size());
        return result;
    }

    /** Decisions for one ticker; empty when no watched direction crossed any threshold. */
    public List<AlertDecision> evaluate(Snapshot snapshot, PositionIndex index) {
        return evaluate(snapshot, index, new ConcurrentHashMap<>());
    }

    private List<AlertDecision> evaluate(
            Snapshot snapshot, PositionIndex index, ConcurrentMap<String, ReentrantLock> tickerLocks) {
        var ticker = snapshot.ticker();
        var directions = index.watchedDirections(ticker);
        if (directions.isEmpty()) {
            return List.of();
        }

        var movement = MovementResult.of(ticker, snapshot.currentPrice(), snapshot.previousClose());
        log.debug("{}: {}% ({}), watching {}", ticker, movement.percentChange(), movement.direction(), directions);
        var tradingDate = LocalDate.ofInstant(clock.instant(), NY_ZONE);

        var lock = tickerLocks.computeIfAbsent(ticker, k -> new ReentrantLock());
        lock.lock();
        try {
            var decisions = new ArrayList<AlertDecision>();
            for (var direction : directions) {
                decisions.addAll(evaluateDirection(snapshot, direction, index.matching(ticker, direction), tradingDate));
            }
            return decisions;
        } finally {
            lock.unlock();
        }
    }

    private List<AlertDecision> evaluateDirection(
            Snapshot snapshot, Direction direction, List<Position> positions, LocalDate tradingDate) {
        var decisions = new ArrayList<AlertDecision>();
        for (var signal : signals) {
            if (!signal.appliesTo(snapshot)) {
                continue;
            }
            var measured = signal.measure(snapshot, direction);
            if (measured.isEmpty()) {
                if (signal.sampling() == Sampling.DAILY) {
                    log.debug("{}: daily threshold not met {}, intraday windows skipped", snapshot.ticker(), direction);
                    return decisions;
                }
                continue;
            }
            var decision = decide(snapshot, direction, signal, measured.get(), positions, tradingDate);
            decisions.add(decision);
            if (decision.isEmitted()) {
                break;
            }
        }
        return decisions;
    }

    private AlertDecision decide(
            Snapshot snapshot,
            Direction direction,
            SignalWindow signal,
            BigDecimal percent,
            List<Position> positions,
            LocalDate tradingDate) {
        var key = new AlertKey(snapshot.ticker(), tradingDate, signal.name());
        String storeError = null;

        AlertRecord existing;
        try {
            existing = store.find(key).orElse(null);
        } catch (StoreException e) {
            log.warn("Alert state read failed for {}, policy {}: {}", key, failurePolicy, e.getMessage());
            storeError = key + ": " + e.getMessage();
            if (failurePolicy == StoreFailurePolicy.FAIL_CLOSED) {
                return AlertDecision.suppressed(key, direction, storeError);
            }
            existing = null;
        }

        var kind = AlertKind.INITIAL;
        BigDecimal previousPercent = null;
        if (existing != null) {
            previousPercent = existing.lastAlertedPercent();
            var delta = percent.abs().subtract(previousPercent.abs());
            if (delta.compareTo(signal.step()) < 0) {
                log.debug("{}: suppressed, {}% is {} past last alert at {}%, step {}",
                        key, percent, delta, previousPercent, signal.step());
                return AlertDecision.suppressed(key, direction, storeError);
            }
            kind = AlertKind.INCREMENTAL;
        }

        int alertCount;
        try {
            alertCount = store.save(key, percent, recordTtl).alertCount();
        } catch (StoreException e) {
            log.warn("Alert state write failed for {}, policy {}: {}", key, failurePolicy, e.getMessage());
            storeError = key + ": " + e.getMessage();
            if (failurePolicy == StoreFailurePolicy.FAIL_CLOSED) {
                return AlertDecision.suppressed(key, direction, storeError);
            }
            alertCount = existing == null ? 1 : existing.alertCount() + 1;
        }

        var event = AlertEvent.builder()
                .eventId(UlidGenerator.generate())
                .ticker(snapshot.ticker())
                .direction(direction)
                .kind(kind)
                .signal(signal.name())
                .percentChange(percent)
                .previousAlertedPercent(previousPercent)
                .currentPrice(snapshot.currentPrice())
                .previousClose(snapshot.previousClose())
                .volume(snapshot.kind() == InstrumentKind.INDEX ? null : snapshot.volume())
                .averageVolume(snapshot.averageVolume())
                .volumeRatio(snapshot.volumeRatio())
                .priceSource(snapshot.priceSource() == null ? null : snapshot.priceSource().name())
                .priceFallback(snapshot.priceFallback())
                .alertCount(alertCount)
                .positions(positions)
                .tradingDate(tradingDate)
                .triggeredAt(clock.instant())
                .build();

        log.info("{} alert #{} for {} {} on {}: {}% ({} positions)",
                kind, alertCount, snapshot.ticker(), direction, signal.name(), percent, positions.size());
        var outcome = kind == AlertKind.INITIAL ? DecisionOutcome.INITIAL : DecisionOutcome.INCREMENTAL;
        return AlertDecision.emitted(event, outcome, storeError);
    }
}
