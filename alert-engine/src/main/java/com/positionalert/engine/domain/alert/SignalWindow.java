package com.positionalert.engine.domain.alert;

import com.positionalert.common.event.Direction;
import com.positionalert.engine.domain.marketdata.PriceBar;
import com.positionalert.engine.domain.marketdata.Sampling;
import com.positionalert.engine.domain.marketdata.Snapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One windowed-threshold alert rule.
 *
 * <p>The series is the close prices for {@link #sampling()}: previous close then current price
 * for {@code DAILY}, intraday bars otherwise. The move over a window of k steps is the sum of
 * its per-step percent changes. A direction qualifies when some window of {@code minSteps} to
 * {@code maxSteps} steps moved at least {@code threshold} that way; the measured value is the
 * largest such move. Alerting again under the same key needs a further {@code step}.
 */
public record SignalWindow(
        String name, Sampling sampling, int minSteps, int maxSteps, BigDecimal threshold, BigDecimal step) {

    public SignalWindow {
        if (minSteps < 1 || maxSteps < minSteps) {
            throw new IllegalArgumentException(
                    "Signal " + name + " needs 1 <= minSteps <= maxSteps, got " + minSteps + ".." + maxSteps);
        }
        if (threshold.signum() <= 0 || step.signum() <= 0) {
            throw new IllegalArgumentException("Signal " + name + " needs a positive threshold and step");
        }
    }

    public static SignalWindow daily(BigDecimal threshold, BigDecimal step) {
        return new SignalWindow("daily", Sampling.DAILY, 1, 1, threshold, step);
    }

    /** Intraday signals need bars, which indices and tickers without a session lack. */
    public boolean appliesTo(Snapshot snapshot) {
        return sampling == Sampling.DAILY || snapshot.bars(sampling).size() > minSteps;
    }

    /**
     * @return the signed move of the strongest qualifying window in {@code direction}, or empty
     *     when no window reaches the threshold that way
     */
    public Optional<BigDecimal> measure(Snapshot snapshot, Direction direction) {
        if (direction == Direction.FLAT) {
            return Optional.empty();
        }
        var steps = stepChanges(closes(snapshot));
        BigDecimal best = null;
        for (int size = minSteps; size <= maxSteps && size <= steps.size(); size++) {
            var sum = BigDecimal.ZERO;
            for (int i = 0; i < steps.size(); i++) {
                sum = sum.add(steps.get(i), MathContext.DECIMAL64);
                if (i >= size) {
                    sum = sum.subtract(steps.get(i - size), MathContext.DECIMAL64);
                }
                if (i >= size - 1 && qualifies(sum, direction) && (best == null || stronger(sum, best, direction))) {
                    best = sum;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private List<BigDecimal> closes(Snapshot snapshot) {
        if (sampling == Sampling.DAILY) {
            return List.of(snapshot.previousClose(), snapshot.currentPrice());
        }
        return snapshot.bars(sampling).stream().map(PriceBar::close).toList();
    }

    private static List<BigDecimal> stepChanges(List<BigDecimal> closes) {
        var changes = new ArrayList<BigDecimal>(Math.max(closes.size() - 1, 0));
        for (int i = 1; i < closes.size(); i++) {
            var previous = closes.get(i - 1);
            var current = closes.get(i);
            if (previous != null && current != null && previous.signum() > 0 && current.signum() > 0) {
                changes.add(MovementResult.percentChange(current, previous));
            }
        }
        return changes;
    }

    private boolean qualifies(BigDecimal move, Direction direction) {
        return direction == Direction.UP
                ? move.compareTo(threshold) >= 0
                : move.compareTo(threshold.negate()) <= 0;
    }

    private static boolean stronger(BigDecimal candidate, BigDecimal current, Direction direction) {
        return direction == Direction.UP ? candidate.compareTo(current) > 0 : candidate.compareTo(current) < 0;
    }
}
