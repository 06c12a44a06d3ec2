package com.positionalert.engine.domain.alert;

import com.positionalert.common.event.AlertEvent;
import com.positionalert.common.event.Direction;

/**
 * Result of one signal crossing its threshold for a ticker and direction.
 *
 * @param event the alert to dispatch, null unless the outcome is INITIAL or INCREMENTAL
 * @param error store or evaluation failure met on the way, may accompany an event under FAIL_OPEN
 */
public record AlertDecision(
        String ticker, Direction direction, String signal, DecisionOutcome outcome, AlertEvent event, String error) {

    public static AlertDecision emitted(AlertEvent event, DecisionOutcome outcome, String error) {
        return new AlertDecision(event.ticker(), event.direction(), event.signal(), outcome, event, error);
    }

    public static AlertDecision suppressed(AlertKey key, Direction direction, String error) {
        return new AlertDecision(key.ticker(), direction, key.signal(), DecisionOutcome.SUPPRESSED, null, error);
    }

    public static AlertDecision failed(String ticker, String error) {
        return new AlertDecision(ticker, null, null, DecisionOutcome.FAILED, null, error);
    }

    public boolean isEmitted() {
        return event != null;
    }
}
