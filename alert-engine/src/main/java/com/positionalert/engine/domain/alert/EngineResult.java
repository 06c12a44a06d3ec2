package com.positionalert.engine.domain.alert;

import com.positionalert.common.event.AlertEvent;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public record EngineResult(
        List<AlertEvent> events, int initialAlerts, int incrementalAlerts, int suppressedAlerts, List<String> errors) {

    public static EngineResult of(Collection<AlertDecision> decisions) {
        return new EngineResult(
                decisions.stream().filter(AlertDecision::isEmitted).map(AlertDecision::event).toList(),
                count(decisions, DecisionOutcome.INITIAL),
                count(decisions, DecisionOutcome.INCREMENTAL),
                count(decisions, DecisionOutcome.SUPPRESSED),
                decisions.stream()
                        .map(AlertDecision::error)
                        .filter(Objects::nonNull)
                        .toList());
    }

    private static int count(Collection<AlertDecision> decisions, DecisionOutcome outcome) {
        return (int) decisions.stream().filter(d -> d.outcome() == outcome).count();
    }
}
