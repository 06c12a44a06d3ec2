package com.positionalert.engine.domain.alert;

public enum DecisionOutcome {
    INITIAL,
    INCREMENTAL,
    SUPPRESSED,
    FAILED
}
