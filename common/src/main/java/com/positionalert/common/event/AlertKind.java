package com.positionalert.common.event;

public enum AlertKind {
    /** First alert of the trading day for a ticker and signal. */
    INITIAL,
    /** Escalation after the move grew by at least one more step since the last alert. */
    INCREMENTAL
}
