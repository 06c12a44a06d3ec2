package com.positionalert.engine.domain.run;

public enum RunStatus {
    SUCCESS,
    /** Some tickers failed but at least one snapshot was fetched. */
    PARTIAL_SUCCESS,
    FAILURE
}
