package com.positionalert.engine.domain.alert;

/** What the engine does when the alert state store cannot be read or written. */
public enum StoreFailurePolicy {
    /** Send anyway and accept a possible duplicate. */
    FAIL_OPEN,
    /** Suppress the alert rather than risk a duplicate. */
    FAIL_CLOSED
}
