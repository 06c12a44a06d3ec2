package com.positionalert.engine.domain.marketdata;

import java.util.Set;

public record ValidationResult(String ticker, Snapshot snapshot, Set<RejectionReason> reasons) {

    public static ValidationResult valid(Snapshot snapshot) {
        return new ValidationResult(snapshot.ticker(), snapshot, Set.of());
    }

    public static ValidationResult rejected(String ticker, Set<RejectionReason> reasons) {
        return new ValidationResult(ticker, null, Set.copyOf(reasons));
    }

    public boolean isValid() {
        return snapshot != null;
    }
}
