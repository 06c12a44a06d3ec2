package com.positionalert.engine.domain.dispatch;

import java.util.List;

public record DispatchReport(int sent, int failed, List<String> errors) {

    public DispatchReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static DispatchReport empty() {
        return new DispatchReport(0, 0, List.of());
    }
}
