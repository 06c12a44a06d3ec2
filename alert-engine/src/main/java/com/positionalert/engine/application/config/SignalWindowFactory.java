package com.positionalert.engine.application.config;

import com.positionalert.engine.domain.alert.SignalWindow;
import com.positionalert.engine.domain.exceptions.ConfigurationException;
import com.positionalert.engine.domain.marketdata.Sampling;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/** Builds the alert signals in priority order: daily, then seconds windows, then minutes. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class SignalWindowFactory {

    static List<SignalWindow> fromProperties(AlertProperties properties) {
        var signals = new ArrayList<SignalWindow>();
        signals.add(build("alert.threshold-percent", () ->
                SignalWindow.daily(properties.thresholdPercent(), properties.effectiveIncrementalStep())));

        var config = properties.signals();
        if (config.secondsEnabled()) {
            for (var window : config.seconds()) {
                signals.add(window(window, Sampling.SECOND));
            }
        }
        if (config.minutesEnabled()) {
            signals.add(window(config.minutes(), Sampling.MINUTE));
        }

        var names = signals.stream().map(SignalWindow::name).distinct().count();
        if (names != signals.size()) {
            throw ConfigurationException.invalid("alert.signals", "signal names must be unique");
        }
        return signals;
    }

    private static SignalWindow window(AlertProperties.Window window, Sampling sampling) {
        var step = window.stepPercent() != null ? window.stepPercent() : window.thresholdPercent();
        return build("alert.signals." + window.name(), () -> new SignalWindow(
                window.name(), sampling, window.minSteps(), window.maxSteps(), window.thresholdPercent(), step));
    }

    private static SignalWindow build(String setting, Supplier<SignalWindow> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw ConfigurationException.invalid(setting, e.getMessage());
        }
    }
}
