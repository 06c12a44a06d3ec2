package com.positionalert.engine.application.job;

import com.positionalert.engine.domain.run.RunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AlertRunMetrics {

    private final Counter alertRunsCounter;
    private final Counter initialAlertsCounter;
    private final Counter incrementalAlertsCounter;
    private final Counter suppressedAlertsCounter;
    private final Counter snapshotsFetchedCounter;
    private final Counter snapshotsRejectedCounter;
    private final Counter runErrorsCounter;
    private final Counter alertsSentCounter;
    private final Counter alertsFailedCounter;
    private final Timer alertRunTimer;

    public void record(RunSummary summary) {
        alertRunsCounter.increment();
        initialAlertsCounter.increment(summary.initialAlerts());
        incrementalAlertsCounter.increment(summary.incrementalAlerts());
        suppressedAlertsCounter.increment(summary.suppressedAlerts());
        snapshotsFetchedCounter.increment(summary.snapshotsFetched());
        snapshotsRejectedCounter.increment(summary.snapshotsRejected());
        runErrorsCounter.increment(summary.errors().size());
        alertsSentCounter.increment(summary.alertsSent());
        alertsFailedCounter.increment(summary.alertsFailed());
        alertRunTimer.record(summary.duration());
    }
}
