package com.positionalert.engine.domain.run;

import com.positionalert.common.event.AlertEvent;
import com.positionalert.common.id.UlidGenerator;
import com.positionalert.engine.domain.alert.AlertEngine;
import com.positionalert.engine.domain.dispatch.DispatchReport;
import com.positionalert.engine.domain.dispatch.NotificationDispatcher;
import com.positionalert.engine.domain.exceptions.PositionsParseException;
import com.positionalert.engine.domain.marketdata.DataValidator;
import com.positionalert.engine.domain.marketdata.Snapshot;
import com.positionalert.engine.domain.marketdata.SnapshotFetcher;
import com.positionalert.engine.domain.position.PositionIndex;
import com.positionalert.engine.domain.position.PositionSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One alert check: load positions, fetch and validate snapshots, decide alerts, dispatch.
 * Per-ticker failures land in the summary; only an unreadable positions source ends the run early.
 */
@Slf4j
@RequiredArgsConstructor
public class AlertRunService {

    private final PositionSource positionSource;
    private final SnapshotFetcher snapshotFetcher;
    private final DataValidator dataValidator;
    private final AlertEngine alertEngine;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    public RunSummary run(RunDeadline deadline) {
        var runId = UlidGenerator.generate();
        var summary = RunSummary.builder().runId(runId).startedAt(clock.instant());
        log.info("Alert run {} started, deadline {}", runId, deadline.at());

        PositionIndex index;
        try {
            index = PositionIndex.of(positionSource.load());
        } catch (PositionsParseException e) {
            log.error("Alert run {} aborted: {}", runId, e.getMessage(), e);
            return finish(summary.errors(List.of(e.getMessage())));
        }
        summary.positionsChecked(index.positionCount()).tickersRequested(index.tickers().size());
        if (index.isEmpty()) {
            log.info("Alert run {}: no positions to check", runId);
            return finish(summary);
        }

        var errors = new ArrayList<String>();
        var valid = new ArrayList<Snapshot>();
        int fetched = 0;
        int rejected = 0;
        for (var outcome : snapshotFetcher.fetch(index.tickers(), deadline).values()) {
            if (!outcome.isSuccess()) {
                errors.add(outcome.error().toString());
                continue;
            }
            fetched++;
            var validation = dataValidator.validate(outcome.snapshot());
            if (validation.isValid()) {
                valid.add(validation.snapshot());
            } else {
                rejected++;
            }
        }

        var engineResult = alertEngine.evaluateAll(valid, index);
        errors.addAll(engineResult.errors());

        var report = dispatch(engineResult.events());
        errors.addAll(report.errors());

        return finish(summary
                .snapshotsFetched(fetched)
                .snapshotsRejected(rejected)
                .initialAlerts(engineResult.initialAlerts())
                .incrementalAlerts(engineResult.incrementalAlerts())
                .suppressedAlerts(engineResult.suppressedAlerts())
                .alertsSent(report.sent())
                .alertsFailed(report.failed())
                .errors(errors));
    }

    private DispatchReport dispatch(List<AlertEvent> events) {
        if (events.isEmpty()) {
            return DispatchReport.empty();
        }
        try {
            return dispatcher.dispatch(events);
        } catch (RuntimeException e) {
            log.error("Dispatch of {} alerts failed", events.size(), e);
            return new DispatchReport(0, events.size(), List.of("dispatch failed: " + e.getMessage()));
        }
    }

    private RunSummary finish(RunSummary.RunSummaryBuilder builder) {
        var summary = builder.finishedAt(clock.instant()).build();
        if (summary.status() == RunStatus.SUCCESS) {
            log.info("Alert run finished: {}", summary.toLogLine());
        } else {
            log.warn("Alert run finished: {}", summary.toLogLine());
        }
        for (var error : summary.errors()) {
            log.warn("Run {} error: {}", summary.runId(), error);
        }
        return summary;
    }
}
