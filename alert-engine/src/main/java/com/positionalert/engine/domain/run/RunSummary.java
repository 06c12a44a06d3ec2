package com.positionalert.engine.domain.run;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record RunSummary(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        int positionsChecked,
        int tickersRequested,
        int snapshotsFetched,
        int snapshotsRejected,
        int initialAlerts,
        int incrementalAlerts,
        int suppressedAlerts,
        int alertsSent,
        int alertsFailed,
        List<String> errors) {

    public RunSummary {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public RunStatus status() {
        if (errors.isEmpty()) {
            return RunStatus.SUCCESS;
        }
        return snapshotsFetched > 0 ? RunStatus.PARTIAL_SUCCESS : RunStatus.FAILURE;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public String toLogLine() {
        return "runId=" + runId
                + " status=" + status()
                + " positions=" + positionsChecked
                + " tickers=" + tickersRequested
                + " fetched=" + snapshotsFetched
                + " rejected=" + snapshotsRejected
                + " initial=" + initialAlerts
                + " incremental=" + incrementalAlerts
                + " suppressed=" + suppressedAlerts
                + " sent=" + alertsSent
                + " failed=" + alertsFailed
                + " errors=" + errors.size()
                + " durationMs=" + duration().toMillis();
    }
}
