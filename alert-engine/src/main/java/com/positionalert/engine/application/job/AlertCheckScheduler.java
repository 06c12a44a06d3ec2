package com.positionalert.engine.application.job;

import com.positionalert.engine.application.config.AlertProperties;
import com.positionalert.engine.domain.run.AlertRunService;
import com.positionalert.engine.domain.run.RunDeadline;
import com.positionalert.engine.domain.run.RunSummary;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers alert checks on the configured cron and, optionally, once at startup.
 * At most one run is in flight per instance; a trigger arriving mid-run is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertCheckScheduler {

    private final AlertRunService alertRunService;
    private final AlertRunMetrics alertRunMetrics;
    private final AlertProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean();

    @Scheduled(cron = "${alert.schedule.cron}", zone = "${alert.schedule.zone}")
    public void scheduledRun() {
        runOnce("schedule");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.schedule().runOnStartup()) {
            runOnce("startup");
        }
    }

    public Optional<RunSummary> runOnce(String trigger) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Alert run from {} skipped: previous run still in progress", trigger);
            return Optional.empty();
        }
        try {
            log.info("Alert run starting (trigger={})", trigger);
            var deadline = RunDeadline.after(properties.run().timeLimit(), clock);
            var summary = alertRunService.run(deadline);
            alertRunMetrics.record(summary);
            return Optional.of(summary);
        } finally {
            running.set(false);
        }
    }
}
