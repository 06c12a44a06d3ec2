package com.positionalert.engine.application.job;

import com.positionalert.engine.domain.run.AlertRunService;
import com.positionalert.engine.domain.run.RunDeadline;
import com.positionalert.engine.domain.run.RunSummary;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.positionalert.engine.test.fixtures.AlertPropertiesFixtures.alertProperties;
import static com.positionalert.engine.test.fixtures.MarketFixtures.SOME_INSTANT;
import static com.positionalert.engine.test.fixtures.MarketFixtures.fixedClock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class AlertCheckSchedulerTest {

    @Mock
    private AlertRunService alertRunService;

    @Mock
    private AlertRunMetrics alertRunMetrics;

    private AlertCheckScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AlertCheckScheduler(alertRunService, alertRunMetrics, alertProperties(), fixedClock());
    }

    private static RunSummary summary() {
        return RunSummary.builder().runId("run-1").startedAt(SOME_INSTANT).finishedAt(SOME_INSTANT).build();
    }

    @Test
    void runOnce_recordsMetricsAndDeadline() {
        // given
        var summary = summary();
        given(alertRunService.run(any())).willAnswer(invocation -> {
            var deadline = invocation.getArgument(0, RunDeadline.class);
            assertThat(deadline.at()).isEqualTo(SOME_INSTANT.plusSeconds(270));
            return summary;
        });

        // when
        var result = scheduler.runOnce("test");

        // then
        assertThat(result).contains(summary);
        then(alertRunMetrics).should().record(summary);
    }

    @Test
    void runOnce_whileRunInProgress_skips() throws Exception {
        // given
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        given(alertRunService.run(any())).willAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return summary();
        });
        var inFlight = CompletableFuture.supplyAsync(() -> scheduler.runOnce("schedule"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        var overlapping = scheduler.runOnce("schedule");
        release.countDown();

        // then
        assertThat(overlapping).isEmpty();
        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isPresent();
        then(alertRunService).should(times(1)).run(any());
    }

    @Test
    void onApplicationReady_startupRunDisabled_doesNothing() {
        scheduler.onApplicationReady();

        then(alertRunService).shouldHaveNoInteractions();
    }
}
