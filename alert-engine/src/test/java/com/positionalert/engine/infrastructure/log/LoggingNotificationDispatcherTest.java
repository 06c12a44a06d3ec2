package com.positionalert.engine.infrastructure.log;

import com.positionalert.common.event.AlertKind;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

import static com.positionalert.engine.test.fixtures.AlertEventFixtures.initialAlertBuilder;
import static org.assertj.core.api.Assertions.assertThat;

class LoggingNotificationDispatcherTest {

    private final LoggingNotificationDispatcher dispatcher = new LoggingNotificationDispatcher();

    @Test
    void dispatch_reportsEveryEventSent() {
        var report = dispatcher.dispatch(List.of(initialAlertBuilder("AAPL").build(), initialAlertBuilder("MSFT").build()));

        assertThat(report.sent()).isEqualTo(2);
        assertThat(report.failed()).isZero();
    }

    @Test
    void render_initialAlert() {
        var text = LoggingNotificationDispatcher.render(initialAlertBuilder("AAPL").build());

        assertThat(text)
                .startsWith("INITIAL ALERT: AAPL UP 5.43% via daily")
                .contains("price 105.43 prev close 100.00 volume x2.00")
                .contains("1 positions at risk: 1x AAPL 110 CALL exp 2025-06-20");
    }

    @Test
    void render_incrementalAlert_showsPreviousLevel() {
        var event = initialAlertBuilder("AAPL")
                .kind(AlertKind.INCREMENTAL)
                .alertCount(2)
                .percentChange(new BigDecimal("10.004"))
                .previousAlertedPercent(new BigDecimal("5"))
                .volumeRatio(null)
                .build();

        var text = LoggingNotificationDispatcher.render(event);

        assertThat(text)
                .startsWith("INCREMENTAL ALERT #2: AAPL UP 10.00% (was 5.00%) via daily")
                .doesNotContain("volume x");
    }
}
