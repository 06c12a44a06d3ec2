package com.positionalert.engine.infrastructure.log;

import com.positionalert.common.event.AlertEvent;
import com.positionalert.common.event.AlertKind;
import com.positionalert.common.position.Position;
import com.positionalert.engine.domain.dispatch.DispatchReport;
import com.positionalert.engine.domain.dispatch.NotificationDispatcher;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Local testing mode: writes each alert to the log instead of sending it anywhere. */
@Slf4j
@Component
@ConditionalOnProperty(name = "alert.dispatch.mode", havingValue = "log")
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public DispatchReport dispatch(List<AlertEvent> events) {
        events.forEach(event -> log.info("{}", render(event)));
        return new DispatchReport(events.size(), 0, List.of());
    }

    static String render(AlertEvent event) {
        var headline = event.kind() == AlertKind.INCREMENTAL
                ? String.format("INCREMENTAL ALERT #%d: %s %s %s%% (was %s%%) via %s",
                        event.alertCount(), event.ticker(), event.direction(),
                        percent(event.percentChange()),
                        event.previousAlertedPercent() == null ? "?" : percent(event.previousAlertedPercent()),
                        event.signal())
                : String.format("INITIAL ALERT: %s %s %s%% via %s",
                        event.ticker(), event.direction(), percent(event.percentChange()), event.signal());
        var positions = event.positions().stream()
                .map(LoggingNotificationDispatcher::describe)
                .collect(Collectors.joining("; "));
        return headline
                + " | price " + event.currentPrice().toPlainString()
                + " prev close " + event.previousClose().toPlainString()
                + (event.volumeRatio() == null ? "" : " volume x" + event.volumeRatio().toPlainString())
                + " | " + event.positions().size() + " positions at risk: " + positions;
    }

    private static String percent(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String describe(Position position) {
        return position.quantity() + "x " + position.ticker() + " "
                + (position.strike() == null ? "?" : position.strike().toPlainString())
                + " " + position.optionType() + " exp " + position.expiration();
    }
}
