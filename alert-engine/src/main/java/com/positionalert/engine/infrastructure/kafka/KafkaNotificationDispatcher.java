package com.positionalert.engine.infrastructure.kafka;

import com.positionalert.common.event.AlertEvent;
import com.positionalert.common.kafka.KafkaTopics;
import com.positionalert.engine.application.config.AlertProperties;
import com.positionalert.engine.domain.dispatch.DispatchReport;
import com.positionalert.engine.domain.dispatch.NotificationDispatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

/**
 * Publishes alert events to the position-alerts topic, keyed by ticker so a ticker's alerts
 * stay ordered. Waits for broker acks so the run summary can count what was delivered.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "alert.dispatch.mode", havingValue = "kafka", matchIfMissing = true)
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, AlertEvent> kafkaTemplate;
    private final long sendTimeoutMillis;

    public KafkaNotificationDispatcher(
            KafkaTemplate<String, AlertEvent> alertEventKafkaTemplate, AlertProperties properties) {
        this.kafkaTemplate = alertEventKafkaTemplate;
        this.sendTimeoutMillis = properties.dispatch().sendTimeout().toMillis();
    }

    @Override
    public DispatchReport dispatch(List<AlertEvent> events) {
        var pending = new LinkedHashMap<AlertEvent, CompletableFuture<SendResult<String, AlertEvent>>>();
        var errors = new ArrayList<String>();
        for (var event : events) {
            try {
                pending.put(event, kafkaTemplate.send(KafkaTopics.POSITION_ALERTS, event.ticker(), event));
            } catch (RuntimeException e) {
                // serialization errors and metadata timeouts surface before a future exists
                log.error("Failed to hand alert {} for {} to the producer: {}",
                        event.eventId(), event.ticker(), e.getMessage());
                errors.add(event.ticker() + ": dispatch failed: " + e.getMessage());
            }
        }

        int sent = 0;
        for (var entry : pending.entrySet()) {
            var event = entry.getKey();
            try {
                var result = entry.getValue().get(sendTimeoutMillis, TimeUnit.MILLISECONDS);
                log.debug("Produced alert {} for {} to partition {}",
                        event.eventId(), event.ticker(), result.getRecordMetadata().partition());
                sent++;
            } catch (ExecutionException | TimeoutException e) {
                log.error("Failed to produce alert {} for {}: {}", event.eventId(), event.ticker(), e.getMessage());
                errors.add(event.ticker() + ": dispatch failed: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add(event.ticker() + ": dispatch interrupted");
            }
        }
        log.info("Dispatched {} of {} alerts to {}", sent, events.size(), KafkaTopics.POSITION_ALERTS);
        return new DispatchReport(sent, events.size() - sent, errors);
    }
}
