package com.positionalert.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.positionalert.common.position.Position;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

/**
 * A decided alert for one ticker and direction, carrying every position that watches that
 * direction. Published to {@link com.positionalert.common.kafka.KafkaTopics#POSITION_ALERTS}
 * keyed by ticker.
 */
@Builder(toBuilder = true)
public record AlertEvent(
        @JsonProperty("event_id") String eventId,
        String ticker,
        Direction direction,
        AlertKind kind,
        String signal,
        @JsonProperty("percent_change") BigDecimal percentChange,
        @JsonProperty("previous_alerted_percent") BigDecimal previousAlertedPercent,
        @JsonProperty("current_price") BigDecimal currentPrice,
        @JsonProperty("previous_close") BigDecimal previousClose,
        Long volume,
        @JsonProperty("average_volume") Long averageVolume,
        @JsonProperty("volume_ratio") BigDecimal volumeRatio,
        @JsonProperty("price_source") String priceSource,
        @JsonProperty("price_fallback") boolean priceFallback,
        @JsonProperty("alert_count") int alertCount,
        List<Position> positions,
        @JsonProperty("trading_date") LocalDate tradingDate,
        @JsonProperty("triggered_at") Instant triggeredAt) {

    public AlertEvent {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
