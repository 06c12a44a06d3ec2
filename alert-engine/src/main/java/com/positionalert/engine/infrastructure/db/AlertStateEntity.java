package com.positionalert.engine.infrastructure.db;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "alert_state",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_alert_state_key", columnNames = {"ticker", "trading_date", "signal_name"}))
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertStateEntity {

    @Id
    @Column(length = 26)
    private String id;

    @Column(nullable = false, length = 16)
    private String ticker;

    @Column(name = "trading_date", nullable = false)
    private LocalDate tradingDate;

    @Column(name = "signal_name", nullable = false, length = 32)
    private String signal;

    @Column(name = "last_alerted_percent", nullable = false, precision = 12, scale = 6)
    private BigDecimal lastAlertedPercent;

    @Column(name = "alert_count", nullable = false)
    private int alertCount;

    @Column(name = "alerted_at", nullable = false)
    private Instant alertedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
