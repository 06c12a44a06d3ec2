package com.positionalert.engine.infrastructure.db;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface AlertStateJpaRepository extends JpaRepository<AlertStateEntity, String> {

    @Query("SELECT s FROM AlertStateEntity s WHERE s.ticker = :ticker AND s.tradingDate = :tradingDate"
            + " AND s.signal = :signal AND s.expiresAt > :now")
    Optional<AlertStateEntity> findActive(String ticker, LocalDate tradingDate, String signal, Instant now);

    /**
     * Inserts the row, or overwrites the existing row for the same key. The count restarts at 1
     * when the stored row had already expired.
     */
    @Modifying
    @Query(
            value =
                    "INSERT INTO alert_state (id, ticker, trading_date, signal_name, last_alerted_percent,"
                        + " alert_count, alerted_at, expires_at) VALUES (:#{#row.id}, :#{#row.ticker},"
                        + " :#{#row.tradingDate}, :#{#row.signal}, :#{#row.lastAlertedPercent}, 1,"
                        + " :#{#row.alertedAt}, :#{#row.expiresAt}) ON CONFLICT (ticker, trading_date,"
                        + " signal_name) DO UPDATE SET last_alerted_percent = EXCLUDED.last_alerted_percent,"
                        + " alert_count = CASE WHEN alert_state.expires_at > EXCLUDED.alerted_at"
                        + " THEN alert_state.alert_count + 1 ELSE 1 END,"
                        + " alerted_at = EXCLUDED.alerted_at, expires_at = EXCLUDED.expires_at",
            nativeQuery = true)
    int upsert(AlertStateEntity row);

    @Modifying
    @Query("DELETE FROM AlertStateEntity s WHERE s.expiresAt <= :now")
    int deleteExpired(Instant now);
}
