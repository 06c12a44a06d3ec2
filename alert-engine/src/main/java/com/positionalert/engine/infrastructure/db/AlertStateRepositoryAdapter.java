package com.positionalert.engine.infrastructure.db;

import com.positionalert.common.id.UlidGenerator;
import com.positionalert.engine.domain.alert.AlertKey;
import com.positionalert.engine.domain.alert.AlertRecord;
import com.positionalert.engine.domain.alert.AlertStateStore;
import com.positionalert.engine.domain.exceptions.StoreException;
import com.positionalert.engine.infrastructure.db.mapper.AlertStateEntityMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL-backed dedup ledger. Rows past {@code expires_at} read as absent and are purged
 * by {@link com.positionalert.engine.application.job.AlertStateRetentionJob}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class AlertStateRepositoryAdapter implements AlertStateStore {

    private final AlertStateJpaRepository jpaRepository;
    private final AlertStateEntityMapper mapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public Optional<AlertRecord> find(AlertKey key) {
        try {
            return jpaRepository
                    .findActive(key.ticker(), key.tradingDate(), key.signal(), clock.instant())
                    .map(mapper::toDomain);
        } catch (DataAccessException | TransactionException e) {
            throw StoreException.readFailed(key.toString(), e);
        }
    }

    @Override
    public AlertRecord save(AlertKey key, BigDecimal percent, Duration ttl) {
        var now = clock.instant();
        var row = mapper.toEntity(AlertRecord.builder()
                .ticker(key.ticker())
                .tradingDate(key.tradingDate())
                .signal(key.signal())
                .lastAlertedPercent(percent)
                .alertCount(1)
                .alertedAt(now)
                .expiresAt(now.plus(ttl))
                .build());
        row.setId(UlidGenerator.generate(now));

        try {
            var saved = transactionTemplate.execute(status -> {
                jpaRepository.upsert(row);
                return jpaRepository.findActive(key.ticker(), key.tradingDate(), key.signal(), now)
                        .orElseThrow(() -> new IllegalStateException("Upserted row not readable: " + key));
            });
            log.debug("Saved alert state {} at {}% (count {})", key, percent, saved.getAlertCount());
            return mapper.toDomain(saved);
        } catch (DataAccessException | TransactionException | IllegalStateException e) {
            throw StoreException.writeFailed(key.toString(), e);
        }
    }

    @Override
    public int purgeExpired() {
        try {
            return transactionTemplate.execute(status -> jpaRepository.deleteExpired(clock.instant()));
        } catch (DataAccessException | TransactionException e) {
            throw StoreException.writeFailed("expired rows", e);
        }
    }
}
