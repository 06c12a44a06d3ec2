package com.positionalert.engine.application.job;

import com.positionalert.engine.domain.alert.AlertStateStore;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Deletes expired dedup records. Guarded by a transaction-scoped advisory lock so only one
 * instance purges at a time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertStateRetentionJob {

    private static final long ADVISORY_LOCK_ID = 2001L;

    private final AlertStateStore alertStateStore;
    private final EntityManager entityManager;

    @Scheduled(cron = "${alert.store.purge-cron}", zone = "${alert.store.purge-zone}")
    @Transactional
    public void purgeExpired() {
        if (!acquireAdvisoryLock()) {
            log.info("Alert state purge: another instance holds the lock, skipping");
            return;
        }
        var deleted = alertStateStore.purgeExpired();
        log.info("Alert state purge complete: {} expired records deleted", deleted);
    }

    private boolean acquireAdvisoryLock() {
        var result = entityManager
                .createNativeQuery("SELECT pg_try_advisory_xact_lock(:lockId)")
                .setParameter("lockId", ADVISORY_LOCK_ID)
                .getSingleResult();
        return Boolean.TRUE.equals(result);
    }
}
