package com.positionalert.engine.domain.alert;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Durable dedup ledger. Reads after a write of the same key from this process see the write.
 * Expiry is the store's job; expired records read as absent.
 *
 * <p>All operations throw {@link com.positionalert.engine.domain.exceptions.StoreException}
 * on failure.
 */
public interface AlertStateStore {

    Optional<AlertRecord> find(AlertKey key);

    /** Creates or replaces the record, bumping its alert count and resetting its expiry to now + ttl. */
    AlertRecord save(AlertKey key, BigDecimal percent, Duration ttl);

    /** Removes expired records and returns how many went. */
    int purgeExpired();
}
