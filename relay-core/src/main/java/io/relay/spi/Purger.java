package io.relay.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes rows of one relay table that are no longer needed.
 *
 * <p>Each implementation decides what "old" means for its table: expired idempotency
 * keys, terminal deliveries past retention, processed inbound events past retention.
 *
 * @see io.relay.purge.PurgeScheduler
 */
public interface Purger {

    /**
     * Deletes up to {@code limit} eligible rows older than {@code before}.
     *
     * @param conn   the JDBC connection (caller controls transaction)
     * @param before cutoff instant
     * @param limit  maximum number of rows to delete in this batch
     * @return the number of rows actually deleted
     */
    int purge(Connection conn, Instant before, int limit);

    /**
     * Short label for log messages, such as {@code "idempotency_keys"}.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
