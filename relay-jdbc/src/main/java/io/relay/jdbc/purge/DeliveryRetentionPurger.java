package io.relay.jdbc.purge;

import io.relay.jdbc.JdbcTemplate;
import io.relay.jdbc.TableNames;
import io.relay.model.DeliveryStatus;

import java.sql.Connection;
import java.time.Instant;

import static io.relay.jdbc.JdbcTemplate.ts;

/**
 * Deletes terminal deliveries (DELIVERED, FAILED_EXHAUSTED, CANCELLED) last updated before
 * the cutoff. Deliveries still waiting or in flight are never touched.
 */
public final class DeliveryRetentionPurger extends AbstractJdbcPurger {
  private static final String TERMINAL_STATUS_IN = "(" + DeliveryStatus.DELIVERED.code() + ","
      + DeliveryStatus.FAILED_EXHAUSTED.code() + "," + DeliveryStatus.CANCELLED.code() + ")";

  public DeliveryRetentionPurger() {
    this(TableNames.DEFAULT_DELIVERIES);
  }

  public DeliveryRetentionPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN + " AND updated_at<?" +
        " ORDER BY updated_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, ts(before), limit);
  }
}
