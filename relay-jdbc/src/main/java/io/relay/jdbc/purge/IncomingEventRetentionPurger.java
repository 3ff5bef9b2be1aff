package io.relay.jdbc.purge;

import io.relay.jdbc.JdbcTemplate;
import io.relay.jdbc.TableNames;
import io.relay.model.IncomingEventStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static io.relay.jdbc.JdbcTemplate.ts;

/**
 * Deletes PROCESSED inbound events processed before the cutoff. ERROR events stay until an
 * operator deals with them; their dedup key keeps protecting against sender retries.
 */
public final class IncomingEventRetentionPurger extends AbstractJdbcPurger {
  private static final int PROCESSED = IncomingEventStatus.PROCESSED.code();

  public IncomingEventRetentionPurger() {
    this(TableNames.DEFAULT_EVENTS);
  }

  public IncomingEventRetentionPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String selectSql = "SELECT source, event_id FROM " + tableName() +
        " WHERE status=" + PROCESSED + " AND processed_at<? ORDER BY processed_at LIMIT ?";
    List<String[]> keys = JdbcTemplate.query(conn, selectSql,
        rs -> new String[]{rs.getString("source"), rs.getString("event_id")}, ts(before), limit);
    String deleteSql = "DELETE FROM " + tableName() +
        " WHERE source=? AND event_id=? AND status=" + PROCESSED;
    int deleted = 0;
    for (String[] key : keys) {
      deleted += JdbcTemplate.update(conn, deleteSql, key[0], key[1]);
    }
    return deleted;
  }
}
