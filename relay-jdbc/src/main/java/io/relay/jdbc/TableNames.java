package io.relay.jdbc;

import java.util.Objects;

/**
 * Names of the four relay tables, validated as plain SQL identifiers.
 *
 * @param idempotencyKeys idempotency records
 * @param endpoints       registered webhook endpoints
 * @param deliveries      outbound deliveries
 * @param events          inbound webhook events
 */
public record TableNames(String idempotencyKeys, String endpoints, String deliveries, String events) {
  public static final String DEFAULT_IDEMPOTENCY_KEYS = "idempotency_keys";
  public static final String DEFAULT_ENDPOINTS = "webhook_endpoints";
  public static final String DEFAULT_DELIVERIES = "webhook_deliveries";
  public static final String DEFAULT_EVENTS = "webhook_events";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public TableNames {
    validate(idempotencyKeys);
    validate(endpoints);
    validate(deliveries);
    validate(events);
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_IDEMPOTENCY_KEYS, DEFAULT_ENDPOINTS, DEFAULT_DELIVERIES, DEFAULT_EVENTS);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
