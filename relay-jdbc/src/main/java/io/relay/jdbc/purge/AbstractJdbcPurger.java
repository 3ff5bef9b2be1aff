package io.relay.jdbc.purge;

import io.relay.jdbc.TableNames;
import io.relay.spi.Purger;

/**
 * Base JDBC purger holding the validated table name.
 *
 * @see IdempotencyKeyPurger
 * @see DeliveryRetentionPurger
 * @see IncomingEventRetentionPurger
 */
public abstract class AbstractJdbcPurger implements Purger {
  private final String tableName;

  protected AbstractJdbcPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  @Override
  public String name() {
    return tableName;
  }
}
