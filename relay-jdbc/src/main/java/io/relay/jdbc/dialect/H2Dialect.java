package io.relay.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>Duplicate inserts fail with SQLState {@code 23505}, which the stores treat as
 * "already present". H2 does not abort the surrounding transaction on that error.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String databaseProductName() {
    return "H2";
  }
}
