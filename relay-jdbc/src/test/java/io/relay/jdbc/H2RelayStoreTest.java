package io.relay.jdbc;

import io.relay.jdbc.dialect.H2Dialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;

class H2RelayStoreTest extends AbstractRelayStoreIntegrationTest {
  private JdbcDataSource dataSource;
  private JdbcRelayStores stores;

  @BeforeEach
  void setUp() {
    dataSource = Schemas.h2("stores");
    stores = JdbcRelayStores.create(new H2Dialect(), TableNames.defaults());
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  JdbcRelayStores stores() {
    return stores;
  }
}
