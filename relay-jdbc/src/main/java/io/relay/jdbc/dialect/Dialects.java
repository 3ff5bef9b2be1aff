package io.relay.jdbc.dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up the dialect for a database, by name, JDBC URL or connection metadata.
 *
 * <p>Dialects are loaded once via {@link ServiceLoader} from
 * {@code META-INF/services/io.relay.jdbc.dialect.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.detect("jdbc:postgresql://localhost/relay");
 * Dialect dialect = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME;

  static {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      byName.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
    BY_NAME = Map.copyOf(byName);
  }

  private Dialects() {
  }

  /** All registered dialects. */
  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * @param name dialect name (case-insensitive)
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Detects the dialect of the database behind a DataSource: first from the connection URL,
   * then from the reported product name.
   *
   * @throws IllegalStateException if no connection can be opened or no dialect matches
   */
  public static Dialect detect(DataSource dataSource) {
    String url;
    String product;
    try (Connection conn = dataSource.getConnection()) {
      DatabaseMetaData metaData = conn.getMetaData();
      url = metaData.getURL();
      product = metaData.getDatabaseProductName();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
    return byUrl(url)
        .or(() -> byProductName(product))
        .orElseThrow(() -> new IllegalStateException(
            "No dialect found for " + product + " at " + url + ". Available: " + BY_NAME.keySet()));
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or no dialect handles it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return byUrl(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Available: " + BY_NAME.keySet()));
  }

  private static Optional<Dialect> byUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    return BY_NAME.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst();
  }

  private static Optional<Dialect> byProductName(String product) {
    if (product == null) {
      return Optional.empty();
    }
    return BY_NAME.values().stream()
        .filter(d -> d.databaseProductName().equalsIgnoreCase(product))
        .findFirst();
  }
}
