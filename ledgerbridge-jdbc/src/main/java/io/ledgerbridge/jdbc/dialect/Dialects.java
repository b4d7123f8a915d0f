package io.ledgerbridge.jdbc.dialect;

import io.ledgerbridge.jdbc.BridgeStoreException;
import io.ledgerbridge.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the dialects found on the classpath, looked up by name or by JDBC URL.
 *
 * <p>Dialects are loaded once via {@link ServiceLoader} from
 * {@code META-INF/services/io.ledgerbridge.jdbc.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect mysql = Dialects.detect("jdbc:mysql://localhost/bridge");
 * Dialect postgres = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();
  private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Objects.requireNonNull(name, "name");
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Detects the dialect from the URL of a connection borrowed from {@code dataSource}.
   *
   * @throws BridgeStoreException if no connection can be obtained
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static Dialect detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new BridgeStoreException("Failed to read JDBC URL from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Detects the dialect from a JDBC URL by prefix (case-insensitive).
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect matches it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return dialect;
        }
      }
    }
    throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + DIALECTS.stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList());
  }
}
