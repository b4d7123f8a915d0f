package io.ledgerbridge.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Source of JDBC connections for the bridge stores. Each store operation borrows one
 * connection and closes it when done.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;

  /**
   * Borrows connections from a {@link DataSource}, usually a pool.
   */
  static ConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}
