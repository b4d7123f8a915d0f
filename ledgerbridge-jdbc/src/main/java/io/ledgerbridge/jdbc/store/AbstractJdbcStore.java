package io.ledgerbridge.jdbc.store;

import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.jdbc.BridgeStoreException;
import io.ledgerbridge.jdbc.ConnectionProvider;
import io.ledgerbridge.jdbc.TableNames;
import io.ledgerbridge.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base of the JDBC stores: borrows one auto-commit connection per operation and binds the
 * bridge's value types.
 *
 * <p>Hashes are stored as lowercase hex, instants as {@code TIMESTAMP}.
 */
abstract class AbstractJdbcStore {
  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String table;

  AbstractJdbcStore(ConnectionProvider connectionProvider, Dialect dialect, String table) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
  }

  protected Dialect dialect() {
    return dialect;
  }

  protected String table() {
    return table;
  }

  protected <T> T withConnection(String action, SqlWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.execute(conn);
    } catch (SQLException e) {
      throw new BridgeStoreException("Failed to " + action + " in " + table, e);
    }
  }

  protected static int update(Connection conn, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      return ps.executeUpdate();
    }
  }

  protected static <T> List<T> list(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> rows = new ArrayList<>();
        while (rs.next()) {
          rows.add(mapper.map(rs));
        }
        return rows;
      }
    }
  }

  /** Maps the first row of a keyed lookup. */
  protected static <T> Optional<T> first(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
      }
    }
  }

  private static void bind(PreparedStatement ps, Object[] params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      int index = i + 1;
      Object param = params[i];
      if (param instanceof PayloadHash hash) {
        ps.setString(index, hash.toHex());
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(index, Timestamp.from(instant));
      } else if (param instanceof Long n) {
        ps.setLong(index, n);
      } else if (param instanceof Integer n) {
        ps.setInt(index, n);
      } else if (param instanceof byte[] bytes) {
        ps.setBytes(index, bytes);
      } else {
        ps.setObject(index, param);
      }
    }
  }

  @FunctionalInterface
  protected interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }

  @FunctionalInterface
  protected interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }
}
