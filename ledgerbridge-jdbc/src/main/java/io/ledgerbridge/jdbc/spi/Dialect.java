package io.ledgerbridge.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific upsert used by the vote store. Register custom dialects via
 * {@code META-INF/services/io.ledgerbridge.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see io.ledgerbridge.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL that inserts a row, or overwrites the value columns of the row with the same key.
   *
   * <p>Parameters: the key columns, then the value columns, in the given order.
   */
  String upsertSql(String table, List<String> keyColumns, List<String> valueColumns);
}
