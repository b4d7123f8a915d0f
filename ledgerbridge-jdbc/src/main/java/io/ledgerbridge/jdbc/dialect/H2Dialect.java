package io.ledgerbridge.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
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
  public String upsertSql(String table, List<String> keyColumns, List<String> valueColumns) {
    List<String> columns = allColumns(keyColumns, valueColumns);
    return "MERGE INTO " + table + " (" + columnList(columns) + ") KEY (" + columnList(keyColumns) + ")"
        + " VALUES (" + placeholders(columns.size()) + ")";
  }
}
