package io.ledgerbridge.jdbc.dialect;

import java.util.List;
import java.util.stream.Collectors;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String upsertSql(String table, List<String> keyColumns, List<String> valueColumns) {
    String updates = valueColumns.stream()
        .map(c -> c + " = EXCLUDED." + c)
        .collect(Collectors.joining(", "));
    return insertPrefix(table, allColumns(keyColumns, valueColumns))
        + " ON CONFLICT (" + columnList(keyColumns) + ") DO UPDATE SET " + updates;
  }
}
