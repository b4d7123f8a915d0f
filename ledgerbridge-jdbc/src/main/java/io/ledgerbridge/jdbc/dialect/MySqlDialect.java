package io.ledgerbridge.jdbc.dialect;

import java.util.List;
import java.util.stream.Collectors;

/**
 * MySQL dialect. Also used for TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public String upsertSql(String table, List<String> keyColumns, List<String> valueColumns) {
    String updates = valueColumns.stream()
        .map(c -> c + " = VALUES(" + c + ")")
        .collect(Collectors.joining(", "));
    return insertPrefix(table, allColumns(keyColumns, valueColumns)) + " ON DUPLICATE KEY UPDATE " + updates;
  }
}
