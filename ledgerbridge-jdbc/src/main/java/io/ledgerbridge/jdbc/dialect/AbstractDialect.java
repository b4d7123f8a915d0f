package io.ledgerbridge.jdbc.dialect;

import io.ledgerbridge.jdbc.spi.Dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base dialect with shared SQL building helpers.
 */
public abstract class AbstractDialect implements Dialect {

  protected static List<String> allColumns(List<String> keyColumns, List<String> valueColumns) {
    List<String> columns = new ArrayList<>(keyColumns);
    columns.addAll(valueColumns);
    return columns;
  }

  protected static String columnList(List<String> columns) {
    return String.join(", ", columns);
  }

  protected static String placeholders(int count) {
    return String.join(",", Collections.nCopies(count, "?"));
  }

  protected static String insertPrefix(String table, List<String> columns) {
    return "INSERT INTO " + table + " (" + columnList(columns) + ") VALUES (" + placeholders(columns.size()) + ")";
  }
}
