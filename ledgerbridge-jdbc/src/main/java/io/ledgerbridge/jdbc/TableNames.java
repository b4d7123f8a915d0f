package io.ledgerbridge.jdbc;

import java.util.Objects;

/**
 * Table names of the bridge stores, derived from a common prefix.
 *
 * <p>With the default prefix the tables are {@code bridge_vote}, {@code bridge_subsidy} and
 * {@code bridge_failed_message}.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "bridge_";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.isEmpty()) {
      validate(prefix);
    }
    return new TableNames(prefix);
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_PREFIX);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public String vote() {
    return prefix + "vote";
  }

  public String subsidy() {
    return prefix + "subsidy";
  }

  public String failedMessage() {
    return prefix + "failed_message";
  }
}
