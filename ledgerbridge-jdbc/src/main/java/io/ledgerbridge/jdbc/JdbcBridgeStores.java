package io.ledgerbridge.jdbc;

import io.ledgerbridge.jdbc.dialect.Dialects;
import io.ledgerbridge.jdbc.spi.Dialect;
import io.ledgerbridge.jdbc.store.JdbcFailedMessageStore;
import io.ledgerbridge.jdbc.store.JdbcSubsidyStore;
import io.ledgerbridge.jdbc.store.JdbcVoteStore;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * The three JDBC stores of one bridge, sharing a connection source, dialect and table prefix.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcBridgeStores stores = JdbcBridgeStores.create(dataSource);
 *
 * MultiAdapter router = MultiAdapter.builder()
 *     .localNetwork(1)
 *     .wards(wards)
 *     .voteStore(stores.voteStore())
 *     .build();
 * Gateway gateway = Gateway.builder()
 *     .router(router)
 *     .handlerRegistry(registry)
 *     .subsidyStore(stores.subsidyStore())
 *     .failedMessageStore(stores.failedMessageStore())
 *     .build();
 * }</pre>
 *
 * <p>The tables must exist; DDL for each supported database ships as
 * {@code ledgerbridge/schema-<dialect>.sql} on the classpath.
 */
public final class JdbcBridgeStores {
  private final JdbcVoteStore voteStore;
  private final JdbcSubsidyStore subsidyStore;
  private final JdbcFailedMessageStore failedMessageStore;

  public JdbcBridgeStores(ConnectionProvider connectionProvider, Dialect dialect, TableNames tableNames) {
    Objects.requireNonNull(tableNames, "tableNames");
    this.voteStore = new JdbcVoteStore(connectionProvider, dialect, tableNames.vote());
    this.subsidyStore = new JdbcSubsidyStore(connectionProvider, dialect, tableNames.subsidy());
    this.failedMessageStore = new JdbcFailedMessageStore(connectionProvider, dialect, tableNames.failedMessage());
  }

  /**
   * Creates stores with the default table prefix, detecting the dialect from the data source.
   */
  public static JdbcBridgeStores create(DataSource dataSource) {
    return create(dataSource, TableNames.DEFAULT_PREFIX);
  }

  /**
   * Creates stores with a custom table prefix, detecting the dialect from the data source.
   */
  public static JdbcBridgeStores create(DataSource dataSource, String tablePrefix) {
    return new JdbcBridgeStores(ConnectionProvider.of(dataSource),
        Dialects.detect(dataSource), TableNames.withPrefix(tablePrefix));
  }

  public JdbcVoteStore voteStore() {
    return voteStore;
  }

  public JdbcSubsidyStore subsidyStore() {
    return subsidyStore;
  }

  public JdbcFailedMessageStore failedMessageStore() {
    return failedMessageStore;
  }
}
