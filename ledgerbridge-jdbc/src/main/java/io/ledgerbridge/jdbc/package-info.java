/**
 * JDBC persistence for the bridge state stores.
 *
 * <p>{@link io.ledgerbridge.jdbc.JdbcBridgeStores} wires the vote, subsidy and failed-message
 * stores against one {@link javax.sql.DataSource}. The SQL dialect (H2, MySQL, PostgreSQL) is
 * detected from the JDBC URL via {@link io.ledgerbridge.jdbc.dialect.Dialects}. Every store
 * operation runs on its own auto-commit connection; JDBC failures surface as
 * {@link io.ledgerbridge.jdbc.BridgeStoreException}.
 */
package io.ledgerbridge.jdbc;
