/**
 * JDBC implementations of the vote, subsidy and failed-message stores.
 *
 * @see io.ledgerbridge.jdbc.JdbcBridgeStores
 */
package io.ledgerbridge.jdbc.store;
