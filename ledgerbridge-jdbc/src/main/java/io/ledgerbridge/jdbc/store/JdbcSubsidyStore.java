package io.ledgerbridge.jdbc.store;

import io.ledgerbridge.jdbc.ConnectionProvider;
import io.ledgerbridge.jdbc.spi.Dialect;
import io.ledgerbridge.spi.SubsidyStore;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link SubsidyStore} on a {@code <prefix>subsidy} table keyed by tenant.
 *
 * <p>Debits are a single conditional {@code UPDATE}, so the balance cannot go negative.
 * Rows are created on first credit or refund address change.
 */
public final class JdbcSubsidyStore extends AbstractJdbcStore implements SubsidyStore {

  public JdbcSubsidyStore(ConnectionProvider connectionProvider, Dialect dialect, String table) {
    super(connectionProvider, dialect, table);
  }

  @Override
  public long balance(long tenant) {
    String sql = "SELECT balance FROM " + table() + " WHERE tenant=?";
    return withConnection("read balance", conn ->
        first(conn, sql, rs -> rs.getLong("balance"), tenant)).orElse(0L);
  }

  @Override
  public void credit(long tenant, long amount) {
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
    String add = "UPDATE " + table() + " SET balance=balance+? WHERE tenant=?";
    String insert = "INSERT INTO " + table() + " (tenant, balance, refund_address) VALUES (?,?,NULL)";
    withConnection("credit balance", conn -> {
      if (update(conn, add, amount, tenant) == 0) {
        update(conn, insert, tenant, amount);
      }
      return null;
    });
  }

  @Override
  public boolean tryDebit(long tenant, long amount) {
    if (amount < 0) {
      throw new IllegalArgumentException("amount must be >= 0");
    }
    if (amount == 0) {
      return true;
    }
    String sql = "UPDATE " + table() + " SET balance=balance-? WHERE tenant=? AND balance>=?";
    return withConnection("debit balance", conn -> update(conn, sql, amount, tenant, amount)) == 1;
  }

  @Override
  public Optional<String> refundAddress(long tenant) {
    String sql = "SELECT refund_address FROM " + table() + " WHERE tenant=?";
    return withConnection("read refund address", conn ->
        first(conn, sql, rs -> rs.getString("refund_address"), tenant));
  }

  @Override
  public void setRefundAddress(long tenant, String refundAddress) {
    Objects.requireNonNull(refundAddress, "refundAddress");
    String set = "UPDATE " + table() + " SET refund_address=? WHERE tenant=?";
    String insert = "INSERT INTO " + table() + " (tenant, balance, refund_address) VALUES (?,0,?)";
    withConnection("set refund address", conn -> {
      if (update(conn, set, refundAddress, tenant) == 0) {
        update(conn, insert, tenant, refundAddress);
      }
      return null;
    });
  }
}
