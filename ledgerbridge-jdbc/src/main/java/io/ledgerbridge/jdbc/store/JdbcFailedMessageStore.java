package io.ledgerbridge.jdbc.store;

import io.ledgerbridge.Message;
import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.jdbc.ConnectionProvider;
import io.ledgerbridge.jdbc.spi.Dialect;
import io.ledgerbridge.spi.FailedMessage;
import io.ledgerbridge.spi.FailedMessageStore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link FailedMessageStore} on a {@code <prefix>failed_message} table keyed by
 * {@code (source_network, message_hash)}.
 */
public final class JdbcFailedMessageStore extends AbstractJdbcStore implements FailedMessageStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  public JdbcFailedMessageStore(ConnectionProvider connectionProvider, Dialect dialect, String table) {
    super(connectionProvider, dialect, table);
  }

  @Override
  public void recordFailure(int sourceNetwork, Message message, String error) {
    Objects.requireNonNull(message, "message");
    PayloadHash hash = message.hash();
    Instant now = Instant.now();
    String lastError = truncate(error);
    String update = "UPDATE " + table()
        + " SET failure_count=failure_count+1, last_error=?, last_failed_at=?"
        + " WHERE source_network=? AND message_hash=?";
    String insert = "INSERT INTO " + table()
        + " (source_network, message_hash, message, failure_count, last_error, first_failed_at, last_failed_at)"
        + " VALUES (?,?,?,1,?,?,?)";
    withConnection("record failure", conn -> {
      if (update(conn, update, lastError, now, sourceNetwork, hash) == 0) {
        update(conn, insert, sourceNetwork, hash, message.toBytes(), lastError, now, now);
      }
      return null;
    });
  }

  @Override
  public int failureCount(int sourceNetwork, PayloadHash messageHash) {
    String sql = "SELECT failure_count FROM " + table() + " WHERE source_network=? AND message_hash=?";
    return withConnection("read failure count", conn ->
        first(conn, sql, rs -> rs.getInt("failure_count"), sourceNetwork, messageHash)).orElse(0);
  }

  @Override
  public boolean clearOne(int sourceNetwork, PayloadHash messageHash) {
    String decrement = "UPDATE " + table() + " SET failure_count=failure_count-1"
        + " WHERE source_network=? AND message_hash=? AND failure_count>0";
    String purge = "DELETE FROM " + table()
        + " WHERE source_network=? AND message_hash=? AND failure_count<=0";
    return withConnection("clear failure", conn -> {
      int updated = update(conn, decrement, sourceNetwork, messageHash);
      update(conn, purge, sourceNetwork, messageHash);
      return updated == 1;
    });
  }

  @Override
  public List<FailedMessage> failures(int sourceNetwork) {
    String sql = "SELECT message, failure_count, last_error, last_failed_at FROM " + table()
        + " WHERE source_network=? AND failure_count>0 ORDER BY first_failed_at, message_hash";
    return withConnection("list failures", conn ->
        list(conn, sql, rs -> new FailedMessage(
            sourceNetwork,
            Message.of(rs.getBytes("message")),
            rs.getInt("failure_count"),
            rs.getString("last_error"),
            rs.getTimestamp("last_failed_at").toInstant()), sourceNetwork));
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
