package io.ledgerbridge.jdbc.store;

import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.jdbc.ConnectionProvider;
import io.ledgerbridge.jdbc.spi.Dialect;
import io.ledgerbridge.router.VoteRecord;
import io.ledgerbridge.spi.VoteStore;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link VoteStore} on a {@code <prefix>vote} table keyed by
 * {@code (source_network, payload_hash)}.
 *
 * <p>Voters are stored as a comma-separated, sorted list of adapter ids. The payload column
 * is cleared once a batch is delivered.
 */
public final class JdbcVoteStore extends AbstractJdbcStore implements VoteStore {
  static final int PENDING = 0;
  static final int HELD = 1;
  static final int DELIVERED = 2;

  private static final List<String> KEY = List.of("source_network", "payload_hash");
  private static final List<String> VALUES = List.of("status", "voters", "payload", "delivered_at");

  public JdbcVoteStore(ConnectionProvider connectionProvider, Dialect dialect, String table) {
    super(connectionProvider, dialect, table);
  }

  @Override
  public Optional<VoteRecord> find(int sourceNetwork, PayloadHash hash) {
    String sql = "SELECT status, voters, payload, delivered_at FROM " + table()
        + " WHERE source_network=? AND payload_hash=?";
    return withConnection("find vote", conn ->
        first(conn, sql, JdbcVoteStore::toRecord, sourceNetwork, hash));
  }

  @Override
  public Map<PayloadHash, VoteRecord.Held> held(int sourceNetwork) {
    String sql = "SELECT payload_hash, voters, payload FROM " + table()
        + " WHERE source_network=? AND status=? ORDER BY payload_hash";
    List<Map.Entry<PayloadHash, VoteRecord.Held>> rows = withConnection("list held votes", conn ->
        list(conn, sql, rs -> Map.entry(
            PayloadHash.fromHex(rs.getString("payload_hash")),
            new VoteRecord.Held(voters(rs.getString("voters")), rs.getBytes("payload"))), sourceNetwork, HELD));
    Map<PayloadHash, VoteRecord.Held> held = new LinkedHashMap<>();
    rows.forEach(row -> held.put(row.getKey(), row.getValue()));
    return held;
  }

  @Override
  public void save(int sourceNetwork, PayloadHash hash, VoteRecord record) {
    String voters = String.join(",", new TreeSet<>(record.voters()));
    Object[] params;
    if (record instanceof VoteRecord.Held held) {
      params = new Object[] {sourceNetwork, hash, HELD, voters, held.payload(), null};
    } else if (record instanceof VoteRecord.Delivered delivered) {
      params = new Object[] {sourceNetwork, hash, DELIVERED, voters, null, delivered.deliveredAt()};
    } else {
      params = new Object[] {sourceNetwork, hash, PENDING, voters, null, null};
    }
    String sql = dialect().upsertSql(table(), KEY, VALUES);
    withConnection("save vote", conn -> update(conn, sql, params));
  }

  private static VoteRecord toRecord(ResultSet rs) throws SQLException {
    int status = rs.getInt("status");
    Set<String> ids = voters(rs.getString("voters"));
    return switch (status) {
      case PENDING -> new VoteRecord.Pending(ids);
      case HELD -> new VoteRecord.Held(ids, rs.getBytes("payload"));
      case DELIVERED -> {
        Timestamp deliveredAt = rs.getTimestamp("delivered_at");
        yield new VoteRecord.Delivered(ids, deliveredAt.toInstant());
      }
      default -> throw new IllegalStateException("Unknown vote status: " + status);
    };
  }

  private static Set<String> voters(String column) {
    return column == null || column.isEmpty()
        ? Set.of()
        : Set.copyOf(Arrays.asList(column.split(",")));
  }
}
