package io.ledgerbridge.jdbc.dialect;

import io.ledgerbridge.jdbc.H2Databases;
import io.ledgerbridge.jdbc.spi.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {
  private static final List<String> KEY = List.of("source_network", "payload_hash");
  private static final List<String> VALUES = List.of("status", "voters");

  @Test
  void allReturnsBuiltInDialects() {
    List<String> names = Dialects.all().stream().map(Dialect::name).toList();

    assertTrue(names.containsAll(List.of("h2", "mysql", "postgresql")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", Dialects.get("MySQL").name());
    assertThrows(IllegalArgumentException.class, () -> Dialects.get("oracle"));
  }

  @Test
  void detectsFromJdbcUrl() {
    assertEquals("mysql", Dialects.detect("jdbc:mysql://localhost/bridge").name());
    assertEquals("mysql", Dialects.detect("jdbc:tidb://localhost/bridge").name());
    assertEquals("postgresql", Dialects.detect("jdbc:postgresql://localhost/bridge").name());
    assertEquals("h2", Dialects.detect("JDBC:H2:mem:bridge").name());
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect("jdbc:oracle:thin:@db"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
  }

  @Test
  void detectsFromDataSource() throws Exception {
    assertEquals("h2", Dialects.detect(H2Databases.create()).name());
  }

  @Test
  void mysqlUpsertUsesOnDuplicateKey() {
    assertEquals("INSERT INTO bridge_vote (source_network, payload_hash, status, voters) VALUES (?,?,?,?)"
            + " ON DUPLICATE KEY UPDATE status = VALUES(status), voters = VALUES(voters)",
        new MySqlDialect().upsertSql("bridge_vote", KEY, VALUES));
  }

  @Test
  void postgresUpsertUsesOnConflict() {
    assertEquals("INSERT INTO bridge_vote (source_network, payload_hash, status, voters) VALUES (?,?,?,?)"
            + " ON CONFLICT (source_network, payload_hash) DO UPDATE SET status = EXCLUDED.status, voters = EXCLUDED.voters",
        new PostgresDialect().upsertSql("bridge_vote", KEY, VALUES));
  }

  @Test
  void h2UpsertUsesMergeKey() {
    assertEquals("MERGE INTO bridge_vote (source_network, payload_hash, status, voters)"
            + " KEY (source_network, payload_hash) VALUES (?,?,?,?)",
        new H2Dialect().upsertSql("bridge_vote", KEY, VALUES));
  }
}
