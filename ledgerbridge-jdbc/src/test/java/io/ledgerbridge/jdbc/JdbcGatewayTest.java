package io.ledgerbridge.jdbc;

import io.ledgerbridge.BatchReceipt;
import io.ledgerbridge.Gateway;
import io.ledgerbridge.InsufficientSubsidyException;
import io.ledgerbridge.Message;
import io.ledgerbridge.Tenant;
import io.ledgerbridge.auth.Wards;
import io.ledgerbridge.registry.DefaultHandlerRegistry;
import io.ledgerbridge.router.MultiAdapter;
import io.ledgerbridge.router.VoteStatus;
import io.ledgerbridge.spi.Adapter;
import io.ledgerbridge.spi.AdapterReceipt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Both sides of a bridge persisting votes, subsidy and failures in H2.
 */
class JdbcGatewayTest {
  private static final int NETWORK_A = 1;
  private static final int NETWORK_B = 2;
  private static final String OPS = "ops";

  private final List<FrameAdapter> outbound = List.of(new FrameAdapter("axl", 4), new FrameAdapter("wh", 1));
  private final List<FrameAdapter> inbound = List.of(new FrameAdapter("axl", 0), new FrameAdapter("wh", 0));
  private final List<String> received = new ArrayList<>();
  private final AtomicBoolean handlerFails = new AtomicBoolean();

  private JdbcBridgeStores storesA;
  private JdbcBridgeStores storesB;
  private Gateway gatewayA;
  private Gateway gatewayB;
  private MultiAdapter routerB;

  @BeforeEach
  void setUp() throws SQLException {
    storesA = JdbcBridgeStores.create(H2Databases.create());
    storesB = JdbcBridgeStores.create(H2Databases.create());

    MultiAdapter routerA = MultiAdapter.builder()
        .localNetwork(NETWORK_A)
        .wards(Wards.of(OPS))
        .voteStore(storesA.voteStore())
        .build();
    routerA.setAdapters(OPS, NETWORK_B, Tenant.GLOBAL, List.copyOf(outbound), 2, 2);
    gatewayA = Gateway.builder()
        .router(routerA)
        .handlerRegistry(new DefaultHandlerRegistry())
        .subsidyStore(storesA.subsidyStore())
        .failedMessageStore(storesA.failedMessageStore())
        .build();

    routerB = MultiAdapter.builder()
        .localNetwork(NETWORK_B)
        .wards(Wards.of(OPS))
        .voteStore(storesB.voteStore())
        .build();
    routerB.setAdapters(OPS, NETWORK_A, Tenant.GLOBAL, List.copyOf(inbound), 2, 2);
    gatewayB = Gateway.builder()
        .router(routerB)
        .handlerRegistry(new DefaultHandlerRegistry().registerAll((source, message) -> {
          if (handlerFails.get()) {
            throw new IllegalStateException("handler down");
          }
          received.add(new String(message.body(), StandardCharsets.UTF_8));
        }))
        .subsidyStore(storesB.subsidyStore())
        .failedMessageStore(storesB.failedMessageStore())
        .build();
  }

  private void relay(int adapterIndex) {
    for (byte[] frame : outbound.get(adapterIndex).frames) {
      routerB.receive(NETWORK_A, inbound.get(adapterIndex), frame);
    }
  }

  private static Message msg(String body) {
    return Message.of(3, body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void deliversAndDebitsPersistedSubsidy() {
    gatewayA.depositSubsidy(Tenant.GLOBAL, 100);

    BatchReceipt receipt = gatewayA.send(NETWORK_B, Tenant.GLOBAL, msg("hello")).orElseThrow();
    relay(1);
    assertEquals(VoteStatus.PENDING, routerB.voteStatus(NETWORK_A, receipt.hash()).status());
    relay(0);

    assertEquals(List.of("hello"), received);
    assertEquals(95, storesA.subsidyStore().balance(Tenant.GLOBAL));
    assertEquals(VoteStatus.DELIVERED, routerB.voteStatus(NETWORK_A, receipt.hash()).status());
  }

  @Test
  void underfundedSendLeavesPersistedBalanceUntouched() {
    gatewayA.depositSubsidy(Tenant.GLOBAL, 3);

    assertThrows(InsufficientSubsidyException.class,
        () -> gatewayA.send(NETWORK_B, Tenant.GLOBAL, msg("too expensive")));

    assertEquals(3, storesA.subsidyStore().balance(Tenant.GLOBAL));
    assertTrue(outbound.get(0).frames.isEmpty());
  }

  @Test
  void failedHandlerIsRetriedFromPersistedFailures() {
    gatewayA.depositSubsidy(Tenant.GLOBAL, 100);
    Message message = msg("retry me");
    handlerFails.set(true);

    gatewayA.send(NETWORK_B, Tenant.GLOBAL, message);
    relay(0);
    relay(1);

    assertTrue(received.isEmpty());
    assertEquals(1, storesB.failedMessageStore().failureCount(NETWORK_A, message.hash()));
    assertFalse(gatewayB.retry(NETWORK_A, message));

    handlerFails.set(false);
    assertTrue(gatewayB.retry(NETWORK_A, message));
    assertEquals(List.of("retry me"), received);
    assertTrue(gatewayB.failedMessages(NETWORK_A).isEmpty());
  }

  private static final class FrameAdapter implements Adapter {
    private final String id;
    private final long cost;
    private final List<byte[]> frames = new ArrayList<>();

    FrameAdapter(String id, long cost) {
      this.id = id;
      this.cost = cost;
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public AdapterReceipt send(int remoteNetwork, byte[] payload, long gasLimit, String refundAddress) {
      frames.add(payload.clone());
      return new AdapterReceipt(id, id + "-" + frames.size(), cost);
    }

    @Override
    public long estimate(int remoteNetwork, byte[] payload, long gasLimit) {
      return cost;
    }
  }
}
