package io.ledgerbridge;

import io.ledgerbridge.auth.Wards;
import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.registry.DefaultHandlerRegistry;
import io.ledgerbridge.router.MultiAdapter;
import io.ledgerbridge.router.VoteStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two networks wired together: frames sent by each outbound adapter on network A are
 * reported by its counterpart on network B.
 */
class BridgeRoundTripTest {
  private static final int NETWORK_A = 1;
  private static final int NETWORK_B = 2;
  private static final String OPS = "ops";

  private final List<RecordingAdapter> outbound = List.of(
      new RecordingAdapter("axl", 5), new RecordingAdapter("wh", 2), new RecordingAdapter("hl", 2));
  private final List<RecordingAdapter> inbound = List.of(
      new RecordingAdapter("axl"), new RecordingAdapter("wh"), new RecordingAdapter("hl"));
  private final List<String> received = new ArrayList<>();

  private Gateway gatewayA;
  private MultiAdapter routerB;

  @BeforeEach
  void setUp() {
    MultiAdapter routerA = MultiAdapter.builder().localNetwork(NETWORK_A).wards(Wards.of(OPS)).build();
    routerA.setAdapters(OPS, NETWORK_B, Tenant.GLOBAL, List.copyOf(outbound), 2, 3);
    gatewayA = Gateway.builder()
        .router(routerA)
        .handlerRegistry(new DefaultHandlerRegistry())
        .build();

    routerB = MultiAdapter.builder().localNetwork(NETWORK_B).wards(Wards.of(OPS)).build();
    routerB.setAdapters(OPS, NETWORK_A, Tenant.GLOBAL, List.copyOf(inbound), 2, 3);
    Gateway.builder()
        .router(routerB)
        .handlerRegistry(new DefaultHandlerRegistry()
            .registerAll((source, message) -> received.add(new String(message.body(), StandardCharsets.UTF_8))))
        .build();
  }

  private void relay(int adapterIndex) {
    for (byte[] frame : outbound.get(adapterIndex).frames()) {
      routerB.receive(NETWORK_A, inbound.get(adapterIndex), frame);
    }
  }

  private static Message msg(String body) {
    return Message.of(1, body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void batchedMessagesArriveOnceInOrder() {
    gatewayA.depositSubsidy(Tenant.GLOBAL, 1_000);

    List<BatchReceipt> receipts = gatewayA.withBatch(() -> {
      gatewayA.send(NETWORK_B, Tenant.GLOBAL, msg("m1"));
      gatewayA.send(NETWORK_B, Tenant.GLOBAL, msg("m2"));
      gatewayA.send(NETWORK_B, Tenant.GLOBAL, msg("m3"));
    });

    assertEquals(1, receipts.size());
    assertEquals(1_000 - 9, gatewayA.subsidy(Tenant.GLOBAL));

    relay(2);
    relay(0);
    relay(1);

    assertEquals(List.of("m1", "m2", "m3"), received);
    assertEquals(VoteStatus.DELIVERED, routerB.voteStatus(NETWORK_A, receipts.get(0).hash()).status());
  }

  @Test
  void silentPrimaryIsRecoveredByWard() {
    gatewayA.depositSubsidy(Tenant.GLOBAL, 1_000);
    gatewayA.send(NETWORK_B, Tenant.GLOBAL, msg("stuck"));
    byte[] payload = outbound.get(0).frames().get(0);

    relay(1);
    relay(2);
    assertTrue(received.isEmpty());
    assertEquals(VoteStatus.AWAITING_PAYLOAD, routerB.voteStatus(NETWORK_A, PayloadHash.of(payload)).status());

    routerB.recover(OPS, NETWORK_A, payload);

    assertEquals(List.of("stuck"), received);
  }

  @Test
  void singleAdapterCannotDeliver() {
    gatewayA.depositSubsidy(Tenant.GLOBAL, 1_000);
    gatewayA.send(NETWORK_B, Tenant.GLOBAL, msg("lonely"));

    relay(0);
    relay(0);

    assertTrue(received.isEmpty());
  }
}
