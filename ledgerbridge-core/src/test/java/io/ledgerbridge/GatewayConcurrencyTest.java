package io.ledgerbridge;

import io.ledgerbridge.auth.Wards;
import io.ledgerbridge.codec.BatchCodec;
import io.ledgerbridge.registry.DefaultHandlerRegistry;
import io.ledgerbridge.router.MultiAdapter;
import io.ledgerbridge.spi.Adapter;
import io.ledgerbridge.spi.AdapterReceipt;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConcurrencyTest {
  private static final int LOCAL = 1;
  private static final int REMOTE = 2;
  private static final String OPS = "ops";

  private final CountDownLatch handlerEntered = new CountDownLatch(1);
  private final CountDownLatch otherSending = new CountDownLatch(1);
  private final AtomicInteger framesSent = new AtomicInteger();

  private final Adapter relay = new Adapter() {
    @Override
    public String id() {
      return "relay";
    }

    @Override
    public AdapterReceipt send(int remoteNetwork, byte[] payload, long gasLimit, String refundAddress) {
      otherSending.countDown();
      return new AdapterReceipt(id(), "tx-" + framesSent.incrementAndGet(), 0);
    }

    @Override
    public long estimate(int remoteNetwork, byte[] payload, long gasLimit) {
      return 0;
    }
  };

  private static Message msg(int kind, String body) {
    return Message.of(kind, body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void handlerSendsWhileAnotherThreadSends() throws Exception {
    MultiAdapter router = MultiAdapter.builder()
        .localNetwork(LOCAL)
        .wards(Wards.of(OPS))
        .build();
    router.setAdapters(OPS, REMOTE, Tenant.GLOBAL, List.of(relay), 1, 1);
    AtomicReference<Optional<BatchReceipt>> reply = new AtomicReference<>();
    AtomicReference<Gateway> gatewayRef = new AtomicReference<>();
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register(1, (source, message) -> {
          handlerEntered.countDown();
          otherSending.await(5, TimeUnit.SECONDS);
          reply.set(gatewayRef.get().send(source, Tenant.GLOBAL, msg(2, "ack")));
        });
    Gateway gateway = Gateway.builder()
        .router(router)
        .handlerRegistry(registry)
        .build();
    gatewayRef.set(gateway);

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<?> inbound = executor.submit(
          () -> router.receive(REMOTE, relay, BatchCodec.pack(List.of(msg(1, "transfer")))));
      Future<Optional<BatchReceipt>> outbound = executor.submit(() -> {
        handlerEntered.await(5, TimeUnit.SECONDS);
        return gateway.send(REMOTE, Tenant.GLOBAL, msg(1, "outgoing"));
      });

      assertTrue(outbound.get(10, TimeUnit.SECONDS).isPresent());
      inbound.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertNotNull(reply.get());
    assertTrue(reply.get().isPresent());
    assertEquals(2, framesSent.get());
    assertTrue(gateway.failedMessages(REMOTE).isEmpty());
  }
}
