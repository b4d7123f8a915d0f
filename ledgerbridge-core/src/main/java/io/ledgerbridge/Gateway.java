package io.ledgerbridge;

import com.github.f4b6a3.ulid.UlidCreator;
import io.ledgerbridge.auth.Wards;
import io.ledgerbridge.codec.BatchCodec;
import io.ledgerbridge.dispatch.DispatchReport;
import io.ledgerbridge.dispatch.InboundDispatcher;
import io.ledgerbridge.dispatch.MessageInterceptor;
import io.ledgerbridge.registry.HandlerRegistry;
import io.ledgerbridge.router.InboundBatchHandler;
import io.ledgerbridge.router.MultiAdapter;
import io.ledgerbridge.router.RouterSendResult;
import io.ledgerbridge.spi.FailedMessage;
import io.ledgerbridge.spi.FailedMessageStore;
import io.ledgerbridge.spi.MetricsExporter;
import io.ledgerbridge.spi.SubsidyStore;
import io.ledgerbridge.store.InMemoryFailedMessageStore;
import io.ledgerbridge.store.InMemorySubsidyStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Outbound hub for domain messages and inbound dispatcher for batches accepted by the
 * {@link MultiAdapter}.
 *
 * <p><b>Outbound:</b> outside a batching scope every {@link #send} is flushed at once as a
 * one-message batch. Between {@link #startBatching()} and {@link #endBatching()} messages
 * accumulate per {@link Route} on the calling thread and are flushed together, so N messages
 * to one route cost one transport round and one subsidy debit.
 *
 * <p>Every flush is paid from the tenant's subsidy. A flush first quotes every batch and
 * checks every tenant's balance; if any tenant cannot pay, nothing is sent, nothing is
 * debited, and the accumulated messages stay pending for a later {@link #endBatching()} or
 * {@link #discardBatch()}. Batches are then sent route by route; a route is removed from the
 * pending set only once it has been sent and paid for. When an adapter fails mid-route, the
 * frames other adapters already accepted are debited, the failing route and every route after
 * it stay pending, and the {@link AdapterSendException} propagates.
 *
 * <p><b>Inbound:</b> {@link #onBatch} dispatches each message through the
 * {@link HandlerRegistry}. Failures are isolated per message and recorded for
 * {@link #retry}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Gateway gateway = Gateway.builder()
 *     .router(router)
 *     .handlerRegistry(new DefaultHandlerRegistry().register(TRANSFER, transfers))
 *     .build();
 *
 * gateway.depositSubsidy(tenant, 1_000_000);
 * List<BatchReceipt> receipts = gateway.withBatch(() -> {
 *   gateway.send(2, tenant, Message.of(TRANSFER, first));
 *   gateway.send(2, tenant, Message.of(TRANSFER, second));
 * });
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Operations are serialized on this instance's monitor. Batching state is bound to the
 * calling thread.
 *
 * @see MultiAdapter
 * @see GatewayConfig
 */
public final class Gateway implements InboundBatchHandler {
  private static final Logger logger = Logger.getLogger(Gateway.class.getName());

  private final MultiAdapter router;
  private final Wards wards;
  private final SubsidyStore subsidyStore;
  private final FailedMessageStore failedMessageStore;
  private final GatewayConfig config;
  private final MetricsExporter metrics;
  private final InboundDispatcher dispatcher;
  private final Set<Route> blockedRoutes = new HashSet<>();
  private final ThreadLocal<Map<Route, PendingBatch>> batches = new ThreadLocal<>();

  private Gateway(Builder builder) {
    this.router = Objects.requireNonNull(builder.router, "router");
    this.wards = router.wards();
    this.subsidyStore = builder.subsidyStore != null ? builder.subsidyStore : new InMemorySubsidyStore();
    this.failedMessageStore = builder.failedMessageStore != null
        ? builder.failedMessageStore : new InMemoryFailedMessageStore();
    this.config = builder.config != null ? builder.config : GatewayConfig.DEFAULT;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.dispatcher = new InboundDispatcher(
        Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry"),
        failedMessageStore, metrics, builder.interceptors);
  }

  public static Builder builder() {
    return new Builder();
  }

  public GatewayConfig config() {
    return config;
  }

  // ── Outbound ───────────────────────────────────────────────────

  /**
   * Sends a message with the base gas limit only.
   *
   * @see #send(int, long, Message, long)
   */
  public Optional<BatchReceipt> send(int remoteNetwork, long tenant, Message message) {
    return send(remoteNetwork, tenant, message, 0L);
  }

  /**
   * Sends a message to a remote network on behalf of a tenant.
   *
   * @param extraGasLimit gas granted to this message on top of
   *     {@link GatewayConfig#messageGasLimit()}
   * @return the receipt when the message was flushed immediately, empty when it was added to
   *     the open batch
   * @throws IllegalArgumentException if {@code remoteNetwork} is the local network, or the
   *     message would push its batch over {@link GatewayConfig#maxBatchGasLimit()}
   * @throws OutgoingBlockedException if the route is blocked
   * @throws UnknownDestinationException if no adapters are configured for the route
   * @throws InsufficientSubsidyException if an immediate flush cannot be paid for
   * @throws AdapterSendException if an adapter fails during an immediate flush
   */
  public synchronized Optional<BatchReceipt> send(int remoteNetwork, long tenant, Message message,
      long extraGasLimit) {
    Objects.requireNonNull(message, "message");
    if (extraGasLimit < 0) {
      throw new IllegalArgumentException("extraGasLimit must be >= 0");
    }
    if (remoteNetwork == router.localNetwork()) {
      throw new IllegalArgumentException("Cannot send to the local network " + remoteNetwork);
    }
    Route route = new Route(remoteNetwork, tenant);
    if (blockedRoutes.contains(route)) {
      throw new OutgoingBlockedException(route);
    }
    if (router.adapterSet(remoteNetwork, tenant).isEmpty()) {
      throw new UnknownDestinationException(route);
    }
    long gas = Math.addExact(config.messageGasLimit(), extraGasLimit);

    Map<Route, PendingBatch> pending = batches.get();
    if (pending == null) {
      requireWithinBatchLimit(route, gas);
      Map<Route, PendingBatch> single = new LinkedHashMap<>();
      single.put(route, new PendingBatch().add(message, gas));
      return Optional.of(flush(single).get(0));
    }
    PendingBatch batch = pending.get(route);
    long total = Math.addExact(batch != null ? batch.gasLimit : 0L, gas);
    requireWithinBatchLimit(route, total);
    pending.computeIfAbsent(route, ignored -> new PendingBatch()).add(message, gas);
    return Optional.empty();
  }

  /**
   * Opens a batching scope on the calling thread.
   *
   * @throws IllegalStateException if batching is already open on this thread
   */
  public void startBatching() {
    if (batches.get() != null) {
      throw new IllegalStateException("Batching already started on this thread");
    }
    batches.set(new LinkedHashMap<>());
  }

  /**
   * Flushes every batch accumulated on the calling thread and closes the scope.
   *
   * <p>If a tenant cannot pay, {@link InsufficientSubsidyException} is thrown before anything
   * is sent; the scope stays open with all messages pending. If an adapter fails, routes
   * already sent are removed and the rest stay pending in the open scope.
   *
   * @return one receipt per route, in order of each route's first message
   * @throws IllegalStateException if batching is not open on this thread
   * @throws AdapterSendException if an adapter fails while sending a route
   */
  public synchronized List<BatchReceipt> endBatching() {
    Map<Route, PendingBatch> pending = batches.get();
    if (pending == null) {
      throw new IllegalStateException("Batching not started on this thread");
    }
    List<BatchReceipt> receipts = flush(pending);
    batches.remove();
    return receipts;
  }

  /**
   * Runs {@code body} in a batching scope and flushes the result. The scope is discarded if
   * the body or the flush fails.
   */
  public List<BatchReceipt> withBatch(Runnable body) {
    Objects.requireNonNull(body, "body");
    startBatching();
    try {
      body.run();
      return endBatching();
    } finally {
      if (isBatching()) {
        discardBatch();
      }
    }
  }

  /**
   * Drops all messages pending on the calling thread and closes the batching scope.
   *
   * @return the number of messages dropped
   */
  public int discardBatch() {
    Map<Route, PendingBatch> pending = batches.get();
    batches.remove();
    if (pending == null) {
      return 0;
    }
    int dropped = 0;
    for (PendingBatch batch : pending.values()) {
      dropped += batch.messages.size();
    }
    if (dropped > 0) {
      logger.info("Discarded " + dropped + " pending messages for " + pending.size() + " routes");
    }
    return dropped;
  }

  public boolean isBatching() {
    return batches.get() != null;
  }

  /**
   * Blocks or unblocks outgoing messages on a route.
   *
   * @throws UnauthorizedException if {@code caller} is not a ward
   */
  public synchronized void blockOutgoing(String caller, int remoteNetwork, long tenant, boolean blocked) {
    wards.requireWard(caller);
    Route route = new Route(remoteNetwork, tenant);
    boolean changed = blocked ? blockedRoutes.add(route) : blockedRoutes.remove(route);
    if (changed) {
      logger.info("Outgoing " + route + (blocked ? " blocked" : " unblocked") + " by " + caller);
    }
  }

  public synchronized boolean isBlocked(int remoteNetwork, long tenant) {
    return blockedRoutes.contains(new Route(remoteNetwork, tenant));
  }

  // ── Subsidy ────────────────────────────────────────────────────

  /**
   * Adds to a tenant's subsidy. Anyone may deposit.
   */
  public synchronized void depositSubsidy(long tenant, long amount) {
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
    subsidyStore.credit(tenant, amount);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Deposited " + amount + " for tenant " + tenant);
    }
  }

  /**
   * Withdraws from a tenant's subsidy to its refund address.
   *
   * @return the payout instruction
   * @throws UnauthorizedException if {@code caller} is not a ward
   * @throws IllegalStateException if the tenant has no refund address
   * @throws InsufficientSubsidyException if the balance is below {@code amount}
   */
  public synchronized SubsidyWithdrawal withdrawSubsidy(String caller, long tenant, long amount) {
    wards.requireWard(caller);
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
    String refundAddress = subsidyStore.refundAddress(tenant)
        .orElseThrow(() -> new IllegalStateException("No refund address for tenant " + tenant));
    if (!subsidyStore.tryDebit(tenant, amount)) {
      throw new InsufficientSubsidyException(tenant, amount, subsidyStore.balance(tenant));
    }
    logger.info("Withdrew " + amount + " for tenant " + tenant + " to " + refundAddress + " by " + caller);
    return new SubsidyWithdrawal(tenant, refundAddress, amount);
  }

  /**
   * @throws UnauthorizedException if {@code caller} is not a ward
   */
  public synchronized void setRefundAddress(String caller, long tenant, String refundAddress) {
    wards.requireWard(caller);
    Objects.requireNonNull(refundAddress, "refundAddress");
    if (refundAddress.isBlank()) {
      throw new IllegalArgumentException("refundAddress cannot be blank");
    }
    subsidyStore.setRefundAddress(tenant, refundAddress);
    logger.info("Refund address for tenant " + tenant + " set by " + caller);
  }

  public synchronized long subsidy(long tenant) {
    return subsidyStore.balance(tenant);
  }

  // ── Inbound ────────────────────────────────────────────────────

  /**
   * Dispatches a batch accepted by the router, one message at a time in batch order.
   */
  @Override
  public void onBatch(int sourceNetwork, List<Message> messages) {
    DispatchReport report = dispatcher.dispatchAll(sourceNetwork, messages);
    if (!report.allHandled()) {
      logger.warning(report.failed() + " of " + messages.size() + " messages from network "
          + sourceNetwork + " failed");
    }
  }

  /**
   * Re-dispatches a previously failed message. On success one failure count is cleared.
   *
   * @return {@code true} if the handler succeeded
   * @throws IllegalArgumentException if no failure is recorded for the message
   */
  public boolean retry(int sourceNetwork, Message message) {
    Objects.requireNonNull(message, "message");
    if (failedMessageStore.failureCount(sourceNetwork, message.hash()) == 0) {
      throw new IllegalArgumentException("No failed " + message + " from network " + sourceNetwork);
    }
    try {
      dispatcher.dispatchOne(sourceNetwork, message);
    } catch (Exception e) {
      metrics.incrementMessageFailed();
      logger.log(Level.WARNING, "Retry failed for " + message + " from network " + sourceNetwork, e);
      return false;
    }
    failedMessageStore.clearOne(sourceNetwork, message.hash());
    logger.info("Retried " + message + " from network " + sourceNetwork);
    return true;
  }

  public List<FailedMessage> failedMessages(int sourceNetwork) {
    return failedMessageStore.failures(sourceNetwork);
  }

  // ── Flush ──────────────────────────────────────────────────────

  private List<BatchReceipt> flush(Map<Route, PendingBatch> pending) {
    List<PlannedBatch> plans = new ArrayList<>();
    Map<Long, Long> required = new LinkedHashMap<>();
    for (Map.Entry<Route, PendingBatch> entry : pending.entrySet()) {
      Route route = entry.getKey();
      if (blockedRoutes.contains(route)) {
        throw new OutgoingBlockedException(route);
      }
      PendingBatch batch = entry.getValue();
      byte[] frame = BatchCodec.pack(batch.messages);
      long cost = router.estimate(route.network(), route.tenant(), frame, batch.gasLimit);
      plans.add(new PlannedBatch(route, batch, frame, cost));
      required.merge(route.tenant(), cost, Math::addExact);
    }
    for (Map.Entry<Long, Long> entry : required.entrySet()) {
      long available = subsidyStore.balance(entry.getKey());
      if (available < entry.getValue()) {
        metrics.incrementUnfundedFlush();
        logger.warning("Flush of " + plans.size() + " batches refused: tenant " + entry.getKey()
            + " needs " + entry.getValue() + ", has " + available);
        throw new InsufficientSubsidyException(entry.getKey(), entry.getValue(), available);
      }
    }

    List<BatchReceipt> receipts = new ArrayList<>(plans.size());
    for (PlannedBatch plan : plans) {
      Route route = plan.route();
      String refundAddress = subsidyStore.refundAddress(route.tenant()).orElse(null);
      RouterSendResult result;
      try {
        result = router.send(route.network(), route.tenant(), plan.frame(),
            plan.batch().gasLimit, refundAddress);
      } catch (AdapterSendException e) {
        debitAccepted(route, e);
        throw e;
      }
      if (!subsidyStore.tryDebit(route.tenant(), plan.cost())) {
        throw new IllegalStateException("Subsidy for tenant " + route.tenant() + " changed during flush");
      }
      pending.remove(route);
      int count = plan.batch().messages.size();
      metrics.incrementBatchSent(count);
      metrics.recordSubsidyDebited(plan.cost());
      BatchReceipt receipt = new BatchReceipt(UlidCreator.getMonotonicUlid().toString(), route,
          result.hash(), count, plan.cost(), result.receipts());
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Flushed batch " + receipt.batchId() + " (" + count + " messages, cost "
            + plan.cost() + ") to " + route);
      }
      receipts.add(receipt);
    }
    return receipts;
  }

  private void debitAccepted(Route route, AdapterSendException failure) {
    long cost = failure.acceptedCost();
    if (cost > 0) {
      if (subsidyStore.tryDebit(route.tenant(), cost)) {
        metrics.recordSubsidyDebited(cost);
      } else {
        logger.warning("Could not debit " + cost + " from tenant " + route.tenant()
            + " for frames accepted before adapter " + failure.adapterId() + " failed");
      }
    }
    logger.warning("Batch " + failure.hash() + " to " + route + " left pending after "
        + failure.accepted().size() + " adapters accepted it, " + cost + " debited");
  }

  private void requireWithinBatchLimit(Route route, long gasLimit) {
    if (gasLimit > config.maxBatchGasLimit()) {
      throw new IllegalArgumentException("Batch gas limit " + gasLimit + " for " + route
          + " exceeds maximum " + config.maxBatchGasLimit());
    }
  }

  private static final class PendingBatch {
    private final List<Message> messages = new ArrayList<>();
    private long gasLimit;

    PendingBatch add(Message message, long gas) {
      messages.add(message);
      gasLimit += gas;
      return this;
    }
  }

  private record PlannedBatch(Route route, PendingBatch batch, byte[] frame, long cost) {
  }

  // ── Builder ────────────────────────────────────────────────────

  /** Builder for {@link Gateway}. */
  public static final class Builder {
    private MultiAdapter router;
    private HandlerRegistry handlerRegistry;
    private SubsidyStore subsidyStore;
    private FailedMessageStore failedMessageStore;
    private GatewayConfig config;
    private MetricsExporter metrics;
    private final List<MessageInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the router used for outbound batches. The built gateway registers itself as the
     * router's inbound handler.
     *
     * <p><b>Required.</b>
     */
    public Builder router(MultiAdapter router) {
      this.router = router;
      return this;
    }

    /**
     * Sets the registry that routes inbound messages to handlers.
     *
     * <p><b>Required.</b>
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Optional. Defaults to an {@link InMemorySubsidyStore}.
     */
    public Builder subsidyStore(SubsidyStore subsidyStore) {
      this.subsidyStore = subsidyStore;
      return this;
    }

    /**
     * Optional. Defaults to an {@link InMemoryFailedMessageStore}.
     */
    public Builder failedMessageStore(FailedMessageStore failedMessageStore) {
      this.failedMessageStore = failedMessageStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link GatewayConfig#DEFAULT}.
     */
    public Builder config(GatewayConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends an interceptor around inbound message handlers.
     */
    public Builder interceptor(MessageInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<MessageInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Builds the gateway and registers it with the router.
     *
     * @throws NullPointerException if {@code router} or {@code handlerRegistry} is null
     */
    public Gateway build() {
      Gateway gateway = new Gateway(this);
      gateway.router.setInboundHandler(gateway);
      return gateway;
    }
  }
}
