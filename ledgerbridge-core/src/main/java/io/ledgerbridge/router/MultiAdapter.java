package io.ledgerbridge.router;

import io.ledgerbridge.AdapterSendException;
import io.ledgerbridge.Message;
import io.ledgerbridge.Route;
import io.ledgerbridge.Tenant;
import io.ledgerbridge.UnauthorizedException;
import io.ledgerbridge.UnknownDestinationException;
import io.ledgerbridge.auth.Wards;
import io.ledgerbridge.codec.BatchCodec;
import io.ledgerbridge.codec.FrameFormatException;
import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.codec.ProofFrame;
import io.ledgerbridge.spi.Adapter;
import io.ledgerbridge.spi.AdapterReceipt;
import io.ledgerbridge.spi.InboundReceiver;
import io.ledgerbridge.spi.MetricsExporter;
import io.ledgerbridge.spi.VoteStore;
import io.ledgerbridge.store.InMemoryVoteStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Quorum router between the {@link io.ledgerbridge.Gateway} and a set of untrusted
 * {@link Adapter}s.
 *
 * <p><b>Outbound:</b> the primary adapter of a registration carries the batch; every other
 * sending adapter carries a {@link ProofFrame} with the batch hash. Adapters at or beyond
 * the registration's {@code recoveryIndex} send nothing.
 *
 * <p><b>Inbound:</b> every registered adapter votes for a hash, either directly (proof frame)
 * or by delivering the batch whose hash it is. A batch is handed to the
 * {@link InboundBatchHandler} exactly once, when the payload is held and the number of
 * distinct voters from the current registration reaches the threshold. Votes may arrive in
 * any order; a payload that arrives after quorum is delivered on arrival. Wards can inject a
 * stuck payload with {@link #recover}, which supplies content but never counts as a vote.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * MultiAdapter router = MultiAdapter.builder()
 *     .localNetwork(1)
 *     .wards(Wards.of("ops"))
 *     .build();
 * router.setAdapters("ops", 2, Tenant.GLOBAL, List.of(axelar, wormhole, hyperlane), 2, 3);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>All public operations are serialized on this instance's monitor. The inbound handler is
 * called after the monitor is released, once the {@link VoteRecord.Delivered} record is
 * saved, so a handler may send through the gateway. Handlers for different batches may
 * therefore run concurrently.
 *
 * @see AdapterSet
 * @see VoteRecord
 */
public final class MultiAdapter implements InboundReceiver {
  private static final Logger logger = Logger.getLogger(MultiAdapter.class.getName());

  private final int localNetwork;
  private final Wards wards;
  private final VoteStore voteStore;
  private final TenantResolver tenantResolver;
  private final MetricsExporter metrics;
  private final Map<Route, AdapterSet> registrations = new HashMap<>();
  private InboundBatchHandler inboundHandler;

  private MultiAdapter(Builder builder) {
    if (builder.localNetwork < 0) {
      throw new IllegalArgumentException("localNetwork must be >= 0");
    }
    this.localNetwork = builder.localNetwork;
    this.wards = Objects.requireNonNull(builder.wards, "wards");
    this.voteStore = builder.voteStore != null ? builder.voteStore : new InMemoryVoteStore();
    this.tenantResolver = builder.tenantResolver != null ? builder.tenantResolver : TenantResolver.GLOBAL;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int localNetwork() {
    return localNetwork;
  }

  public Wards wards() {
    return wards;
  }

  /**
   * Sets the handler that receives batches accepted by quorum. The gateway registers itself
   * here when it is built.
   */
  public synchronized void setInboundHandler(InboundBatchHandler handler) {
    this.inboundHandler = Objects.requireNonNull(handler, "handler");
  }

  // ── Configuration ──────────────────────────────────────────────

  /**
   * Replaces the registration for a remote network and tenant, using the first adapter as
   * primary.
   *
   * @see #setAdapters(String, int, long, List, int, int, int)
   */
  public void setAdapters(String caller, int remoteNetwork, long tenant,
      List<Adapter> adapters, int threshold, int recoveryIndex) {
    setAdapters(caller, remoteNetwork, tenant, adapters, threshold, recoveryIndex, 0);
  }

  /**
   * Replaces the registration for a remote network and tenant. The previous registration,
   * if any, stops counting immediately: votes already recorded from adapters outside the
   * new set no longer contribute to quorum.
   *
   * <p>Held batches from {@code remoteNetwork} are checked again against the new
   * registrations, so lowering a threshold delivers any batch that now has enough votes.
   *
   * @param caller        the principal making the change, must be a ward
   * @param remoteNetwork the remote network
   * @param tenant        the tenant, {@link Tenant#GLOBAL} for the network-wide default
   * @param adapters      ordered adapters
   * @param threshold     votes required to deliver
   * @param recoveryIndex adapters from this index on send nothing
   * @param primaryIndex  index of the adapter that carries the batch payload
   * @throws UnauthorizedException if {@code caller} is not a ward
   * @throws IllegalArgumentException if the registration is invalid (see {@link AdapterSet})
   */
  public void setAdapters(String caller, int remoteNetwork, long tenant,
      List<Adapter> adapters, int threshold, int recoveryIndex, int primaryIndex) {
    List<Delivery> deliveries = new ArrayList<>();
    synchronized (this) {
      wards.requireWard(caller);
      if (remoteNetwork == localNetwork) {
        throw new IllegalArgumentException("Cannot register adapters for the local network " + localNetwork);
      }
      Route route = new Route(remoteNetwork, tenant);
      AdapterSet set = new AdapterSet(adapters, threshold, recoveryIndex, primaryIndex);
      registrations.put(route, set);
      logger.info("Adapters for " + route + " set by " + caller + ": " + set);
      if (inboundHandler != null) {
        voteStore.held(remoteNetwork).forEach((hash, held) -> {
          Delivery delivery = deliverIfReady(remoteNetwork, hash, held);
          if (delivery != null) {
            deliveries.add(delivery);
          }
        });
      }
    }
    deliveries.forEach(Delivery::run);
  }

  /**
   * Returns the registration for a tenant, falling back to the global registration of the
   * network when the tenant has none.
   */
  public synchronized Optional<AdapterSet> adapterSet(int remoteNetwork, long tenant) {
    AdapterSet set = registrations.get(new Route(remoteNetwork, tenant));
    if (set == null && tenant != Tenant.GLOBAL) {
      set = registrations.get(Route.global(remoteNetwork));
    }
    return Optional.ofNullable(set);
  }

  // ── Outbound ───────────────────────────────────────────────────

  /**
   * Quotes the cost of {@link #send} for a batch: the primary's estimate for the batch plus
   * every other sending adapter's estimate for the proof frame.
   *
   * @throws UnknownDestinationException if no registration applies
   */
  public synchronized long estimate(int remoteNetwork, long tenant, byte[] batch, long gasLimit) {
    requireBatch(batch);
    AdapterSet set = requireAdapterSet(remoteNetwork, tenant);
    byte[] proof = ProofFrame.pack(PayloadHash.of(batch));
    long total = 0;
    List<Adapter> sending = set.sendingAdapters();
    for (int i = 0; i < sending.size(); i++) {
      byte[] frame = i == set.primaryIndex() ? batch : proof;
      total = Math.addExact(total, sending.get(i).estimate(remoteNetwork, frame, gasLimit));
    }
    return total;
  }

  /**
   * Sends a batch to the primary adapter and its proof to the other sending adapters, in
   * registration order. Stops at the first adapter that fails.
   *
   * @param refundAddress forwarded to every adapter, may be {@code null}
   * @return the batch hash, the quoted cost and the adapter receipts
   * @throws UnknownDestinationException if no registration applies
   * @throws IllegalArgumentException if {@code batch} is empty or is a proof frame
   * @throws AdapterSendException if an adapter fails; carries what earlier adapters accepted
   */
  public synchronized RouterSendResult send(int remoteNetwork, long tenant, byte[] batch,
      long gasLimit, String refundAddress) {
    requireBatch(batch);
    AdapterSet set = requireAdapterSet(remoteNetwork, tenant);
    PayloadHash hash = PayloadHash.of(batch);
    byte[] proof = ProofFrame.pack(hash);
    long quoted = 0;
    List<AdapterReceipt> receipts = new ArrayList<>();
    List<Adapter> sending = set.sendingAdapters();
    for (int i = 0; i < sending.size(); i++) {
      Adapter adapter = sending.get(i);
      byte[] frame = i == set.primaryIndex() ? batch : proof;
      try {
        long cost = adapter.estimate(remoteNetwork, frame, gasLimit);
        AdapterReceipt receipt = adapter.send(remoteNetwork, frame, gasLimit, refundAddress);
        quoted = Math.addExact(quoted, cost);
        receipts.add(receipt);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Adapter " + adapter.id() + " failed sending batch " + hash
            + " to network " + remoteNetwork + " after " + receipts.size() + " accepted", e);
        throw new AdapterSendException(adapter.id(), remoteNetwork, hash, quoted, receipts, e);
      }
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Sent batch " + hash + " to network " + remoteNetwork + " via " + receipts.size() + " adapters");
    }
    return new RouterSendResult(hash, quoted, receipts);
  }

  // ── Inbound ────────────────────────────────────────────────────

  /**
   * Records a frame reported by an adapter. A proof frame votes for the hash it carries; a
   * batch frame is validated, votes for its own hash and is held as the payload. Delivers
   * the batch if this completes quorum.
   *
   * @throws IllegalStateException if no inbound handler is set
   * @throws UnauthorizedException if the adapter is not registered for {@code sourceNetwork}
   * @throws FrameFormatException if the frame is malformed; no vote is recorded
   */
  @Override
  public void receive(int sourceNetwork, Adapter reportingAdapter, byte[] payload) {
    Objects.requireNonNull(reportingAdapter, "reportingAdapter");
    Objects.requireNonNull(payload, "payload");
    Delivery delivery;
    synchronized (this) {
      if (inboundHandler == null) {
        throw new IllegalStateException("No inbound handler set");
      }
      if (!isRegistered(sourceNetwork, reportingAdapter)) {
        throw new UnauthorizedException("Adapter " + reportingAdapter.id()
            + " is not registered for network " + sourceNetwork);
      }
      try {
        if (ProofFrame.isProof(payload)) {
          delivery = vote(sourceNetwork, ProofFrame.unpack(payload), reportingAdapter.id(), null);
        } else {
          BatchCodec.unpack(payload);
          delivery = vote(sourceNetwork, PayloadHash.of(payload), reportingAdapter.id(), payload);
        }
      } catch (FrameFormatException e) {
        logger.log(Level.WARNING, "Rejected frame from adapter " + reportingAdapter.id()
            + " on network " + sourceNetwork + ": " + e.getMessage());
        throw e;
      }
    }
    if (delivery != null) {
      delivery.run();
    }
  }

  /**
   * Supplies a batch payload out of band, for a batch whose payload-carrying adapter failed.
   * The payload does not count as a vote: it is delivered only once recorded votes already
   * meet the threshold, immediately if they do.
   *
   * @param caller the principal, must be a ward
   * @return {@code true} if the batch was delivered by this call
   * @throws UnauthorizedException if {@code caller} is not a ward
   * @throws FrameFormatException if {@code payload} is not a well-formed batch frame
   */
  public boolean recover(String caller, int sourceNetwork, byte[] payload) {
    Delivery delivery;
    synchronized (this) {
      wards.requireWard(caller);
      Objects.requireNonNull(payload, "payload");
      if (inboundHandler == null) {
        throw new IllegalStateException("No inbound handler set");
      }
      BatchCodec.unpack(payload);
      PayloadHash hash = PayloadHash.of(payload);
      VoteRecord current = voteStore.find(sourceNetwork, hash).orElse(null);
      if (current instanceof VoteRecord.Delivered) {
        logger.fine("Recovery of already delivered batch " + hash + " ignored");
        return false;
      }
      Set<String> voters = current != null ? current.voters() : Set.of();
      metrics.incrementRecovery();
      logger.info("Payload for batch " + hash + " from network " + sourceNetwork + " recovered by " + caller);
      delivery = tryDeliver(sourceNetwork, hash, new VoteRecord.Held(voters, payload));
    }
    if (delivery == null) {
      return false;
    }
    delivery.run();
    return true;
  }

  /**
   * Returns the current vote state for a hash. Thresholds come from the registration that
   * would apply at delivery; without a held payload the tenant is unknown and the global
   * registration is used.
   */
  public synchronized VoteSnapshot voteStatus(int sourceNetwork, PayloadHash hash) {
    Objects.requireNonNull(hash, "hash");
    VoteRecord record = voteStore.find(sourceNetwork, hash).orElse(null);
    if (record == null) {
      return new VoteSnapshot(sourceNetwork, hash, VoteStatus.UNKNOWN, Set.of(), false, thresholdOf(globalSet(sourceNetwork)));
    }
    if (record instanceof VoteRecord.Held held) {
      AdapterSet set = setForPayload(sourceNetwork, held.payload());
      return new VoteSnapshot(sourceNetwork, hash, VoteStatus.PENDING, held.voters(), true, thresholdOf(set));
    }
    AdapterSet global = globalSet(sourceNetwork);
    if (record instanceof VoteRecord.Delivered) {
      return new VoteSnapshot(sourceNetwork, hash, VoteStatus.DELIVERED, record.voters(), false, thresholdOf(global));
    }
    VoteStatus status = global != null && countVotes(record.voters(), global) >= global.threshold()
        ? VoteStatus.AWAITING_PAYLOAD
        : VoteStatus.PENDING;
    return new VoteSnapshot(sourceNetwork, hash, status, record.voters(), false, thresholdOf(global));
  }

  private Delivery vote(int sourceNetwork, PayloadHash hash, String adapterId, byte[] payload) {
    VoteRecord current = voteStore.find(sourceNetwork, hash).orElse(null);
    if (current instanceof VoteRecord.Delivered) {
      metrics.incrementDuplicateVote();
      logger.fine("Vote from " + adapterId + " for delivered batch " + hash + " ignored");
      return null;
    }
    Set<String> voters = new HashSet<>(current != null ? current.voters() : Set.of());
    if (voters.add(adapterId)) {
      metrics.incrementVoteRecorded();
      logger.fine("Vote from " + adapterId + " for batch " + hash + " on network " + sourceNetwork);
    } else {
      metrics.incrementDuplicateVote();
      logger.fine("Repeated vote from " + adapterId + " for batch " + hash + " ignored");
    }
    byte[] held = current instanceof VoteRecord.Held h ? h.payload() : payload;
    VoteRecord next = held != null ? new VoteRecord.Held(voters, held) : new VoteRecord.Pending(voters);
    return tryDeliver(sourceNetwork, hash, next);
  }

  /** Saves {@code record}, or marks it delivered if quorum is met. Caller holds the monitor. */
  private Delivery tryDeliver(int sourceNetwork, PayloadHash hash, VoteRecord record) {
    if (record instanceof VoteRecord.Held held) {
      Delivery delivery = deliverIfReady(sourceNetwork, hash, held);
      if (delivery != null) {
        return delivery;
      }
    }
    voteStore.save(sourceNetwork, hash, record);
    return null;
  }

  private Delivery deliverIfReady(int sourceNetwork, PayloadHash hash, VoteRecord.Held held) {
    List<Message> messages = BatchCodec.unpack(held.payload());
    long tenant = tenantResolver.resolve(sourceNetwork, messages);
    AdapterSet set = adapterSet(sourceNetwork, tenant).orElse(null);
    if (set == null || countVotes(held.voters(), set) < set.threshold()) {
      return null;
    }
    voteStore.save(sourceNetwork, hash, new VoteRecord.Delivered(held.voters(), Instant.now()));
    metrics.incrementBatchDelivered();
    logger.info("Delivering batch " + hash + " from network " + sourceNetwork
        + " (" + messages.size() + " messages, tenant " + tenant + ")");
    return new Delivery(inboundHandler, sourceNetwork, messages);
  }

  private AdapterSet setForPayload(int sourceNetwork, byte[] payload) {
    long tenant = tenantResolver.resolve(sourceNetwork, BatchCodec.unpack(payload));
    return adapterSet(sourceNetwork, tenant).orElse(null);
  }

  private AdapterSet globalSet(int network) {
    return registrations.get(Route.global(network));
  }

  private boolean isRegistered(int network, Adapter adapter) {
    for (Map.Entry<Route, AdapterSet> entry : registrations.entrySet()) {
      if (entry.getKey().network() == network && entry.getValue().contains(adapter)) {
        return true;
      }
    }
    return false;
  }

  private AdapterSet requireAdapterSet(int remoteNetwork, long tenant) {
    return adapterSet(remoteNetwork, tenant)
        .orElseThrow(() -> new UnknownDestinationException(new Route(remoteNetwork, tenant)));
  }

  private static int countVotes(Set<String> voters, AdapterSet set) {
    int count = 0;
    for (String voter : voters) {
      if (set.ids().contains(voter)) {
        count++;
      }
    }
    return count;
  }

  private static int thresholdOf(AdapterSet set) {
    return set != null ? set.threshold() : 0;
  }

  private static void requireBatch(byte[] batch) {
    Objects.requireNonNull(batch, "batch");
    if (batch.length == 0) {
      throw new IllegalArgumentException("batch cannot be empty");
    }
    if (ProofFrame.isProof(batch)) {
      throw new IllegalArgumentException("batch cannot be a proof frame");
    }
  }

  /** A batch marked delivered, to be handed over once the monitor is released. */
  private record Delivery(InboundBatchHandler handler, int sourceNetwork, List<Message> messages) {
    void run() {
      handler.onBatch(sourceNetwork, messages);
    }
  }

  // ── Builder ────────────────────────────────────────────────────

  /** Builder for {@link MultiAdapter}. */
  public static final class Builder {
    private int localNetwork = -1;
    private Wards wards;
    private VoteStore voteStore;
    private TenantResolver tenantResolver;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the id of the network this router runs on.
     *
     * <p><b>Required.</b>
     */
    public Builder localNetwork(int localNetwork) {
      this.localNetwork = localNetwork;
      return this;
    }

    /**
     * Sets the principals allowed to change registrations and recover payloads.
     *
     * <p><b>Required.</b>
     */
    public Builder wards(Wards wards) {
      this.wards = wards;
      return this;
    }

    /**
     * Optional. Defaults to an {@link InMemoryVoteStore}.
     */
    public Builder voteStore(VoteStore voteStore) {
      this.voteStore = voteStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link TenantResolver#GLOBAL}.
     */
    public Builder tenantResolver(TenantResolver tenantResolver) {
      this.tenantResolver = tenantResolver;
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
     * @throws NullPointerException if {@code wards} is null
     * @throws IllegalArgumentException if {@code localNetwork} is unset or negative
     */
    public MultiAdapter build() {
      return new MultiAdapter(this);
    }
  }
}
