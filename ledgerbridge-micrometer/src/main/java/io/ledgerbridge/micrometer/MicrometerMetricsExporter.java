package io.ledgerbridge.micrometer;

import io.ledgerbridge.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Outbound counters</h3>
 * <ul>
 *   <li>{@code ledgerbridge.batch.sent}: batches handed to adapters</li>
 *   <li>{@code ledgerbridge.message.sent}: messages inside those batches</li>
 *   <li>{@code ledgerbridge.subsidy.debited}: total subsidy debited for sent batches</li>
 *   <li>{@code ledgerbridge.flush.unfunded}: flushes refused for insufficient subsidy</li>
 * </ul>
 *
 * <h3>Inbound counters</h3>
 * <ul>
 *   <li>{@code ledgerbridge.vote.recorded}: adapter votes recorded</li>
 *   <li>{@code ledgerbridge.vote.duplicate}: repeated or late votes ignored</li>
 *   <li>{@code ledgerbridge.batch.delivered}: batches delivered after quorum</li>
 *   <li>{@code ledgerbridge.message.handled}: messages handled successfully</li>
 *   <li>{@code ledgerbridge.message.failed}: messages whose handler failed</li>
 *   <li>{@code ledgerbridge.recovery}: payloads injected by a ward</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter batchSent;
  private final Counter messageSent;
  private final Counter subsidyDebited;
  private final Counter unfundedFlush;
  private final Counter voteRecorded;
  private final Counter duplicateVote;
  private final Counter batchDelivered;
  private final Counter messageHandled;
  private final Counter messageFailed;
  private final Counter recovery;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "ledgerbridge"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "ledgerbridge");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several gateways in one
   * process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "eth.bridge"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.batchSent = counter(namePrefix + ".batch.sent", "Batches handed to adapters");
    this.messageSent = counter(namePrefix + ".message.sent", "Messages in sent batches");
    this.subsidyDebited = counter(namePrefix + ".subsidy.debited", "Subsidy debited for sent batches");
    this.unfundedFlush = counter(namePrefix + ".flush.unfunded", "Flushes refused for insufficient subsidy");
    this.voteRecorded = counter(namePrefix + ".vote.recorded", "Inbound adapter votes recorded");
    this.duplicateVote = counter(namePrefix + ".vote.duplicate", "Inbound votes ignored as repeats");
    this.batchDelivered = counter(namePrefix + ".batch.delivered", "Batches delivered after quorum");
    this.messageHandled = counter(namePrefix + ".message.handled", "Inbound messages handled");
    this.messageFailed = counter(namePrefix + ".message.failed", "Inbound messages whose handler failed");
    this.recovery = counter(namePrefix + ".recovery", "Payloads injected through recovery");
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementBatchSent(int messageCount) {
    if (closed) return;
    batchSent.increment();
    messageSent.increment(messageCount);
  }

  @Override
  public void recordSubsidyDebited(long amount) {
    if (closed) return;
    subsidyDebited.increment(amount);
  }

  @Override
  public void incrementUnfundedFlush() {
    if (closed) return;
    unfundedFlush.increment();
  }

  @Override
  public void incrementVoteRecorded() {
    if (closed) return;
    voteRecorded.increment();
  }

  @Override
  public void incrementDuplicateVote() {
    if (closed) return;
    duplicateVote.increment();
  }

  @Override
  public void incrementBatchDelivered() {
    if (closed) return;
    batchDelivered.increment();
  }

  @Override
  public void incrementMessageHandled() {
    if (closed) return;
    messageHandled.increment();
  }

  @Override
  public void incrementMessageFailed() {
    if (closed) return;
    messageFailed.increment();
  }

  @Override
  public void incrementRecovery() {
    if (closed) return;
    recovery.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(batchSent, messageSent, subsidyDebited, unfundedFlush,
        voteRecorded, duplicateVote, batchDelivered, messageHandled, messageFailed, recovery)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
