package io.ledgerbridge;

import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.spi.AdapterReceipt;

import java.util.List;

/**
 * Thrown when an adapter fails while a batch is being sent. Adapters earlier in the
 * registration may already have accepted their frame; their receipts and quoted cost are
 * carried here so the caller can account for them.
 */
public final class AdapterSendException extends RuntimeException {
  private final String adapterId;
  private final int remoteNetwork;
  private final PayloadHash hash;
  private final long acceptedCost;
  private final List<AdapterReceipt> accepted;

  public AdapterSendException(String adapterId, int remoteNetwork, PayloadHash hash,
      long acceptedCost, List<AdapterReceipt> accepted, Throwable cause) {
    super("Adapter " + adapterId + " failed to send batch " + hash + " to network " + remoteNetwork
        + " after " + accepted.size() + " adapters accepted", cause);
    this.adapterId = adapterId;
    this.remoteNetwork = remoteNetwork;
    this.hash = hash;
    this.acceptedCost = acceptedCost;
    this.accepted = List.copyOf(accepted);
  }

  public String adapterId() {
    return adapterId;
  }

  public int remoteNetwork() {
    return remoteNetwork;
  }

  public PayloadHash hash() {
    return hash;
  }

  /** Summed estimate of the adapters that accepted their frame before the failure. */
  public long acceptedCost() {
    return acceptedCost;
  }

  public List<AdapterReceipt> accepted() {
    return accepted;
  }
}
