package io.ledgerbridge;

import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.spi.AdapterReceipt;

import java.util.List;

/**
 * Record of one batch handed to the adapters.
 *
 * @param batchId      locally unique id (ULID) for logs and tracing
 * @param route        destination network and paying tenant
 * @param hash         content hash the destination votes on
 * @param messageCount number of messages in the batch
 * @param cost         subsidy debited for the batch
 * @param receipts     one receipt per adapter that was sent to, in registration order
 */
public record BatchReceipt(
    String batchId,
    Route route,
    PayloadHash hash,
    int messageCount,
    long cost,
    List<AdapterReceipt> receipts) {

  public BatchReceipt {
    receipts = List.copyOf(receipts);
  }
}
