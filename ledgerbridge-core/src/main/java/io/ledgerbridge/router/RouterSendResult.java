package io.ledgerbridge.router;

import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.spi.AdapterReceipt;

import java.util.List;

/**
 * Outcome of {@link MultiAdapter#send}.
 *
 * @param hash     hash of the batch, carried by every proof frame
 * @param quoted   summed estimate of all sending adapters
 * @param receipts receipts in registration order, primary included
 */
public record RouterSendResult(PayloadHash hash, long quoted, List<AdapterReceipt> receipts) {

  public RouterSendResult {
    receipts = List.copyOf(receipts);
  }
}
