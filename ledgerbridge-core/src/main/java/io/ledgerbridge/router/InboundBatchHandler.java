package io.ledgerbridge.router;

import io.ledgerbridge.Message;

import java.util.List;

/**
 * Receives batches the {@link MultiAdapter} has accepted by quorum. Called at most once
 * per source network and payload hash.
 */
@FunctionalInterface
public interface InboundBatchHandler {

  void onBatch(int sourceNetwork, List<Message> messages);
}
