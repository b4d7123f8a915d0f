package io.ledgerbridge.spi;

import io.ledgerbridge.Message;
import io.ledgerbridge.codec.PayloadHash;

import java.util.List;

/**
 * Record of inbound messages whose handler failed, counted per source network and
 * message hash.
 *
 * @see io.ledgerbridge.store.InMemoryFailedMessageStore
 */
public interface FailedMessageStore {

    /**
     * Increments the failure count of a message and remembers the latest error.
     *
     * @param error failure description, may be {@code null}
     */
    void recordFailure(int sourceNetwork, Message message, String error);

    /**
     * Returns the outstanding failure count, {@code 0} if none.
     */
    int failureCount(int sourceNetwork, PayloadHash messageHash);

    /**
     * Decrements the failure count by one, removing the entry when it reaches zero.
     *
     * @return {@code true} if a failure was outstanding
     */
    boolean clearOne(int sourceNetwork, PayloadHash messageHash);

    /**
     * Lists outstanding failures for a source network, oldest first.
     */
    List<FailedMessage> failures(int sourceNetwork);
}
