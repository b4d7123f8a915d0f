package io.ledgerbridge.spi;

import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.router.VoteRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Persistence of inbound vote state, keyed by source network and payload hash.
 *
 * <p>Only the {@link io.ledgerbridge.router.MultiAdapter} writes to this store, and it
 * serializes its own calls.
 *
 * @see io.ledgerbridge.store.InMemoryVoteStore
 */
public interface VoteStore {

    /**
     * Looks up the record for a hash.
     *
     * @return the record, or empty if no vote or payload has been seen for it
     */
    Optional<VoteRecord> find(int sourceNetwork, PayloadHash hash);

    /**
     * Lists the batches from a network whose payload is known but which have not reached
     * their threshold yet. Read when a network's adapter sets change.
     */
    Map<PayloadHash, VoteRecord.Held> held(int sourceNetwork);

    /**
     * Inserts or replaces the record for a hash.
     */
    void save(int sourceNetwork, PayloadHash hash, VoteRecord record);
}
