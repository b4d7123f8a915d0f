package io.ledgerbridge.router;

import io.ledgerbridge.codec.PayloadHash;

import java.util.Set;

/**
 * Point-in-time view of the votes for one hash.
 *
 * @param sourceNetwork the source network
 * @param hash          the payload hash
 * @param status        summarized state
 * @param voters        adapter ids that voted
 * @param payloadHeld   whether the payload has been received
 * @param threshold     votes needed under the registration in force, {@code 0} if none
 */
public record VoteSnapshot(
    int sourceNetwork,
    PayloadHash hash,
    VoteStatus status,
    Set<String> voters,
    boolean payloadHeld,
    int threshold) {

  public VoteSnapshot {
    voters = Set.copyOf(voters);
  }
}
