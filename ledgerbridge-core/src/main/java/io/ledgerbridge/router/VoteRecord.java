package io.ledgerbridge.router;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Inbound state of one payload hash from one source network.
 *
 * <p>Lifecycle: {@code Pending -> Held -> Delivered}, or {@code Held} directly when the
 * payload arrives first. {@link Delivered} is terminal.
 */
public sealed interface VoteRecord {

  /** Ids of the adapters that voted for this hash, in no particular order. */
  Set<String> voters();

  /** Votes recorded, payload not yet seen. */
  record Pending(Set<String> voters) implements VoteRecord {
    public Pending {
      voters = Set.copyOf(voters);
    }
  }

  /** Payload held (validated batch frame), waiting for quorum. */
  record Held(Set<String> voters, byte[] payload) implements VoteRecord {
    public Held {
      voters = Set.copyOf(voters);
      Objects.requireNonNull(payload, "payload");
      payload = Arrays.copyOf(payload, payload.length);
    }

    @Override
    public byte[] payload() {
      return Arrays.copyOf(payload, payload.length);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Held other
          && voters.equals(other.voters)
          && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
      return 31 * voters.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
      return "Held[voters=" + voters + ", payloadLength=" + payload.length + "]";
    }
  }

  /** Handed to the inbound handler. Later votes for this hash are ignored. */
  record Delivered(Set<String> voters, Instant deliveredAt) implements VoteRecord {
    public Delivered {
      voters = Set.copyOf(voters);
      Objects.requireNonNull(deliveredAt, "deliveredAt");
    }
  }
}
