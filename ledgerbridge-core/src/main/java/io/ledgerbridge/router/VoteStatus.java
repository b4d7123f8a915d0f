package io.ledgerbridge.router;

/**
 * Operator-facing summary of a {@link VoteRecord}.
 */
public enum VoteStatus {
  /** Nothing recorded for the hash. */
  UNKNOWN,
  /** Payload held or not, quorum not reached. */
  PENDING,
  /** Quorum reached but the payload has not arrived; recoverable with {@link MultiAdapter#recover}. */
  AWAITING_PAYLOAD,
  DELIVERED
}
