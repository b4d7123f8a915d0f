/**
 * Quorum routing over multiple relay adapters.
 *
 * <p>{@link io.ledgerbridge.router.MultiAdapter} fans outbound batches out as one payload
 * plus hash-only proofs, and accepts inbound batches once per hash after a threshold of
 * registered adapters agree on it.
 */
package io.ledgerbridge.router;
