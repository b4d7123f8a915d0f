/**
 * Bit-exact wire format shared by every adapter on a network pair.
 *
 * <p>Two frame kinds exist. A batch frame ({@link io.ledgerbridge.codec.BatchCodec}) packs
 * length-prefixed messages. A proof frame ({@link io.ledgerbridge.codec.ProofFrame}) carries
 * only the {@link io.ledgerbridge.codec.PayloadHash} of a batch. The first byte decides which
 * one a receiver holds. Malformed frames raise
 * {@link io.ledgerbridge.codec.FrameFormatException}.
 */
package io.ledgerbridge.codec;
