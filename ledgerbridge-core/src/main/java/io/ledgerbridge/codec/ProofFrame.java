package io.ledgerbridge.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Hash-only stand-in for a batch, sent by every non-primary adapter.
 *
 * <p>Layout: one marker byte {@code 0xFF} followed by the {@value PayloadHash#LENGTH}-byte
 * hash of the batch. Batch frames can never start with {@code 0xFF} because
 * {@link io.ledgerbridge.Message#MAX_LENGTH} keeps the high byte of every length prefix
 * below it, so the first byte alone tells the two apart.
 *
 * <p>A new proof layout must use a new marker byte.
 */
public final class ProofFrame {
  public static final byte MARKER = (byte) 0xFF;
  public static final int LENGTH = 1 + PayloadHash.LENGTH;

  private ProofFrame() {}

  public static byte[] pack(PayloadHash hash) {
    Objects.requireNonNull(hash, "hash");
    byte[] frame = new byte[LENGTH];
    frame[0] = MARKER;
    System.arraycopy(hash.toBytes(), 0, frame, 1, PayloadHash.LENGTH);
    return frame;
  }

  /**
   * Returns {@code true} if the frame carries the proof marker. Only the first byte is
   * inspected; use {@link #unpack} to validate the rest.
   */
  public static boolean isProof(byte[] frame) {
    return frame != null && frame.length > 0 && frame[0] == MARKER;
  }

  /**
   * Extracts the hash carried by a proof frame.
   *
   * @throws FrameFormatException if the frame is not a well-formed proof frame
   */
  public static PayloadHash unpack(byte[] frame) {
    Objects.requireNonNull(frame, "frame");
    if (!isProof(frame)) {
      throw new FrameFormatException("Not a proof frame");
    }
    if (frame.length != LENGTH) {
      throw new FrameFormatException("Proof frame must be " + LENGTH + " bytes, got " + frame.length);
    }
    return PayloadHash.fromBytes(Arrays.copyOfRange(frame, 1, LENGTH));
  }
}
