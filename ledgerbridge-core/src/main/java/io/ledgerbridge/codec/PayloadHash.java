package io.ledgerbridge.codec;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Fixed-width SHA-256 content hash of a batch (or of a single message).
 *
 * <p>Instances are immutable. {@link #toString()} renders lowercase hex.
 */
public final class PayloadHash {
  public static final int LENGTH = 32;

  private static final HexFormat HEX = HexFormat.of();

  private final byte[] bytes;

  private PayloadHash(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Hashes the given bytes.
   *
   * @param data the bytes to hash
   * @return the SHA-256 hash of {@code data}
   */
  public static PayloadHash of(byte[] data) {
    Objects.requireNonNull(data, "data");
    try {
      return new PayloadHash(MessageDigest.getInstance("SHA-256").digest(data));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Wraps an already computed 32-byte hash.
   *
   * @param raw the raw hash bytes
   * @return the hash
   * @throws IllegalArgumentException if {@code raw} is not {@value #LENGTH} bytes
   */
  public static PayloadHash fromBytes(byte[] raw) {
    Objects.requireNonNull(raw, "raw");
    if (raw.length != LENGTH) {
      throw new IllegalArgumentException("Hash must be " + LENGTH + " bytes, got " + raw.length);
    }
    return new PayloadHash(Arrays.copyOf(raw, LENGTH));
  }

  public static PayloadHash fromHex(String hex) {
    Objects.requireNonNull(hex, "hex");
    return fromBytes(HEX.parseHex(hex));
  }

  public byte[] toBytes() {
    return Arrays.copyOf(bytes, LENGTH);
  }

  public String toHex() {
    return HEX.formatHex(bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PayloadHash other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
