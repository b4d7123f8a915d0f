package io.ledgerbridge;

import io.ledgerbridge.codec.PayloadHash;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable domain sub-message: one business event relayed to a remote network.
 *
 * <p>The payload is opaque to the transport. By convention its first byte is the
 * message kind, which the {@linkplain io.ledgerbridge.registry.HandlerRegistry handler
 * registry} uses for routing on the receiving side. Length is limited to
 * {@value #MAX_LENGTH} bytes so packed length prefixes never collide with the proof
 * frame marker.
 *
 * @see io.ledgerbridge.codec.BatchCodec
 */
public final class Message {
  public static final int MAX_LENGTH = 0xFEFF;

  private final byte[] bytes;

  private Message(byte[] bytes) {
    if (bytes.length == 0) {
      throw new IllegalArgumentException("Message cannot be empty");
    }
    if (bytes.length > MAX_LENGTH) {
      throw new IllegalArgumentException("Message exceeds maximum size of " + MAX_LENGTH + " bytes");
    }
    this.bytes = bytes;
  }

  /**
   * Creates a message from raw bytes; the first byte is taken as the kind.
   *
   * @param bytes the encoded message (copied)
   * @return a new message
   */
  public static Message of(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    return new Message(Arrays.copyOf(bytes, bytes.length));
  }

  /**
   * Creates a message from a kind tag and a body.
   *
   * @param kind the kind tag, 0..255
   * @param body the body bytes (copied)
   * @return a new message
   */
  public static Message of(int kind, byte[] body) {
    Objects.requireNonNull(body, "body");
    if (kind < 0 || kind > 0xFF) {
      throw new IllegalArgumentException("kind must be in 0..255");
    }
    byte[] bytes = new byte[body.length + 1];
    bytes[0] = (byte) kind;
    System.arraycopy(body, 0, bytes, 1, body.length);
    return new Message(bytes);
  }

  public int kind() {
    return bytes[0] & 0xFF;
  }

  public byte[] body() {
    return Arrays.copyOfRange(bytes, 1, bytes.length);
  }

  public int length() {
    return bytes.length;
  }

  public byte[] toBytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  /** Content hash used to key failed-message records. */
  public PayloadHash hash() {
    return PayloadHash.of(bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Message other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Message{kind=" + kind() + ", length=" + bytes.length + '}';
  }
}
