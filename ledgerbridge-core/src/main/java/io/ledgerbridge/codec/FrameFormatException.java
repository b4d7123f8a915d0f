package io.ledgerbridge.codec;

/**
 * Unchecked exception for inbound or outbound frames that violate the wire format.
 *
 * <p>Decoding fails closed: when this is thrown, no part of the frame has been
 * handed to any caller.
 */
public final class FrameFormatException extends RuntimeException {
  public FrameFormatException(String message) {
    super(message);
  }
}
