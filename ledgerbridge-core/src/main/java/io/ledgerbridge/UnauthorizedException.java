package io.ledgerbridge;

/**
 * Thrown when a caller that is not a ward tries to change configuration, or when an
 * adapter that is not registered for a network reports inbound bytes from it.
 */
public final class UnauthorizedException extends RuntimeException {
  public UnauthorizedException(String message) {
    super(message);
  }
}
