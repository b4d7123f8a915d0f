package io.ledgerbridge.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC bridge stores.
 */
public final class BridgeStoreException extends RuntimeException {
  public BridgeStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
