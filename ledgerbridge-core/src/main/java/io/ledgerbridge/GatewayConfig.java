package io.ledgerbridge;

/**
 * Gas limits applied by the {@link Gateway} when it assembles batches.
 *
 * @param messageGasLimit  base gas granted to every message on the destination side
 * @param maxBatchGasLimit upper bound on the summed gas of one batch
 */
public record GatewayConfig(long messageGasLimit, long maxBatchGasLimit) {

  public static final GatewayConfig DEFAULT = new GatewayConfig(100_000L, 25_000_000L);

  public GatewayConfig {
    if (messageGasLimit <= 0) {
      throw new IllegalArgumentException("messageGasLimit must be > 0");
    }
    if (maxBatchGasLimit < messageGasLimit) {
      throw new IllegalArgumentException("maxBatchGasLimit must be >= messageGasLimit");
    }
  }
}
