package io.ledgerbridge;

/**
 * Thrown when a tenant's subsidy cannot cover a flush or a withdrawal. Nothing has been
 * sent or debited when this is thrown.
 */
public final class InsufficientSubsidyException extends RuntimeException {
  private final long tenant;
  private final long required;
  private final long available;

  public InsufficientSubsidyException(long tenant, long required, long available) {
    super("Insufficient subsidy for tenant " + tenant + ": required " + required + ", available " + available);
    this.tenant = tenant;
    this.required = required;
    this.available = available;
  }

  public long tenant() {
    return tenant;
  }

  public long required() {
    return required;
  }

  public long available() {
    return available;
  }
}
