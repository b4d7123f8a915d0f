package io.ledgerbridge;

/**
 * Thrown when a message is sent on a route a ward has blocked.
 */
public final class OutgoingBlockedException extends RuntimeException {
  private final Route route;

  public OutgoingBlockedException(Route route) {
    super("Outgoing messages blocked for network " + route.network() + " (tenant " + route.tenant() + ")");
    this.route = route;
  }

  public Route route() {
    return route;
  }
}
