package io.ledgerbridge;

/**
 * Thrown when no adapter set is configured for a route, neither for its tenant nor for
 * the global scope.
 */
public final class UnknownDestinationException extends RuntimeException {
  private final Route route;

  public UnknownDestinationException(Route route) {
    super("No adapters configured for network " + route.network() + " (tenant " + route.tenant() + ")");
    this.route = route;
  }

  public Route route() {
    return route;
  }
}
