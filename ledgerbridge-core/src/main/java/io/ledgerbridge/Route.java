package io.ledgerbridge;

/**
 * A remote network as seen by one tenant.
 *
 * @param network the remote network id
 * @param tenant  the tenant id, {@link Tenant#GLOBAL} for the network-wide scope
 */
public record Route(int network, long tenant) {

  public Route {
    if (network < 0) {
      throw new IllegalArgumentException("network must be >= 0");
    }
    if (tenant < 0) {
      throw new IllegalArgumentException("tenant must be >= 0");
    }
  }

  public static Route global(int network) {
    return new Route(network, Tenant.GLOBAL);
  }

  public boolean isGlobal() {
    return tenant == Tenant.GLOBAL;
  }
}
