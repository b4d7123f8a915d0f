package io.ledgerbridge;

/**
 * Tenant identifiers. Tenants scope adapter registrations and subsidy balances; the
 * {@link #GLOBAL} tenant is the network-wide scope every tenant falls back to.
 */
public final class Tenant {
  public static final long GLOBAL = 0L;

  private Tenant() {}
}
