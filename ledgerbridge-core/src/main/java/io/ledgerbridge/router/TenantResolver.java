package io.ledgerbridge.router;

import io.ledgerbridge.Message;
import io.ledgerbridge.Tenant;

import java.util.List;

/**
 * Derives the tenant of an inbound batch from its decoded messages. The tenant selects
 * which registration's threshold and voter set apply.
 */
@FunctionalInterface
public interface TenantResolver {

  /** Resolves every batch to {@link Tenant#GLOBAL}. */
  TenantResolver GLOBAL = (sourceNetwork, messages) -> Tenant.GLOBAL;

  long resolve(int sourceNetwork, List<Message> messages);
}
