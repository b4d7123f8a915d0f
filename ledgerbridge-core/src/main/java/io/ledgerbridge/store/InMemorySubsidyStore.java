package io.ledgerbridge.store;

import io.ledgerbridge.spi.SubsidyStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Heap-backed {@link SubsidyStore}.
 */
public final class InMemorySubsidyStore implements SubsidyStore {
  private final Map<Long, Long> balances = new HashMap<>();
  private final Map<Long, String> refundAddresses = new HashMap<>();

  @Override
  public synchronized long balance(long tenant) {
    return balances.getOrDefault(tenant, 0L);
  }

  @Override
  public synchronized void credit(long tenant, long amount) {
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
    balances.merge(tenant, amount, Math::addExact);
  }

  @Override
  public synchronized boolean tryDebit(long tenant, long amount) {
    if (amount < 0) {
      throw new IllegalArgumentException("amount must be >= 0");
    }
    long balance = balance(tenant);
    if (balance < amount) {
      return false;
    }
    balances.put(tenant, balance - amount);
    return true;
  }

  @Override
  public synchronized Optional<String> refundAddress(long tenant) {
    return Optional.ofNullable(refundAddresses.get(tenant));
  }

  @Override
  public synchronized void setRefundAddress(long tenant, String refundAddress) {
    refundAddresses.put(tenant, Objects.requireNonNull(refundAddress, "refundAddress"));
  }
}
