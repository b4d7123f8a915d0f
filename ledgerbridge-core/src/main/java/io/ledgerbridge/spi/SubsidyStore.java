package io.ledgerbridge.spi;

import java.util.Optional;

/**
 * Per-tenant prepaid balance that funds outbound batches.
 *
 * <p>Balances never go negative: {@link #tryDebit} refuses rather than overdraws.
 *
 * @see io.ledgerbridge.store.InMemorySubsidyStore
 */
public interface SubsidyStore {

    /**
     * Returns the current balance, {@code 0} for a tenant never credited.
     */
    long balance(long tenant);

    /**
     * Adds to a tenant's balance.
     *
     * @param amount a positive amount
     */
    void credit(long tenant, long amount);

    /**
     * Subtracts from a tenant's balance if it covers the amount.
     *
     * @param amount a non-negative amount
     * @return {@code true} if debited, {@code false} if the balance was too low
     */
    boolean tryDebit(long tenant, long amount);

    Optional<String> refundAddress(long tenant);

    void setRefundAddress(long tenant, String refundAddress);
}
