package io.ledgerbridge;

/**
 * Instruction to pay out withdrawn subsidy to a tenant's refund address.
 *
 * @param tenant        the tenant whose balance was debited
 * @param refundAddress where the amount is to be paid
 * @param amount        the amount debited
 */
public record SubsidyWithdrawal(long tenant, String refundAddress, long amount) {
}
