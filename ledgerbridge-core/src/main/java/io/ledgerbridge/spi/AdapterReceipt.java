package io.ledgerbridge.spi;

/**
 * Result of handing one frame to one adapter.
 *
 * @param adapterId the adapter that accepted the frame
 * @param reference transport-specific reference (message id, tx hash), may be {@code null}
 * @param cost      what the adapter charged
 */
public record AdapterReceipt(String adapterId, String reference, long cost) {
}
