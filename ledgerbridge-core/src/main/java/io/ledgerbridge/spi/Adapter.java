package io.ledgerbridge.spi;

/**
 * One independent relay channel between the local network and remote networks.
 *
 * <p>Adapters are untrusted: they may drop, delay, duplicate or forge frames. The
 * {@link io.ledgerbridge.router.MultiAdapter} only trusts content that a quorum of them
 * agrees on. Inbound bytes are reported through {@link InboundReceiver#receive}, passing the
 * adapter instance itself so the router can check it is registered.
 *
 * <p>Nothing is assumed about retries, ordering or latency of the underlying transport.
 */
public interface Adapter {

    /**
     * Stable identifier, unique within one registration. Used to record votes.
     */
    String id();

    /**
     * Transmits a frame to a remote network.
     *
     * @param remoteNetwork the destination network
     * @param payload       a batch frame or a proof frame
     * @param gasLimit      gas the destination should make available for processing
     * @param refundAddress where unused fees are refunded, may be {@code null}
     * @return the transport's receipt
     */
    AdapterReceipt send(int remoteNetwork, byte[] payload, long gasLimit, String refundAddress);

    /**
     * Quotes the cost of {@link #send} for the same arguments.
     *
     * @return the cost in subsidy units, never negative
     */
    long estimate(int remoteNetwork, byte[] payload, long gasLimit);
}
