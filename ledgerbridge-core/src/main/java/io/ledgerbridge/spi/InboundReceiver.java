package io.ledgerbridge.spi;

/**
 * Entry point adapters call when bytes arrive from a remote network.
 */
public interface InboundReceiver {

    /**
     * Reports a frame received from a remote network.
     *
     * @param sourceNetwork    the network the frame came from
     * @param reportingAdapter the adapter reporting the frame
     * @param payload          a batch frame or a proof frame
     * @throws io.ledgerbridge.UnauthorizedException if the adapter is not registered for
     *     {@code sourceNetwork}
     * @throws io.ledgerbridge.codec.FrameFormatException if the frame is malformed
     */
    void receive(int sourceNetwork, Adapter reportingAdapter, byte[] payload);
}
