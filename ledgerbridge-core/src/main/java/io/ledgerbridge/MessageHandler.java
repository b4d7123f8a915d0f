package io.ledgerbridge;

/**
 * Domain handler for messages arriving from a remote network.
 *
 * <p>Handlers run synchronously inside the inbound call that completed quorum, once per
 * message and in batch order. A handler must not call back into the
 * {@link io.ledgerbridge.router.MultiAdapter} or {@link Gateway} inbound path.
 *
 * <h2>Error Handling</h2>
 * <p>An exception fails only the message at hand. It is recorded as a failed message that
 * can later be replayed with {@link Gateway#retry}; the remaining messages of the batch are
 * still dispatched.
 *
 * @see io.ledgerbridge.registry.HandlerRegistry
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * Handles one message.
   *
   * @param sourceNetwork the network the message came from
   * @param message       the decoded message
   * @throws Exception if handling fails
   */
  void handle(int sourceNetwork, Message message) throws Exception;
}
