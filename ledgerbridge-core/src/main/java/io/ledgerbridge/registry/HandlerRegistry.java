package io.ledgerbridge.registry;

import io.ledgerbridge.MessageHandler;

/**
 * Registry for looking up the handler of an inbound message by its kind.
 *
 * @see MessageHandler
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler for a message kind.
   *
   * <p>The handler registered for the exact kind wins; otherwise the catch-all handler, if
   * any, is returned.
   *
   * @param kind the message kind, 0..255
   * @return the handler, or {@code null} if none applies
   */
  MessageHandler handlerFor(int kind);
}
