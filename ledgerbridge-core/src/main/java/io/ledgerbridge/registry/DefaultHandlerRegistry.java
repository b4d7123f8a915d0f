package io.ledgerbridge.registry;

import io.ledgerbridge.MessageHandler;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe registry mapping each message kind to a single handler.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register(MessageKinds.TRANSFER, (source, message) -> ledger.credit(message))
 *     .register(MessageKinds.PRICE_UPDATE, (source, message) -> prices.apply(message))
 *     .registerAll((source, message) -> audit.unhandled(source, message));
 * }</pre>
 *
 * @see HandlerRegistry
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final Map<Integer, MessageHandler> handlers = new ConcurrentHashMap<>();
  private final AtomicReference<MessageHandler> fallback = new AtomicReference<>();

  /**
   * Registers the handler for a message kind.
   *
   * @param kind    the message kind, 0..255
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered for {@code kind}
   */
  public DefaultHandlerRegistry register(int kind, MessageHandler handler) {
    if (kind < 0 || kind > 0xFF) {
      throw new IllegalArgumentException("kind must be in 0..255, got " + kind);
    }
    Objects.requireNonNull(handler, "handler");
    if (handlers.putIfAbsent(kind, handler) != null) {
      throw new IllegalStateException("Duplicate handler for message kind " + kind);
    }
    return this;
  }

  /**
   * Registers the catch-all handler for kinds without a dedicated one.
   *
   * @throws IllegalStateException if a catch-all handler is already registered
   */
  public DefaultHandlerRegistry registerAll(MessageHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (!fallback.compareAndSet(null, handler)) {
      throw new IllegalStateException("Duplicate catch-all handler");
    }
    return this;
  }

  @Override
  public MessageHandler handlerFor(int kind) {
    MessageHandler handler = handlers.get(kind);
    return handler != null ? handler : fallback.get();
  }
}
