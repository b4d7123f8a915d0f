package io.ledgerbridge.registry;

import io.ledgerbridge.MessageHandler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultHandlerRegistryTest {

  @Test
  void returnsNullForUnregisteredKind() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertNull(registry.handlerFor(1));
  }

  @Test
  void returnsRegisteredHandler() {
    MessageHandler handler = (source, message) -> { };
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry().register(1, handler);

    assertSame(handler, registry.handlerFor(1));
    assertNull(registry.handlerFor(2));
  }

  @Test
  void specificHandlerWinsOverCatchAll() {
    MessageHandler specific = (source, message) -> { };
    MessageHandler fallback = (source, message) -> { };
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register(3, specific)
        .registerAll(fallback);

    assertSame(specific, registry.handlerFor(3));
    assertSame(fallback, registry.handlerFor(4));
  }

  @Test
  void rejectsDuplicateKind() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry().register(1, (source, message) -> { });

    assertThrows(IllegalStateException.class, () -> registry.register(1, (source, message) -> { }));
  }

  @Test
  void rejectsSecondCatchAll() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry().registerAll((source, message) -> { });

    assertThrows(IllegalStateException.class, () -> registry.registerAll((source, message) -> { }));
  }

  @Test
  void rejectsKindOutOfRange() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertThrows(IllegalArgumentException.class, () -> registry.register(256, (source, message) -> { }));
  }
}
