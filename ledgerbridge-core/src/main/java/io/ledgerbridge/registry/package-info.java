/**
 * Inbound message routing by message kind.
 *
 * <p>The registry maps each kind to a single {@link io.ledgerbridge.MessageHandler}, with
 * an optional catch-all. Messages with no matching handler are unroutable and recorded as
 * failed.
 *
 * @see io.ledgerbridge.registry.HandlerRegistry
 * @see io.ledgerbridge.registry.DefaultHandlerRegistry
 */
package io.ledgerbridge.registry;
