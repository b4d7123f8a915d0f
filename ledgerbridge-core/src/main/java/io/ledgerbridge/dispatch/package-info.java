/**
 * Inbound message dispatch with per-message failure isolation.
 *
 * @see io.ledgerbridge.dispatch.InboundDispatcher
 * @see io.ledgerbridge.dispatch.MessageInterceptor
 */
package io.ledgerbridge.dispatch;
