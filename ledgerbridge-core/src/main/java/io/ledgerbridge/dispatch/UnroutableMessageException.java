package io.ledgerbridge.dispatch;

/**
 * Thrown when no handler is registered for a message's kind.
 *
 * <p>The message is recorded as failed and can be retried once a handler exists.
 */
public final class UnroutableMessageException extends Exception {

    public UnroutableMessageException(String message) {
        super(message);
    }
}
