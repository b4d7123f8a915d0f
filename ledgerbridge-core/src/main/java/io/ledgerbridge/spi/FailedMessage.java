package io.ledgerbridge.spi;

import io.ledgerbridge.Message;

import java.time.Instant;

/**
 * Outstanding failure of one inbound message.
 *
 * @param sourceNetwork the network the message came from
 * @param message       the message that failed
 * @param count         how many deliveries of it have failed without a successful retry
 * @param lastError     the latest failure description, may be {@code null}
 * @param lastFailedAt  when it last failed
 */
public record FailedMessage(int sourceNetwork, Message message, int count, String lastError, Instant lastFailedAt) {
}
