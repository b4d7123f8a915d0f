package io.ledgerbridge.store;

import io.ledgerbridge.Message;
import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.spi.FailedMessage;
import io.ledgerbridge.spi.FailedMessageStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Heap-backed {@link FailedMessageStore}. Entries keep their first-failure order.
 */
public final class InMemoryFailedMessageStore implements FailedMessageStore {
  private final Map<Key, FailedMessage> entries = new LinkedHashMap<>();

  @Override
  public synchronized void recordFailure(int sourceNetwork, Message message, String error) {
    Objects.requireNonNull(message, "message");
    Key key = new Key(sourceNetwork, message.hash());
    FailedMessage existing = entries.get(key);
    int count = existing != null ? existing.count() + 1 : 1;
    entries.put(key, new FailedMessage(sourceNetwork, message, count, error, Instant.now()));
  }

  @Override
  public synchronized int failureCount(int sourceNetwork, PayloadHash messageHash) {
    FailedMessage entry = entries.get(new Key(sourceNetwork, messageHash));
    return entry != null ? entry.count() : 0;
  }

  @Override
  public synchronized boolean clearOne(int sourceNetwork, PayloadHash messageHash) {
    Key key = new Key(sourceNetwork, messageHash);
    FailedMessage entry = entries.get(key);
    if (entry == null) {
      return false;
    }
    if (entry.count() <= 1) {
      entries.remove(key);
    } else {
      entries.put(key, new FailedMessage(sourceNetwork, entry.message(), entry.count() - 1,
          entry.lastError(), entry.lastFailedAt()));
    }
    return true;
  }

  @Override
  public synchronized List<FailedMessage> failures(int sourceNetwork) {
    List<FailedMessage> result = new ArrayList<>();
    for (FailedMessage entry : entries.values()) {
      if (entry.sourceNetwork() == sourceNetwork) {
        result.add(entry);
      }
    }
    return List.copyOf(result);
  }

  private record Key(int sourceNetwork, PayloadHash hash) {
    Key {
      Objects.requireNonNull(hash, "hash");
    }
  }
}
