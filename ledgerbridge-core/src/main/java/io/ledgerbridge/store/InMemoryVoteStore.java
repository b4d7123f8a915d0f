package io.ledgerbridge.store;

import io.ledgerbridge.codec.PayloadHash;
import io.ledgerbridge.router.VoteRecord;
import io.ledgerbridge.spi.VoteStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link VoteStore}. State is lost on restart.
 */
public final class InMemoryVoteStore implements VoteStore {
  private final Map<Key, VoteRecord> records = new ConcurrentHashMap<>();

  @Override
  public Optional<VoteRecord> find(int sourceNetwork, PayloadHash hash) {
    return Optional.ofNullable(records.get(new Key(sourceNetwork, hash)));
  }

  @Override
  public Map<PayloadHash, VoteRecord.Held> held(int sourceNetwork) {
    Map<PayloadHash, VoteRecord.Held> held = new LinkedHashMap<>();
    records.forEach((key, record) -> {
      if (key.sourceNetwork() == sourceNetwork && record instanceof VoteRecord.Held h) {
        held.put(key.hash(), h);
      }
    });
    return held;
  }

  @Override
  public void save(int sourceNetwork, PayloadHash hash, VoteRecord record) {
    Objects.requireNonNull(record, "record");
    records.put(new Key(sourceNetwork, hash), record);
  }

  private record Key(int sourceNetwork, PayloadHash hash) {
    Key {
      Objects.requireNonNull(hash, "hash");
    }
  }
}
