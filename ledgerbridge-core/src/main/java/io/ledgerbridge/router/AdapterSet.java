package io.ledgerbridge.router;

import io.ledgerbridge.spi.Adapter;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable adapter registration for one remote network and tenant.
 *
 * <p>Adapters are ordered. The adapter at {@code primaryIndex} carries the batch payload,
 * the other adapters below {@code recoveryIndex} carry proof frames. Adapters at or beyond
 * {@code recoveryIndex} send nothing but still vote on inbound traffic, which keeps spare
 * channels available for recovery without paying for them on every batch.
 *
 * <p>Constraints, checked at construction:
 * <ul>
 *   <li>{@code 1 <= adapters.size() <= }{@value #MAX_ADAPTER_COUNT}</li>
 *   <li>{@code 1 <= threshold <= recoveryIndex <= adapters.size()}</li>
 *   <li>{@code 0 <= primaryIndex < recoveryIndex}</li>
 *   <li>no adapter instance and no adapter id appears twice</li>
 * </ul>
 */
public final class AdapterSet {
  public static final int MAX_ADAPTER_COUNT = 8;

  private final List<Adapter> adapters;
  private final int threshold;
  private final int recoveryIndex;
  private final int primaryIndex;
  private final Set<String> ids;

  public AdapterSet(List<Adapter> adapters, int threshold, int recoveryIndex, int primaryIndex) {
    Objects.requireNonNull(adapters, "adapters");
    if (adapters.isEmpty()) {
      throw new IllegalArgumentException("At least one adapter is required");
    }
    if (adapters.size() > MAX_ADAPTER_COUNT) {
      throw new IllegalArgumentException("At most " + MAX_ADAPTER_COUNT + " adapters allowed, got " + adapters.size());
    }
    if (threshold < 1 || threshold > adapters.size()) {
      throw new IllegalArgumentException("threshold must be in 1.." + adapters.size() + ", got " + threshold);
    }
    if (recoveryIndex < threshold || recoveryIndex > adapters.size()) {
      throw new IllegalArgumentException("recoveryIndex must be in " + threshold + ".." + adapters.size()
          + ", got " + recoveryIndex);
    }
    if (primaryIndex < 0 || primaryIndex >= recoveryIndex) {
      throw new IllegalArgumentException("primaryIndex must be in 0.." + (recoveryIndex - 1) + ", got " + primaryIndex);
    }
    Set<String> seen = new HashSet<>();
    for (Adapter adapter : adapters) {
      Objects.requireNonNull(adapter, "adapter");
      String id = Objects.requireNonNull(adapter.id(), "adapter id");
      if (id.isBlank() || id.indexOf(',') >= 0) {
        throw new IllegalArgumentException("Adapter id must be non-blank and contain no ',': '" + id + "'");
      }
      if (!seen.add(id)) {
        throw new IllegalArgumentException("Duplicate adapter: " + id);
      }
    }
    this.adapters = List.copyOf(adapters);
    this.threshold = threshold;
    this.recoveryIndex = recoveryIndex;
    this.primaryIndex = primaryIndex;
    this.ids = Set.copyOf(seen);
  }

  public List<Adapter> adapters() {
    return adapters;
  }

  public int threshold() {
    return threshold;
  }

  public int recoveryIndex() {
    return recoveryIndex;
  }

  public int primaryIndex() {
    return primaryIndex;
  }

  public Adapter primary() {
    return adapters.get(primaryIndex);
  }

  /** Adapters that transmit outbound frames, in registration order. */
  public List<Adapter> sendingAdapters() {
    return adapters.subList(0, recoveryIndex);
  }

  public Set<String> ids() {
    return ids;
  }

  /** Identity check: {@code true} only for the registered instance itself. */
  public boolean contains(Adapter adapter) {
    for (Adapter registered : adapters) {
      if (registered == adapter) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "AdapterSet{ids=" + adapters.stream().map(Adapter::id).toList()
        + ", threshold=" + threshold
        + ", recoveryIndex=" + recoveryIndex
        + ", primaryIndex=" + primaryIndex + '}';
  }
}
