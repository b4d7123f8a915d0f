package io.ledgerbridge.router;

import io.ledgerbridge.RecordingAdapter;
import io.ledgerbridge.spi.Adapter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdapterSetTest {
  private final Adapter a = new RecordingAdapter("a");
  private final Adapter b = new RecordingAdapter("b");
  private final Adapter c = new RecordingAdapter("c");

  @Test
  void sendingAdaptersStopAtRecoveryIndex() {
    AdapterSet set = new AdapterSet(List.of(a, b, c), 2, 2, 1);

    assertEquals(List.of(a, b), set.sendingAdapters());
    assertSame(b, set.primary());
  }

  @Test
  void rejectsEmpty() {
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(), 1, 1, 0));
  }

  @Test
  void rejectsThresholdOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(a, b), 0, 2, 0));
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(a, b), 3, 2, 0));
  }

  @Test
  void rejectsRecoveryIndexBelowThresholdOrAboveSize() {
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(a, b, c), 2, 1, 0));
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(a, b, c), 2, 4, 0));
  }

  @Test
  void rejectsPrimaryOutsideSendingAdapters() {
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(a, b, c), 1, 2, 2));
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(a, b, c), 1, 2, -1));
  }

  @Test
  void rejectsDuplicates() {
    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(List.of(a, b, a), 2, 3, 0));
    assertThrows(IllegalArgumentException.class,
        () -> new AdapterSet(List.of(a, new RecordingAdapter("a")), 1, 2, 0));
  }

  @Test
  void rejectsTooManyAdapters() {
    List<Adapter> adapters = new ArrayList<>();
    for (int i = 0; i <= AdapterSet.MAX_ADAPTER_COUNT; i++) {
      adapters.add(new RecordingAdapter("adapter-" + i));
    }

    assertThrows(IllegalArgumentException.class, () -> new AdapterSet(adapters, 1, 1, 0));
  }

  @Test
  void containsChecksIdentity() {
    AdapterSet set = new AdapterSet(List.of(a, b), 1, 2, 0);

    assertTrue(set.contains(a));
    assertFalse(set.contains(new RecordingAdapter("a")));
  }
}
