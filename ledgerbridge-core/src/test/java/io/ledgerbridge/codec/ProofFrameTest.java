package io.ledgerbridge.codec;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ProofFrameTest {

  @Test
  void carriesMarkerAndHash() {
    PayloadHash hash = PayloadHash.of(new byte[] {0, 1, 42});

    byte[] frame = ProofFrame.pack(hash);

    assertEquals(33, frame.length);
    assertEquals((byte) 0xFF, frame[0]);
    assertTrue(ProofFrame.isProof(frame));
    assertEquals(hash, ProofFrame.unpack(frame));
  }

  @Test
  void batchFramesAreNotProofs() {
    assertFalse(ProofFrame.isProof(new byte[] {0, 1, 42}));
    assertFalse(ProofFrame.isProof(new byte[0]));
    assertFalse(ProofFrame.isProof(null));
  }

  @Test
  void rejectsWrongLength() {
    byte[] frame = ProofFrame.pack(PayloadHash.of(new byte[] {1}));

    assertThrows(FrameFormatException.class, () -> ProofFrame.unpack(Arrays.copyOf(frame, 32)));
    assertThrows(FrameFormatException.class, () -> ProofFrame.unpack(Arrays.copyOf(frame, 34)));
  }

  @Test
  void rejectsNonProof() {
    assertThrows(FrameFormatException.class, () -> ProofFrame.unpack(new byte[33]));
  }
}
