package io.ledgerbridge;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

  @Test
  void kindIsFirstByte() {
    Message message = Message.of(7, "hello".getBytes(StandardCharsets.UTF_8));

    assertEquals(7, message.kind());
    assertEquals("hello", new String(message.body(), StandardCharsets.UTF_8));
    assertEquals(6, message.length());
  }

  @Test
  void kindAbove127IsUnsigned() {
    Message message = Message.of(new byte[] {(byte) 0xC8, 1});

    assertEquals(200, message.kind());
  }

  @Test
  void copiesInputBytes() {
    byte[] raw = {1, 2, 3};
    Message message = Message.of(raw);
    raw[1] = 99;

    assertArrayEquals(new byte[] {1, 2, 3}, message.toBytes());
  }

  @Test
  void rejectsEmptyMessage() {
    assertThrows(IllegalArgumentException.class, () -> Message.of(new byte[0]));
  }

  @Test
  void acceptsMaximumLength() {
    Message message = Message.of(new byte[Message.MAX_LENGTH]);

    assertEquals(Message.MAX_LENGTH, message.length());
  }

  @Test
  void rejectsOversizedMessage() {
    assertThrows(IllegalArgumentException.class, () -> Message.of(new byte[Message.MAX_LENGTH + 1]));
  }

  @Test
  void rejectsKindOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> Message.of(256, new byte[0]));
    assertThrows(IllegalArgumentException.class, () -> Message.of(-1, new byte[0]));
  }

  @Test
  void equalityIsByContent() {
    assertEquals(Message.of(1, new byte[] {5}), Message.of(new byte[] {1, 5}));
    assertEquals(Message.of(1, new byte[] {5}).hash(), Message.of(new byte[] {1, 5}).hash());
    assertNotEquals(Message.of(1, new byte[] {5}), Message.of(1, new byte[] {6}));
  }
}
