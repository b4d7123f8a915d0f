package io.ledgerbridge.codec;

import io.ledgerbridge.Message;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Packs ordered messages into a single batch frame and back.
 *
 * <p>A batch is the concatenation of {@code (uint16 big-endian length, length bytes)} for
 * each message, in send order. There is no header and no trailer; the frame ends exactly
 * where the last message ends.
 */
public final class BatchCodec {

  private BatchCodec() {}

  /**
   * Packs messages into a batch frame.
   *
   * @param messages the messages, in delivery order
   * @return the batch bytes
   * @throws IllegalArgumentException if {@code messages} is empty
   */
  public static byte[] pack(List<Message> messages) {
    Objects.requireNonNull(messages, "messages");
    if (messages.isEmpty()) {
      throw new IllegalArgumentException("Cannot pack an empty batch");
    }
    int total = 0;
    for (Message message : messages) {
      Objects.requireNonNull(message, "message");
      total = Math.addExact(total, 2 + message.length());
    }
    ByteBuffer buffer = ByteBuffer.allocate(total);
    for (Message message : messages) {
      buffer.putShort((short) message.length());
      buffer.put(message.toBytes());
    }
    return buffer.array();
  }

  /**
   * Unpacks a batch frame.
   *
   * @param frame the batch bytes
   * @return the messages in packed order
   * @throws FrameFormatException if the frame is empty, is a proof frame, or has a zero,
   *     oversized or truncated entry
   */
  public static List<Message> unpack(byte[] frame) {
    Objects.requireNonNull(frame, "frame");
    if (frame.length == 0) {
      throw new FrameFormatException("Empty frame");
    }
    if (ProofFrame.isProof(frame)) {
      throw new FrameFormatException("Proof frame is not a batch");
    }
    List<Message> messages = new ArrayList<>();
    int offset = 0;
    while (offset < frame.length) {
      if (frame.length - offset < 2) {
        throw new FrameFormatException("Truncated length prefix at offset " + offset);
      }
      int length = ((frame[offset] & 0xFF) << 8) | (frame[offset + 1] & 0xFF);
      if (length == 0 || length > Message.MAX_LENGTH) {
        throw new FrameFormatException("Invalid message length " + length + " at offset " + offset);
      }
      int start = offset + 2;
      if (frame.length - start < length) {
        throw new FrameFormatException("Truncated message at offset " + offset
            + ": declared " + length + " bytes, " + (frame.length - start) + " available");
      }
      messages.add(Message.of(Arrays.copyOfRange(frame, start, start + length)));
      offset = start + length;
    }
    return List.copyOf(messages);
  }
}
