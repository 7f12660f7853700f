package io.github.themoah.kfetch.protocol;

import io.vertx.core.buffer.Buffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Encoder and decoder for the broker's binary wire format. All fields are big-endian.
 *
 * <p>Request layout:
 * <pre>
 * [4B size][2B request type][2B topic length][topic][4B partition][request fields]
 * </pre>
 * The size field counts every byte after itself.
 *
 * <p>Message layout inside a consume response:
 * <pre>
 * [4B length][4B checksum][payload]
 * </pre>
 * where length covers the checksum and the payload.
 */
public final class WireCodec {

  public static final int LENGTH_FIELD_SIZE = 4;
  public static final int CHECKSUM_SIZE = 4;
  public static final int OFFSET_SIZE = 8;
  public static final int COUNT_FIELD_SIZE = 4;

  /** Time marker asking for the latest available offset. */
  public static final long LATEST_TIME = -1L;

  /** Time marker asking for the earliest available offset. */
  public static final long EARLIEST_TIME = -2L;

  private WireCodec() {}

  /**
   * Encodes a fetch request for messages starting at {@code offset}.
   *
   * @param topic topic to fetch from
   * @param partition partition to fetch from
   * @param offset absolute offset of the first message wanted
   * @param maxFetchSize upper bound on the response payload in bytes
   * @return the encoded request frame
   */
  public static Buffer encodeConsumeRequest(String topic, int partition, long offset, int maxFetchSize) {
    Buffer request = encodeRequestHeader(RequestType.FETCH, topic, partition)
      .appendLong(offset)
      .appendInt(maxFetchSize);
    return writeRequestSize(request);
  }

  /**
   * Encodes a request for valid offsets before the given time.
   *
   * @param topic topic to query
   * @param partition partition to query
   * @param time millisecond timestamp, {@link #LATEST_TIME} or {@link #EARLIEST_TIME}
   * @param maxNumOffsets maximum number of offsets the broker should return
   * @return the encoded request frame
   */
  public static Buffer encodeOffsetRequest(String topic, int partition, long time, int maxNumOffsets) {
    Buffer request = encodeRequestHeader(RequestType.OFFSETS, topic, partition)
      .appendLong(time)
      .appendInt(maxNumOffsets);
    return writeRequestSize(request);
  }

  private static Buffer encodeRequestHeader(RequestType type, String topic, int partition) {
    Objects.requireNonNull(topic, "topic cannot be null");
    byte[] topicBytes = topic.getBytes(StandardCharsets.UTF_8);
    return Buffer.buffer()
      .appendInt(0) // size, filled in once the request is complete
      .appendShort((short) type.id())
      .appendShort((short) topicBytes.length)
      .appendBytes(topicBytes)
      .appendInt(partition);
  }

  private static Buffer writeRequestSize(Buffer request) {
    return request.setInt(0, request.length() - LENGTH_FIELD_SIZE);
  }

  /**
   * Frames a payload the way the broker stores it: length, CRC32 checksum, payload.
   */
  public static Buffer encodeMessage(byte[] payload) {
    Objects.requireNonNull(payload, "payload cannot be null");
    CRC32 crc = new CRC32();
    crc.update(payload);
    return Buffer.buffer(LENGTH_FIELD_SIZE + CHECKSUM_SIZE + payload.length)
      .appendInt(CHECKSUM_SIZE + payload.length)
      .appendInt((int) crc.getValue())
      .appendBytes(payload);
  }

  /**
   * Decodes the message at the start of the buffer, with offset zero.
   *
   * @see #decode(Buffer, int, long)
   */
  public static Message decode(Buffer buffer) {
    return decode(buffer, 0, 0L);
  }

  /**
   * Decodes one message frame starting at {@code position}.
   *
   * @param buffer buffer holding one or more message frames
   * @param position index of the frame's length field
   * @param offset absolute log offset to assign to the message
   * @return the message, or null if the frame is truncated or its length is invalid
   */
  public static Message decode(Buffer buffer, int position, long offset) {
    int remaining = buffer.length() - position;
    if (position < 0 || remaining < LENGTH_FIELD_SIZE) {
      return null;
    }

    int length = buffer.getInt(position);
    if (length < CHECKSUM_SIZE || length > remaining - LENGTH_FIELD_SIZE) {
      return null;
    }

    int checksumStart = position + LENGTH_FIELD_SIZE;
    int payloadStart = checksumStart + CHECKSUM_SIZE;
    int checksum = buffer.getInt(checksumStart);
    byte[] payload = buffer.getBytes(payloadStart, checksumStart + length);
    return new Message(offset, length, checksum, payload);
  }

  /**
   * Decodes the body of an offsets response: a count followed by 8-byte offsets.
   *
   * @param body response body, error code already stripped
   * @param frameLength declared length of the response frame
   * @param maxNumOffsets upper bound on the number of offsets returned
   * @return offsets in the order the broker sent them (descending)
   */
  public static List<Long> decodeOffsets(Buffer body, int frameLength, int maxNumOffsets) {
    if (frameLength <= COUNT_FIELD_SIZE || body.length() < COUNT_FIELD_SIZE) {
      return List.of();
    }

    long count = Integer.toUnsignedLong(body.getInt(0));
    long limit = Math.min(count, Integer.toUnsignedLong(maxNumOffsets));
    List<Long> offsets = new ArrayList<>();
    int position = COUNT_FIELD_SIZE;
    while (position + OFFSET_SIZE <= body.length() && offsets.size() < limit) {
      offsets.add(body.getLong(position));
      position += OFFSET_SIZE;
    }
    return List.copyOf(offsets);
  }
}
