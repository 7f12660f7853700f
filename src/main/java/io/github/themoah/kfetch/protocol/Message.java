package io.github.themoah.kfetch.protocol;

import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * A message decoded from a consume response.
 * The payload is copied out of the network buffer, so instances may be retained freely.
 */
public final class Message {

  private final long offset;
  private final int totalLength;
  private final int checksum;
  private final byte[] payload;

  Message(long offset, int totalLength, int checksum, byte[] payload) {
    this.offset = offset;
    this.totalLength = totalLength;
    this.checksum = checksum;
    this.payload = payload;
  }

  /**
   * Absolute position of this message in the partition log.
   */
  public long offset() {
    return offset;
  }

  /**
   * Stored length of the message: checksum plus payload, excluding the length field.
   */
  public int totalLength() {
    return totalLength;
  }

  /**
   * Bytes this message occupies on the wire, length field included.
   */
  public int frameLength() {
    return WireCodec.LENGTH_FIELD_SIZE + totalLength;
  }

  public int checksum() {
    return checksum;
  }

  public byte[] payload() {
    return payload.clone();
  }

  public int payloadLength() {
    return payload.length;
  }

  /**
   * Offset of the message that follows this one in the log.
   */
  public long nextOffset() {
    return offset + frameLength();
  }

  /**
   * Returns true if the stored checksum matches the CRC32 of the payload.
   */
  public boolean isValid() {
    CRC32 crc = new CRC32();
    crc.update(payload);
    return (int) crc.getValue() == checksum;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Message other)) {
      return false;
    }
    return offset == other.offset
      && totalLength == other.totalLength
      && checksum == other.checksum
      && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(offset);
    result = 31 * result + checksum;
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "Message{offset=" + offset + ", totalLength=" + totalLength
      + ", checksum=" + Integer.toHexString(checksum) + "}";
  }
}
