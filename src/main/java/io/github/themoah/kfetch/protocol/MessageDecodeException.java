package io.github.themoah.kfetch.protocol;

/**
 * Raised when a consume payload holds a truncated or malformed message frame.
 * Messages decoded before the bad frame have already reached the handler.
 */
public class MessageDecodeException extends RuntimeException {

  private final long offset;
  private final int messagesHandled;

  public MessageDecodeException(long offset, int messagesHandled) {
    super("Error decoding message at offset " + offset + " after " + messagesHandled + " messages");
    this.offset = offset;
    this.messagesHandled = messagesHandled;
  }

  /**
   * Absolute offset of the frame that failed to decode.
   */
  public long offset() {
    return offset;
  }

  /**
   * Number of messages handed to the handler in the failed pass.
   */
  public int messagesHandled() {
    return messagesHandled;
  }
}
