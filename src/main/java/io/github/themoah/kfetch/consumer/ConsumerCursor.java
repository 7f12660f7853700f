package io.github.themoah.kfetch.consumer;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Next offset to fetch, plus the fetch size bound.
 * The offset only moves forward, except through {@link #reset(long)}.
 */
public class ConsumerCursor {

  private final AtomicLong offset;
  private final int maxFetchSize;

  /**
   * @param offset first absolute offset to fetch
   * @param maxFetchSize upper bound on a response payload; must cover the largest message
   *                     in the log or the consumer stalls
   */
  public ConsumerCursor(long offset, int maxFetchSize) {
    this.offset = new AtomicLong(offset);
    this.maxFetchSize = maxFetchSize;
  }

  public long offset() {
    return offset.get();
  }

  public int maxFetchSize() {
    return maxFetchSize;
  }

  /**
   * Moves the cursor past {@code bytes} consumed bytes.
   *
   * @return the new offset
   */
  long advance(long bytes) {
    if (bytes < 0) {
      throw new IllegalArgumentException("Cursor cannot move backwards: " + bytes);
    }
    return offset.addAndGet(bytes);
  }

  /**
   * Sets the offset explicitly, for example to a value returned by an offset query.
   */
  void reset(long newOffset) {
    offset.set(newOffset);
  }

  @Override
  public String toString() {
    return "ConsumerCursor{offset=" + offset.get() + ", maxFetchSize=" + maxFetchSize + "}";
  }
}
