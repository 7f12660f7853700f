package io.github.themoah.kfetch.consumer;

import io.github.themoah.kfetch.protocol.Message;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded, closeable queue of messages between a consume loop and its readers.
 * After {@link #close()}, readers drain what is left and then receive null.
 */
public class MessageChannel {

  /** How often a blocked reader rechecks the closed flag. */
  private static final long CLOSE_CHECK_INTERVAL_MS = 50L;

  private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();
  private volatile boolean closed;

  /**
   * Appends a message.
   *
   * @return false if the channel is closed and the message was dropped
   */
  public boolean offer(Message message) {
    if (closed) {
      return false;
    }
    return queue.offer(message);
  }

  /**
   * Waits for the next message.
   *
   * @return the next message, or null once the channel is closed and empty
   */
  public Message take() throws InterruptedException {
    while (true) {
      Message message = queue.poll(CLOSE_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
      if (message != null) {
        return message;
      }
      if (closed) {
        return queue.poll();
      }
    }
  }

  /**
   * Waits up to the given time for the next message.
   *
   * @return the next message, or null on timeout or once the channel is closed and empty
   */
  public Message poll(long timeout, TimeUnit unit) throws InterruptedException {
    if (closed) {
      return queue.poll();
    }
    return queue.poll(timeout, unit);
  }

  /**
   * Removes and returns every message currently queued.
   */
  public List<Message> drain() {
    List<Message> drained = new ArrayList<>();
    queue.drainTo(drained);
    return drained;
  }

  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public int size() {
    return queue.size();
  }
}
