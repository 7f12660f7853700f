package io.github.themoah.kfetch.metrics;

import io.github.themoah.kfetch.protocol.Message;
import io.vertx.core.Future;

/**
 * Receives consumer activity for reporting to external systems.
 * Every method defaults to a no-op.
 */
public interface ConsumerMetrics {

  ConsumerMetrics NOOP = new ConsumerMetrics() {};

  /**
   * Records one message delivered to a handler.
   */
  default void recordMessage(Message message) {
  }

  /**
   * Records a completed poll and the number of messages it delivered.
   */
  default void recordPoll(int messageCount) {
  }

  /**
   * Records a poll that ended with an error.
   */
  default void recordPollFailure(Throwable error) {
  }

  /**
   * Records the cursor position after a poll.
   */
  default void recordCursor(long offset) {
  }

  /**
   * Records the latest offset the broker reported.
   */
  default void recordLatestOffset(long offset) {
  }

  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
