package io.github.themoah.kfetch.consumer;

import io.github.themoah.kfetch.broker.Broker;
import io.github.themoah.kfetch.broker.BrokerConnection;
import io.github.themoah.kfetch.broker.EndOfStreamException;
import io.github.themoah.kfetch.metrics.ConsumerMetrics;
import io.github.themoah.kfetch.protocol.Message;
import io.github.themoah.kfetch.protocol.MessageDecodeException;
import io.github.themoah.kfetch.protocol.WireCodec;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes one topic partition from one broker, tracking the next offset to fetch.
 *
 * <p>Each instance owns its cursor. A running loop owns its connection exclusively;
 * run at most one loop per instance at a time.
 */
public class BrokerConsumer {

  private static final Logger log = LoggerFactory.getLogger(BrokerConsumer.class);

  /** Responses this short carry no messages. */
  private static final int EMPTY_RESPONSE_LENGTH = 2;

  private final Vertx vertx;
  private final Broker broker;
  private final ConsumerCursor cursor;
  private final OffsetQuery offsetQuery;
  private final ConsumerMetrics metrics;

  /**
   * Creates a new BrokerConsumer.
   *
   * @param vertx the Vert.x instance
   * @param broker the broker serving the partition
   * @param offset offset to start consuming from
   * @param maxFetchSize maximum response size in bytes; at least the size of the largest message
   */
  public BrokerConsumer(Vertx vertx, Broker broker, long offset, int maxFetchSize) {
    this(vertx, broker, offset, maxFetchSize, ConsumerMetrics.NOOP);
  }

  public BrokerConsumer(Vertx vertx, Broker broker, long offset, int maxFetchSize, ConsumerMetrics metrics) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.broker = Objects.requireNonNull(broker, "broker cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.cursor = new ConsumerCursor(offset, maxFetchSize);
    this.offsetQuery = new OffsetQuery(broker);
  }

  /**
   * Creates a consumer with offset and fetch size zero, meant for offset queries.
   */
  public static BrokerConsumer forOffsets(Vertx vertx, Broker broker) {
    return new BrokerConsumer(vertx, broker, 0L, 0);
  }

  public long offset() {
    return cursor.offset();
  }

  public int maxFetchSize() {
    return cursor.maxFetchSize();
  }

  /**
   * Moves the cursor to {@code offset}. Do not call while a loop is running.
   */
  public void reset(long offset) {
    log.info("Resetting cursor for {}-{} from {} to {}",
      broker.topic(), broker.partition(), cursor.offset(), offset);
    cursor.reset(offset);
    metrics.recordCursor(offset);
  }

  /**
   * Opens a connection, performs a single poll and closes the connection.
   *
   * @param handler invoked once per message, in offset order
   * @return Future containing the number of messages handled
   */
  public Future<Integer> consume(MessageHandler handler) {
    Objects.requireNonNull(handler, "handler cannot be null");
    return broker.connect()
      .compose(connection -> connection.closeAfter(consumeWithConnection(connection, handler)))
      .onFailure(err -> log.error("Consume from {}-{} failed at offset {}",
        broker.topic(), broker.partition(), cursor.offset(), err));
  }

  /**
   * Polls continuously on one connection until {@code quitSignal} completes.
   * End-of-stream is ignored; other errors are logged and polling continues.
   * The returned future completes once polling has stopped and the connection is closed.
   *
   * @param pollIntervalMs delay between polls
   * @param quitSignal completes (either way) when consumption should stop
   * @param handler invoked once per message, in offset order
   * @return Future containing the loop summary, or failed if the connection could not be opened
   */
  public Future<ConsumeSummary> consumeUntilQuit(long pollIntervalMs, Future<?> quitSignal, MessageHandler handler) {
    Objects.requireNonNull(quitSignal, "quitSignal cannot be null");
    Objects.requireNonNull(handler, "handler cannot be null");

    return broker.connect().compose(connection -> {
      log.info("Consuming {} from offset {} every {}ms until quit",
        connection, cursor.offset(), pollIntervalMs);
      PollLoop loop = new PollLoop(connection, handler, pollIntervalMs, false);
      quitSignal.onComplete(ar -> loop.requestQuit());
      loop.start();
      return loop.finished();
    });
  }

  /**
   * Polls continuously on one connection, delivering messages to {@code channel}.
   * Polling stops at the first error other than end-of-stream. When {@code quitSignal}
   * completes the connection is closed, the loop is awaited and the channel is closed.
   *
   * @param channel receives every decoded message
   * @param pollIntervalMs delay between polls
   * @param quitSignal completes (either way) when consumption should stop
   * @return Future containing the loop summary, completed only after quit
   */
  public Future<ConsumeSummary> consumeOnChannel(MessageChannel channel, long pollIntervalMs, Future<?> quitSignal) {
    Objects.requireNonNull(channel, "channel cannot be null");
    Objects.requireNonNull(quitSignal, "quitSignal cannot be null");

    return broker.connect().compose(connection -> {
      log.info("Consuming {} onto channel from offset {} every {}ms",
        connection, cursor.offset(), pollIntervalMs);
      MessageHandler delivery = message -> {
        if (!channel.offer(message)) {
          log.warn("Channel closed, dropping message at offset {}", message.offset());
        }
      };
      PollLoop loop = new PollLoop(connection, delivery, pollIntervalMs, true);
      loop.start();

      return quitSignal.transform(ar -> {
          loop.requestQuit();
          connection.close();
          return loop.finished();
        })
        .onComplete(ar -> channel.close());
    });
  }

  /**
   * Gets up to {@code maxNumOffsets} valid offsets before {@code time}, in descending order.
   *
   * @see OffsetQuery#getOffsets(long, int)
   */
  public Future<List<Long>> getOffsets(long time, int maxNumOffsets) {
    return offsetQuery.getOffsets(time, maxNumOffsets);
  }

  /**
   * Performs one poll on an open connection: fetch from the cursor, hand every complete
   * message to the handler, then advance the cursor past the consumed bytes.
   * On failure the cursor is left where the poll started.
   */
  Future<Integer> consumeWithConnection(BrokerConnection connection, MessageHandler handler) {
    long baseOffset = cursor.offset();
    Buffer request = WireCodec.encodeConsumeRequest(
      broker.topic(), broker.partition(), baseOffset, cursor.maxFetchSize());

    return connection.exchange(request).compose(frame -> {
      int length = frame.length();
      if (length <= EMPTY_RESPONSE_LENGTH) {
        log.debug("No new messages on {} at offset {}", connection, baseOffset);
        metrics.recordPoll(0);
        return Future.succeededFuture(0);
      }

      Buffer body = frame.body();
      int count = 0;
      int position = 0;
      // length counts the 2-byte error code, so this leaves at least 2 body bytes to read
      while (position <= length - 4) {
        Message message = WireCodec.decode(body, position, baseOffset + position);
        if (message == null) {
          return Future.failedFuture(new MessageDecodeException(baseOffset + position, count));
        }
        position += message.frameLength();
        handler.handle(message);
        metrics.recordMessage(message);
        count++;
      }

      long newOffset = cursor.advance(position);
      metrics.recordPoll(count);
      metrics.recordCursor(newOffset);
      log.debug("Consumed {} messages from {}, cursor now {}", count, connection, newOffset);
      return Future.succeededFuture(count);
    });
  }

  /**
   * Fixed-delay polling on one connection. Quit is observed between polls; an in-flight
   * exchange always completes first. Callbacks run on the connection's event loop.
   */
  private final class PollLoop {

    private static final long NO_TIMER = -1L;

    private final BrokerConnection connection;
    private final MessageHandler handler;
    private final long pollIntervalMs;
    private final boolean stopOnError;

    private final AtomicBoolean quitRequested = new AtomicBoolean();
    private final AtomicLong sleepTimer = new AtomicLong(NO_TIMER);
    private final AtomicBoolean finishing = new AtomicBoolean();
    private final Promise<ConsumeSummary> finished = Promise.promise();

    private final AtomicLong messageCount = new AtomicLong();
    private final AtomicLong failedPolls = new AtomicLong();
    private volatile Throwable lastError;

    PollLoop(BrokerConnection connection, MessageHandler handler, long pollIntervalMs, boolean stopOnError) {
      this.connection = connection;
      this.handler = handler;
      this.pollIntervalMs = pollIntervalMs;
      this.stopOnError = stopOnError;
    }

    Future<ConsumeSummary> finished() {
      return finished.future();
    }

    void start() {
      poll();
    }

    void requestQuit() {
      if (!quitRequested.compareAndSet(false, true)) {
        return;
      }
      log.info("Quit requested for {}", connection);
      // whoever takes the timer id first gets to move the loop on
      long timerId = sleepTimer.getAndSet(NO_TIMER);
      if (timerId != NO_TIMER) {
        vertx.cancelTimer(timerId);
        finish();
      }
    }

    private void poll() {
      if (quitRequested.get()) {
        finish();
        return;
      }
      consumeWithConnection(connection, handler).onComplete(this::afterPoll);
    }

    private void afterPoll(AsyncResult<Integer> ar) {
      if (ar.succeeded()) {
        messageCount.addAndGet(ar.result());
      } else if (!handleFailure(ar.cause())) {
        finish();
        return;
      }

      if (quitRequested.get()) {
        finish();
        return;
      }
      sleep();
    }

    /**
     * @return true if polling should continue
     */
    private boolean handleFailure(Throwable err) {
      if (err instanceof MessageDecodeException decodeError) {
        messageCount.addAndGet(decodeError.messagesHandled());
      }
      if (err instanceof EndOfStreamException) {
        log.debug("End of stream on {}", connection);
        return true;
      }

      failedPolls.incrementAndGet();
      lastError = err;
      metrics.recordPollFailure(err);

      if (quitRequested.get()) {
        log.debug("Poll on {} interrupted by quit: {}", connection, err.getMessage());
        return true;
      }
      if (stopOnError) {
        log.error("Fatal error consuming {} at offset {}, stopping", connection, cursor.offset(), err);
        return false;
      }
      log.error("Error consuming {} at offset {}", connection, cursor.offset(), err);
      return true;
    }

    private void sleep() {
      long timerId = vertx.setTimer(Math.max(1L, pollIntervalMs), id -> {
        if (sleepTimer.compareAndSet(id, NO_TIMER)) {
          poll();
        }
      });
      sleepTimer.set(timerId);
    }

    private void finish() {
      if (!finishing.compareAndSet(false, true)) {
        return;
      }
      ConsumeSummary summary = new ConsumeSummary(messageCount.get(), failedPolls.get(), lastError);
      connection.close()
        .onComplete(v -> {
          log.info("Stopped consuming {}: {} messages, {} failed polls, cursor at {}",
            connection, summary.messageCount(), summary.failedPolls(), cursor.offset());
          finished.complete(summary);
        });
    }
  }
}
