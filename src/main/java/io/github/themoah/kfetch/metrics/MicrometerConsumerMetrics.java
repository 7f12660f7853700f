package io.github.themoah.kfetch.metrics;

import io.github.themoah.kfetch.broker.EndOfStreamException;
import io.github.themoah.kfetch.protocol.Message;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports consumer activity using a Micrometer MeterRegistry.
 * All meters are tagged with the topic and partition being consumed.
 */
public class MicrometerConsumerMetrics implements ConsumerMetrics {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConsumerMetrics.class);

  private final MeterRegistry registry;
  private final Tags tags;
  private final Counter messages;
  private final Counter bytes;
  private final Counter emptyPolls;
  private final Counter successfulPolls;
  private final AtomicLong cursorOffset = new AtomicLong();
  private final AtomicLong latestOffset = new AtomicLong();

  public MicrometerConsumerMetrics(MeterRegistry registry, String topic, int partition) {
    this.registry = registry;
    this.tags = Tags.of("topic", topic, "partition", String.valueOf(partition));

    this.messages = Counter.builder("kfetch.consumer.messages")
      .description("Messages delivered to the handler")
      .tags(tags)
      .register(registry);
    this.bytes = Counter.builder("kfetch.consumer.bytes")
      .description("Message frame bytes consumed")
      .baseUnit("bytes")
      .tags(tags)
      .register(registry);
    this.successfulPolls = pollCounter("success");
    this.emptyPolls = pollCounter("empty");

    Gauge.builder("kfetch.consumer.offset", cursorOffset, AtomicLong::get)
      .description("Next offset the consumer will fetch")
      .tags(tags)
      .register(registry);
    Gauge.builder("kfetch.partition.latest_offset", latestOffset, AtomicLong::get)
      .description("Latest offset reported by the broker")
      .tags(tags)
      .register(registry);
    Gauge.builder("kfetch.consumer.lag_bytes", this, MicrometerConsumerMetrics::lagBytes)
      .description("Bytes between the cursor and the latest broker offset")
      .tags(tags)
      .register(registry);
  }

  @Override
  public void recordMessage(Message message) {
    messages.increment();
    bytes.increment(message.frameLength());
  }

  @Override
  public void recordPoll(int messageCount) {
    if (messageCount == 0) {
      emptyPolls.increment();
    } else {
      successfulPolls.increment();
    }
  }

  @Override
  public void recordPollFailure(Throwable error) {
    String outcome = error instanceof EndOfStreamException ? "end_of_stream" : "error";
    Counter.builder("kfetch.consumer.polls")
      .tags(tags)
      .tag("outcome", outcome)
      .tag("exception", error.getClass().getSimpleName())
      .register(registry)
      .increment();
  }

  @Override
  public void recordCursor(long offset) {
    cursorOffset.set(offset);
  }

  @Override
  public void recordLatestOffset(long offset) {
    latestOffset.set(offset);
  }

  double lagBytes() {
    return Math.max(0, latestOffset.get() - cursorOffset.get());
  }

  @Override
  public Future<Void> close() {
    log.info("Closing consumer metrics registry");
    registry.close();
    return Future.succeededFuture();
  }

  private Counter pollCounter(String outcome) {
    return Counter.builder("kfetch.consumer.polls")
      .description("Polls by outcome")
      .tags(tags)
      .tag("outcome", outcome)
      .tag("exception", "none")
      .register(registry);
  }
}
