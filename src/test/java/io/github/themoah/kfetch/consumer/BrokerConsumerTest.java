package io.github.themoah.kfetch.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kfetch.broker.Broker;
import io.github.themoah.kfetch.broker.BrokerConnectionException;
import io.github.themoah.kfetch.broker.BrokerErrorException;
import io.github.themoah.kfetch.broker.EndOfStreamException;
import io.github.themoah.kfetch.broker.MockBroker;
import io.github.themoah.kfetch.metrics.ConsumerMetrics;
import io.github.themoah.kfetch.metrics.MicrometerConsumerMetrics;
import io.github.themoah.kfetch.protocol.Message;
import io.github.themoah.kfetch.protocol.MessageDecodeException;
import io.github.themoah.kfetch.protocol.RequestType;
import io.github.themoah.kfetch.protocol.WireCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for BrokerConsumer against a scripted broker.
 */
@ExtendWith(VertxExtension.class)
public class BrokerConsumerTest {

  private static final int MAX_FETCH_SIZE = 4096;

  /** Frame size of a one-character payload: length + checksum + 1 byte. */
  private static final int SMALL_FRAME = 9;

  private static Future<BrokerConsumer> startConsumer(Vertx vertx, MockBroker mock, long offset) {
    return startConsumer(vertx, mock, offset, ConsumerMetrics.NOOP);
  }

  private static Future<BrokerConsumer> startConsumer(Vertx vertx, MockBroker mock, long offset,
                                                      ConsumerMetrics metrics) {
    return mock.start()
      .map(m -> new BrokerConsumer(vertx, new Broker(vertx, m.config()), offset, MAX_FETCH_SIZE, metrics));
  }

  private static Buffer truncatedFrame() {
    return Buffer.buffer().appendInt(50).appendBytes(new byte[6]);
  }

  private static String text(Message message) {
    return new String(message.payload(), StandardCharsets.UTF_8);
  }

  private static void await(VertxTestContext ctx) throws Throwable {
    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
    if (ctx.failed()) {
      throw ctx.causeOfFailure();
    }
  }

  @Test
  void consume_deliversMessagesAndAdvancesCursor(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx)
      .respond(MockBroker.response(MockBroker.messages("0123456789", "abcdefghij")))
      .closeWhenExhausted();
    List<Message> received = new CopyOnWriteArrayList<>();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consume(received::add).map(count -> {
        ctx.verify(() -> {
          assertEquals(2, count);
          assertEquals(36L, consumer.offset());
        });
        return count;
      }))
      .compose(count -> mock.firstClose())
      .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
        assertEquals(2, received.size());
        assertEquals(0L, received.get(0).offset());
        assertEquals("0123456789", text(received.get(0)));
        assertEquals(18L, received.get(1).offset());
        assertEquals("abcdefghij", text(received.get(1)));
        assertTrue(received.get(1).isValid());

        assertEquals(1, mock.requests().size());
        MockBroker.Request request = mock.requests().get(0);
        assertEquals(RequestType.FETCH.id(), request.type());
        assertEquals(MockBroker.TOPIC, request.topic());
        assertEquals(MockBroker.PARTITION, request.partition());
        assertEquals(0L, request.offsetOrTime());
        assertEquals(MAX_FETCH_SIZE, request.maxSize());
        assertEquals(1, mock.connections());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consume_fromNonZeroOffset(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.response(MockBroker.messages("a", "b")));
    List<Message> received = new CopyOnWriteArrayList<>();

    startConsumer(vertx, mock, 100L)
      .compose(consumer -> consumer.consume(received::add).map(count -> consumer))
      .onComplete(ctx.succeeding(consumer -> ctx.verify(() -> {
        assertEquals(100L, mock.requests().get(0).offsetOrTime());
        assertEquals(100L, received.get(0).offset());
        assertEquals(100L + SMALL_FRAME, received.get(1).offset());
        assertEquals(100L + 2 * SMALL_FRAME, consumer.offset());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consume_emptyResponseDeliversNothing(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.response(Buffer.buffer()));
    List<Message> received = new CopyOnWriteArrayList<>();

    startConsumer(vertx, mock, 42L)
      .compose(consumer -> consumer.consume(received::add).map(count -> {
        ctx.verify(() -> {
          assertEquals(0, count);
          assertEquals(42L, consumer.offset());
        });
        return count;
      }))
      .onComplete(ctx.succeeding(count -> ctx.verify(() -> {
        assertTrue(received.isEmpty());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consume_truncatedFrameFailsAndKeepsCursor(Vertx vertx, VertxTestContext ctx) throws Throwable {
    Buffer body = MockBroker.messages("a").appendBuffer(truncatedFrame());
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.response(body));
    List<Message> received = new CopyOnWriteArrayList<>();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consume(received::add)
        .transform(ar -> Future.succeededFuture(new Object[] {consumer, ar.cause()})))
      .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
        BrokerConsumer consumer = (BrokerConsumer) result[0];
        MessageDecodeException error = assertInstanceOf(MessageDecodeException.class, result[1]);
        assertEquals(SMALL_FRAME, error.offset());
        assertEquals(1, error.messagesHandled());
        assertEquals(1, received.size());
        assertEquals(0L, consumer.offset());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consume_throwingHandlerFailsAndKeepsCursor(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.response(MockBroker.messages("a", "b")));

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consume(message -> {
          if (message.offset() > 0) {
            throw new IllegalStateException("handler rejected " + message.offset());
          }
        })
        .transform(ar -> {
          ctx.verify(() -> {
            assertInstanceOf(IllegalStateException.class, ar.cause());
            assertEquals(0L, consumer.offset());
          });
          return Future.succeededFuture();
        }))
      .onComplete(ctx.succeedingThenComplete());

    await(ctx);
  }

  @Test
  void consume_brokerErrorFails(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.errorResponse(1));

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consume(m -> ctx.failNow(new AssertionError("unexpected message"))))
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        assertEquals(1, assertInstanceOf(BrokerErrorException.class, err).errorCode());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consume_endOfStreamFails(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).closeWhenExhausted();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consume(m -> ctx.failNow(new AssertionError("unexpected message"))))
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        assertInstanceOf(EndOfStreamException.class, err);
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consume_recordsMetrics(Vertx vertx, VertxTestContext ctx) throws Throwable {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    ConsumerMetrics metrics = new MicrometerConsumerMetrics(registry, MockBroker.TOPIC, MockBroker.PARTITION);
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.response(MockBroker.messages("a", "b", "c")));

    startConsumer(vertx, mock, 0L, metrics)
      .compose(consumer -> consumer.consume(m -> { }))
      .onComplete(ctx.succeeding(count -> ctx.verify(() -> {
        assertEquals(3.0, registry.get("kfetch.consumer.messages").counter().count());
        assertEquals(3.0 * SMALL_FRAME, registry.get("kfetch.consumer.bytes").counter().count());
        assertEquals(1.0, registry.get("kfetch.consumer.polls").tag("outcome", "success").counter().count());
        assertEquals(3.0 * SMALL_FRAME, registry.get("kfetch.consumer.offset").gauge().value());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void reset_movesNextFetch(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx);

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> {
        consumer.reset(5000L);
        return consumer.consume(m -> { });
      })
      .onComplete(ctx.succeeding(count -> ctx.verify(() -> {
        assertEquals(5000L, mock.requests().get(0).offsetOrTime());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeUntilQuit_pollsUntilQuit(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(
      MockBroker.response(MockBroker.messages("a", "b")),
      MockBroker.response(Buffer.buffer()),
      MockBroker.response(MockBroker.messages("c")));
    Promise<Void> quit = Promise.promise();
    List<Message> received = new CopyOnWriteArrayList<>();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consumeUntilQuit(10L, quit.future(), message -> {
          received.add(message);
          if (received.size() == 3) {
            quit.tryComplete();
          }
        })
        .map(summary -> {
          ctx.verify(() -> {
            assertEquals(3L, summary.messageCount());
            assertEquals(0L, summary.failedPolls());
            assertFalse(summary.hasError());
            assertEquals(3L * SMALL_FRAME, consumer.offset());
          });
          return summary;
        }))
      .compose(summary -> mock.firstClose())
      .onComplete(ctx.succeeding(v -> {
        int deliveredAtFinish = received.size();
        vertx.setTimer(100, id -> ctx.verify(() -> {
          assertEquals(3, deliveredAtFinish);
          assertEquals(3, received.size());
          assertEquals(1, mock.connections());
          assertEquals(1, mock.closedConnections());

          List<MockBroker.Request> requests = mock.requests();
          assertEquals(3, requests.size());
          assertEquals(0L, requests.get(0).offsetOrTime());
          assertEquals(2L * SMALL_FRAME, requests.get(1).offsetOrTime());
          assertEquals(2L * SMALL_FRAME, requests.get(2).offsetOrTime());
          ctx.completeNow();
        }));
      }));

    await(ctx);
  }

  @Test
  void consumeUntilQuit_keepsPollingAfterErrors(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(
      MockBroker.errorResponse(5),
      MockBroker.response(MockBroker.messages("a")));
    Promise<Void> quit = Promise.promise();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consumeUntilQuit(10L, quit.future(), message -> quit.tryComplete()))
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(1L, summary.messageCount());
        assertEquals(1L, summary.failedPolls());
        assertEquals(5, assertInstanceOf(BrokerErrorException.class, summary.lastError()).errorCode());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeUntilQuit_quitWhileSleepingStopsPromptly(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx);
    Promise<Void> quit = Promise.promise();
    long started = System.currentTimeMillis();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> {
        vertx.setTimer(200, id -> quit.complete());
        return consumer.consumeUntilQuit(60_000L, quit.future(), message -> { });
      })
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertTrue(System.currentTimeMillis() - started < 5_000L);
        assertEquals(0L, summary.messageCount());
        assertTrue(mock.requests().size() <= 1);
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeUntilQuit_quitAlreadySignalled(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx);

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.consumeUntilQuit(10L, Future.succeededFuture(), message -> { }))
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(0L, summary.messageCount());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeUntilQuit_failsWhenBrokerUnreachable(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx);

    mock.start()
      .compose(m -> {
        Broker broker = new Broker(vertx, m.config());
        return m.stop().map(v -> new BrokerConsumer(vertx, broker, 0L, MAX_FETCH_SIZE));
      })
      .compose(consumer -> consumer.consumeUntilQuit(10L, Promise.promise().future(), message -> { }))
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        assertInstanceOf(BrokerConnectionException.class, err);
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeUntilQuit_endOfStreamIsSilent(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx)
      .respond(MockBroker.response(MockBroker.messages("a")))
      .closeWhenExhausted();
    Promise<Void> quit = Promise.promise();
    List<Message> received = new CopyOnWriteArrayList<>();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> {
        vertx.setTimer(300, id -> quit.complete());
        return consumer.consumeUntilQuit(10L, quit.future(), received::add).map(summary -> {
          ctx.verify(() -> assertEquals((long) SMALL_FRAME, consumer.offset()));
          return summary;
        });
      })
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(1L, summary.messageCount());
        assertEquals(0L, summary.failedPolls());
        assertNull(summary.lastError());
        assertFalse(summary.hasError());
        assertEquals(1, received.size());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeOnChannel_endOfStreamKeepsPolling(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx)
      .respond(MockBroker.response(MockBroker.messages("a")))
      .closeWhenExhausted();
    MessageChannel channel = new MessageChannel();
    Promise<Void> quit = Promise.promise();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> {
        vertx.setTimer(300, id -> {
          ctx.verify(() -> assertFalse(channel.isClosed()));
          quit.complete();
        });
        return consumer.consumeOnChannel(channel, 10L, quit.future());
      })
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(1L, summary.messageCount());
        assertEquals(0L, summary.failedPolls());
        assertNull(summary.lastError());
        assertTrue(channel.isClosed());
        assertEquals(1, channel.drain().size());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeOnChannel_stopsOnDecodeError(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(
      MockBroker.response(MockBroker.messages("a", "b")),
      MockBroker.response(truncatedFrame()));
    MessageChannel channel = new MessageChannel();
    Promise<Void> quit = Promise.promise();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> {
        vertx.setTimer(300, id -> {
          ctx.verify(() -> assertFalse(channel.isClosed()));
          quit.complete();
        });
        return consumer.consumeOnChannel(channel, 10L, quit.future()).map(summary -> {
          ctx.verify(() -> assertEquals(2L * SMALL_FRAME, consumer.offset()));
          return summary;
        });
      })
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(2L, summary.messageCount());
        assertInstanceOf(MessageDecodeException.class, summary.lastError());
        assertEquals(2, mock.requests().size());

        assertTrue(channel.isClosed());
        List<Message> delivered = channel.drain();
        assertEquals(2, delivered.size());
        assertEquals("a", text(delivered.get(0)));
        assertEquals("b", text(delivered.get(1)));
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void consumeOnChannel_quitClosesChannel(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx);
    MessageChannel channel = new MessageChannel();
    Promise<Void> quit = Promise.promise();

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> {
        vertx.setTimer(50, id -> quit.complete());
        return consumer.consumeOnChannel(channel, 10L, quit.future());
      })
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(0L, summary.messageCount());
        assertTrue(channel.isClosed());
        assertEquals(0, channel.size());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void getOffsets_returnsAtMostMax(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.response(MockBroker.offsets(300L, 200L, 100L)));

    startConsumer(vertx, mock, 0L)
      .compose(consumer -> consumer.getOffsets(WireCodec.LATEST_TIME, 2))
      .compose(offsets -> mock.firstClose().map(offsets))
      .onComplete(ctx.succeeding(offsets -> ctx.verify(() -> {
        assertEquals(List.of(300L, 200L), offsets);
        MockBroker.Request request = mock.requests().get(0);
        assertEquals(RequestType.OFFSETS.id(), request.type());
        assertEquals(WireCodec.LATEST_TIME, request.offsetOrTime());
        assertEquals(2, request.maxSize());
        ctx.completeNow();
      })));

    await(ctx);
  }

  @Test
  void getOffsets_shortResponseIsEmpty(Vertx vertx, VertxTestContext ctx) throws Throwable {
    MockBroker mock = new MockBroker(vertx).respond(MockBroker.response(Buffer.buffer(new byte[2])));

    mock.start()
      .compose(m -> BrokerConsumer.forOffsets(vertx, new Broker(vertx, m.config()))
        .getOffsets(WireCodec.EARLIEST_TIME, 10))
      .onComplete(ctx.succeeding(offsets -> ctx.verify(() -> {
        assertTrue(offsets.isEmpty());
        assertEquals(WireCodec.EARLIEST_TIME, mock.requests().get(0).offsetOrTime());
        ctx.completeNow();
      })));

    await(ctx);
  }
}
