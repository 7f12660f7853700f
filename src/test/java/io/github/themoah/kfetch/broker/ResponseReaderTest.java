package io.github.themoah.kfetch.broker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.buffer.Buffer;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ResponseReader.
 */
public class ResponseReaderTest {

  private List<ResponseFrame> frames;
  private List<Throwable> errors;
  private ResponseReader reader;

  @BeforeEach
  void setUp() {
    frames = new ArrayList<>();
    errors = new ArrayList<>();
    reader = new ResponseReader(frames::add, errors::add);
  }

  @Test
  void singleFrameInOneChunk() {
    reader.handle(MockBroker.response(Buffer.buffer("abc")));

    assertEquals(1, frames.size());
    ResponseFrame frame = frames.get(0);
    assertEquals(5, frame.length());
    assertEquals(0, frame.errorCode());
    assertEquals("abc", frame.body().toString());
  }

  @Test
  void frameSplitAcrossChunks() {
    Buffer wire = MockBroker.response(Buffer.buffer("split body"));
    for (int i = 0; i < wire.length(); i++) {
      reader.handle(wire.getBuffer(i, i + 1));
    }

    assertEquals(1, frames.size());
    assertEquals("split body", frames.get(0).body().toString());
  }

  @Test
  void twoFramesInOneChunk() {
    Buffer wire = Buffer.buffer()
      .appendBuffer(MockBroker.response(Buffer.buffer("one")))
      .appendBuffer(MockBroker.response(Buffer.buffer("two")));

    reader.handle(wire);

    assertEquals(2, frames.size());
    assertEquals("one", frames.get(0).body().toString());
    assertEquals("two", frames.get(1).body().toString());
  }

  @Test
  void emptyResponseHasEmptyBody() {
    reader.handle(MockBroker.response(Buffer.buffer()));

    assertEquals(1, frames.size());
    assertEquals(2, frames.get(0).length());
    assertEquals(0, frames.get(0).body().length());
  }

  @Test
  void errorCodeIsParsed() {
    reader.handle(MockBroker.errorResponse(3));

    assertEquals(1, frames.size());
    assertEquals(3, frames.get(0).errorCode());
  }

  @Test
  void invalidLengthStopsReader() {
    reader.handle(Buffer.buffer().appendInt(1).appendByte((byte) 0));
    reader.handle(MockBroker.response(Buffer.buffer("ignored")));

    assertTrue(frames.isEmpty());
    assertEquals(1, errors.size());
    assertInstanceOf(BrokerProtocolException.class, errors.get(0));
  }
}
