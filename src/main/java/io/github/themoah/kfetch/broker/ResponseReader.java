package io.github.themoah.kfetch.broker;

import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.parsetools.RecordParser;
import java.util.Objects;

/**
 * Reassembles length-prefixed response frames from socket chunks.
 *
 * <p>Wire layout: {@code [4B length][2B error code][body]}, where length counts the
 * error code and the body. Frames are emitted whole, regardless of how the bytes
 * were split across reads.
 */
public class ResponseReader implements Handler<Buffer> {

  static final int LENGTH_FIELD_SIZE = 4;
  static final int ERROR_CODE_SIZE = 2;

  private final RecordParser parser;
  private final Handler<ResponseFrame> frameHandler;
  private final Handler<Throwable> errorHandler;

  private int frameLength = -1;
  private boolean failed;

  public ResponseReader(Handler<ResponseFrame> frameHandler, Handler<Throwable> errorHandler) {
    this.frameHandler = Objects.requireNonNull(frameHandler, "frameHandler cannot be null");
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler cannot be null");
    this.parser = RecordParser.newFixed(LENGTH_FIELD_SIZE, this::handleRecord);
  }

  @Override
  public void handle(Buffer chunk) {
    if (!failed) {
      parser.handle(chunk);
    }
  }

  private void handleRecord(Buffer record) {
    if (failed) {
      return;
    }
    if (frameLength < 0) {
      readLength(record);
    } else {
      readFrame(record);
    }
  }

  private void readLength(Buffer record) {
    int length = record.getInt(0);
    if (length < ERROR_CODE_SIZE) {
      // stream position is unknown after a bad length, nothing more can be read
      failed = true;
      errorHandler.handle(new BrokerProtocolException("Invalid response frame length: " + length));
      return;
    }
    frameLength = length;
    parser.fixedSizeMode(length);
  }

  private void readFrame(Buffer record) {
    int length = frameLength;
    frameLength = -1;
    parser.fixedSizeMode(LENGTH_FIELD_SIZE);

    int errorCode = record.getUnsignedShort(0);
    Buffer body = record.getBuffer(ERROR_CODE_SIZE, record.length());
    frameHandler.handle(new ResponseFrame(length, errorCode, body));
  }
}
