package io.github.themoah.kfetch.broker;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetSocket;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A TCP connection to a broker carrying one request/response exchange at a time.
 * Owned by a single consumer loop; never shared.
 */
public class BrokerConnection {

  private static final Logger log = LoggerFactory.getLogger(BrokerConnection.class);

  private final NetSocket socket;
  private final String description;
  private final AtomicReference<Promise<ResponseFrame>> pending = new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean ended = new AtomicBoolean();

  BrokerConnection(NetSocket socket, String description) {
    this.socket = Objects.requireNonNull(socket, "socket cannot be null");
    this.description = description;
    socket.handler(new ResponseReader(this::handleFrame, this::handleReadError));
    socket.exceptionHandler(this::failPending);
    socket.closeHandler(v -> handleEnd());
  }

  /**
   * Writes a request and completes with the next response frame.
   * Fails with {@link BrokerErrorException} when the broker reports an error code,
   * and with {@link EndOfStreamException} when the broker closes the connection first.
   * Once the broker has closed the connection every later exchange ends the same way.
   *
   * @param request an encoded request frame
   * @return Future containing the response frame
   */
  public Future<ResponseFrame> exchange(Buffer request) {
    if (closed.get()) {
      return Future.failedFuture(new BrokerConnectionException("Connection to " + description + " is closed"));
    }
    if (ended.get()) {
      return Future.failedFuture(new EndOfStreamException(description));
    }
    Promise<ResponseFrame> promise = Promise.promise();
    if (!pending.compareAndSet(null, promise)) {
      return Future.failedFuture(new IllegalStateException("An exchange is already in flight on " + description));
    }
    log.debug("Sending {} byte request to {}", request.length(), description);
    socket.write(request).onFailure(this::failPending);
    return promise.future();
  }

  /**
   * Closes the socket. Only the first call has an effect.
   *
   * @return Future that completes when the socket is closed
   */
  public Future<Void> close() {
    if (!closed.compareAndSet(false, true)) {
      return Future.succeededFuture();
    }
    log.debug("Closing connection to {}", description);
    return socket.close();
  }

  /**
   * Closes this connection once {@code work} completes, whatever the outcome,
   * and passes the outcome on unchanged.
   */
  public <T> Future<T> closeAfter(Future<T> work) {
    return work.transform(ar -> close()
      .otherwiseEmpty()
      .transform(v -> ar.succeeded()
        ? Future.<T>succeededFuture(ar.result())
        : Future.<T>failedFuture(ar.cause())));
  }

  public boolean isClosed() {
    return closed.get() || ended.get();
  }

  @Override
  public String toString() {
    return description;
  }

  private void handleFrame(ResponseFrame frame) {
    Promise<ResponseFrame> promise = pending.getAndSet(null);
    if (promise == null) {
      log.warn("Dropping unsolicited {} byte response from {}", frame.length(), description);
      return;
    }
    log.debug("Received {} byte response from {}, error code {}",
      frame.length(), description, frame.errorCode());
    if (frame.errorCode() != 0) {
      promise.fail(new BrokerErrorException(frame.errorCode()));
    } else {
      promise.complete(frame);
    }
  }

  private void handleReadError(Throwable err) {
    log.error("Unreadable response from {}, closing connection", description, err);
    failPending(err);
    close();
  }

  private void handleEnd() {
    ended.set(true);
    log.debug("Connection to {} ended", description);
    failPending(new EndOfStreamException(description));
  }

  private void failPending(Throwable err) {
    Promise<ResponseFrame> promise = pending.getAndSet(null);
    if (promise != null) {
      promise.fail(err);
    } else {
      log.debug("Connection error on {} with no exchange in flight: {}", description, err.getMessage());
    }
  }
}
