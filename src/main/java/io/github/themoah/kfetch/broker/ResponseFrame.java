package io.github.themoah.kfetch.broker;

import io.vertx.core.buffer.Buffer;

/**
 * One response read off the wire.
 *
 * @param length declared frame length, covering the error code and the body
 * @param errorCode broker error code, zero on success
 * @param body bytes following the error code
 */
public record ResponseFrame(
  int length,
  int errorCode,
  Buffer body
) {
}
