package io.github.themoah.kfetch.consumer;

import io.github.themoah.kfetch.protocol.Message;

/**
 * Callback invoked synchronously once per decoded message, in offset order.
 * It runs on the connection's event loop and must not block for long.
 */
@FunctionalInterface
public interface MessageHandler {

  void handle(Message message);
}
