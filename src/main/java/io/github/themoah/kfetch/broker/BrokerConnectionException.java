package io.github.themoah.kfetch.broker;

/**
 * Raised when a broker connection cannot be opened or is used after it was closed.
 */
public class BrokerConnectionException extends RuntimeException {

  public BrokerConnectionException(String message) {
    super(message);
  }

  public BrokerConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
