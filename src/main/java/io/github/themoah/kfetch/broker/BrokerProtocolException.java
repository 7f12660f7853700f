package io.github.themoah.kfetch.broker;

/**
 * A response frame violated the wire format. The connection is unusable afterwards.
 */
public class BrokerProtocolException extends RuntimeException {

  public BrokerProtocolException(String message) {
    super(message);
  }
}
