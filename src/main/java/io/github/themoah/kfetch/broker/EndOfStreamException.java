package io.github.themoah.kfetch.broker;

/**
 * The broker closed the connection while a response was expected.
 * Continuous consumers treat this as "no data this poll".
 */
public class EndOfStreamException extends RuntimeException {

  public EndOfStreamException(String connection) {
    super("End of stream on " + connection);
  }
}
