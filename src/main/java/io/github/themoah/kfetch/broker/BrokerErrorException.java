package io.github.themoah.kfetch.broker;

/**
 * The broker answered with a non-zero error code.
 */
public class BrokerErrorException extends RuntimeException {

  private final int errorCode;

  public BrokerErrorException(int errorCode) {
    super("Broker returned error code " + errorCode);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }
}
