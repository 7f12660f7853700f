package io.github.themoah.kfetch.protocol;

/**
 * Request type ids carried in the request header.
 */
public enum RequestType {
  PRODUCE(0),
  FETCH(1),
  MULTIFETCH(2),
  MULTIPRODUCE(3),
  OFFSETS(4);

  private final int id;

  RequestType(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }
}
