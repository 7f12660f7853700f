package io.github.themoah.kfetch.broker;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens connections to the broker serving one topic partition.
 */
public class Broker {

  private static final Logger log = LoggerFactory.getLogger(Broker.class);

  private final BrokerConfig config;
  private final NetClient netClient;

  /**
   * Creates a new Broker.
   *
   * @param vertx  the Vert.x instance
   * @param config the broker configuration
   */
  public Broker(Vertx vertx, BrokerConfig config) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    NetClientOptions options = new NetClientOptions()
      .setConnectTimeout(config.getConnectTimeoutMs())
      .setTcpNoDelay(true);
    this.netClient = vertx.createNetClient(options);
  }

  /**
   * Opens a new connection. The caller owns it and must close it.
   *
   * @return Future containing the open connection
   */
  public Future<BrokerConnection> connect() {
    String description = describe();
    log.debug("Connecting to {}", description);
    return netClient.connect(config.getPort(), config.getHost())
      .<BrokerConnection>map(socket -> new BrokerConnection(socket, description))
      .recover(err -> Future.failedFuture(
        new BrokerConnectionException("Failed to connect to " + description, err)))
      .onSuccess(conn -> log.debug("Connected to {}", description))
      .onFailure(err -> log.error("Failed to connect to {}: {}", description, err.getMessage()));
  }

  public String topic() {
    return config.getTopic();
  }

  public int partition() {
    return config.getPartition();
  }

  public BrokerConfig config() {
    return config;
  }

  /**
   * Releases the underlying client. Connections already handed out stay open.
   */
  public Future<Void> close() {
    return netClient.close();
  }

  private String describe() {
    return config.getTopic() + "-" + config.getPartition() + "@" + config.getHost() + ":" + config.getPort();
  }
}
