package io.github.themoah.kfetch.broker;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration holder for a single topic partition consumer.
 */
public class BrokerConfig {

  private static final Logger log = LoggerFactory.getLogger(BrokerConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_ADDRESS = "broker.address";
  private static final String PROP_TOPIC = "broker.topic";
  private static final String PROP_PARTITION = "broker.partition";
  private static final String PROP_START_OFFSET = "broker.start.offset";
  private static final String PROP_MAX_FETCH_SIZE = "broker.max.fetch.size";
  private static final String PROP_CONNECT_TIMEOUT_MS = "broker.connect.timeout.ms";

  static final int DEFAULT_PORT = 9092;
  private static final String DEFAULT_HOST = "localhost";
  private static final int DEFAULT_MAX_FETCH_SIZE = 1024 * 1024;
  private static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;

  private final String host;
  private final int port;
  private final String topic;
  private final int partition;
  private final long startOffset;
  private final int maxFetchSize;
  private final int connectTimeoutMs;

  private BrokerConfig(Builder builder) {
    this.host = builder.host;
    this.port = builder.port;
    this.topic = builder.topic;
    this.partition = builder.partition;
    this.startOffset = builder.startOffset;
    this.maxFetchSize = builder.maxFetchSize;
    this.connectTimeoutMs = builder.connectTimeoutMs;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String getTopic() {
    return topic;
  }

  public int getPartition() {
    return partition;
  }

  public long getStartOffset() {
    return startOffset;
  }

  public int getMaxFetchSize() {
    return maxFetchSize;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads configuration from BROKER_* environment variables.
   */
  public static BrokerConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  static BrokerConfig fromMap(Map<String, String> env) {
    Builder builder = builder()
      .address(env.getOrDefault("BROKER_ADDRESS", DEFAULT_HOST + ":" + DEFAULT_PORT))
      .partition(Integer.parseInt(env.getOrDefault("BROKER_PARTITION", "0")))
      .startOffset(Long.parseLong(env.getOrDefault("BROKER_START_OFFSET", "0")))
      .maxFetchSize(Integer.parseInt(
        env.getOrDefault("BROKER_MAX_FETCH_SIZE", String.valueOf(DEFAULT_MAX_FETCH_SIZE))))
      .connectTimeoutMs(Integer.parseInt(
        env.getOrDefault("BROKER_CONNECT_TIMEOUT_MS", String.valueOf(DEFAULT_CONNECT_TIMEOUT_MS))));
    String topic = env.get("BROKER_TOPIC");
    if (topic != null && !topic.isBlank()) {
      builder.topic(topic);
    }
    return builder.build();
  }

  /**
   * Loads configuration from the default application.properties file on the classpath.
   *
   * @return BrokerConfig loaded from classpath
   * @throws IOException if the config file cannot be read
   */
  public static BrokerConfig fromClasspath() throws IOException {
    return fromClasspath(DEFAULT_CONFIG_FILE);
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @return BrokerConfig loaded from the resource
   * @throws IOException if the config file cannot be read
   */
  public static BrokerConfig fromClasspath(String resourceName) throws IOException {
    log.info("Loading configuration from classpath: {}", resourceName);
    try (InputStream is = BrokerConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Loads configuration from a properties file at the given path.
   *
   * @param path the path to the properties file
   * @return BrokerConfig loaded from the file
   * @throws IOException if the file cannot be read
   */
  public static BrokerConfig fromFile(Path path) throws IOException {
    log.info("Loading configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from a Properties object holding broker.* keys.
   */
  public static BrokerConfig fromProperties(Properties props) {
    Builder builder = builder();

    String address = props.getProperty(PROP_ADDRESS);
    if (address != null && !address.isBlank()) {
      builder.address(address);
    }
    String topic = props.getProperty(PROP_TOPIC);
    if (topic != null && !topic.isBlank()) {
      builder.topic(topic.trim());
    }
    String partition = props.getProperty(PROP_PARTITION);
    if (partition != null && !partition.isBlank()) {
      builder.partition(Integer.parseInt(partition.trim()));
    }
    String startOffset = props.getProperty(PROP_START_OFFSET);
    if (startOffset != null && !startOffset.isBlank()) {
      builder.startOffset(Long.parseLong(startOffset.trim()));
    }
    String maxFetchSize = props.getProperty(PROP_MAX_FETCH_SIZE);
    if (maxFetchSize != null && !maxFetchSize.isBlank()) {
      builder.maxFetchSize(Integer.parseInt(maxFetchSize.trim()));
    }
    String connectTimeout = props.getProperty(PROP_CONNECT_TIMEOUT_MS);
    if (connectTimeout != null && !connectTimeout.isBlank()) {
      builder.connectTimeoutMs(Integer.parseInt(connectTimeout.trim()));
    }

    BrokerConfig config = builder.build();
    log.info("Configuration loaded: broker={}:{}, topic={}, partition={}",
      config.host, config.port, config.topic, config.partition);
    return config;
  }

  public static class Builder {

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String topic;
    private int partition = 0;
    private long startOffset = 0;
    private int maxFetchSize = DEFAULT_MAX_FETCH_SIZE;
    private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;

    /**
     * Sets host and port from "host" or "host:port". The port defaults to 9092.
     */
    public Builder address(String address) {
      Objects.requireNonNull(address, "address cannot be null");
      String trimmed = address.trim();
      int colon = trimmed.lastIndexOf(':');
      if (colon < 0) {
        this.host = trimmed;
        this.port = DEFAULT_PORT;
      } else {
        this.host = trimmed.substring(0, colon);
        this.port = Integer.parseInt(trimmed.substring(colon + 1));
      }
      if (host.isEmpty()) {
        throw new IllegalArgumentException("Broker address has no host: " + address);
      }
      return this;
    }

    public Builder host(String host) {
      this.host = Objects.requireNonNull(host, "host cannot be null");
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder topic(String topic) {
      this.topic = Objects.requireNonNull(topic, "topic cannot be null");
      return this;
    }

    public Builder partition(int partition) {
      this.partition = partition;
      return this;
    }

    public Builder startOffset(long startOffset) {
      this.startOffset = startOffset;
      return this;
    }

    public Builder maxFetchSize(int maxFetchSize) {
      this.maxFetchSize = maxFetchSize;
      return this;
    }

    public Builder connectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    public BrokerConfig build() {
      if (topic == null || topic.isBlank()) {
        throw new IllegalStateException("A topic must be configured");
      }
      if (port <= 0 || port > 65535) {
        throw new IllegalStateException("Invalid broker port: " + port);
      }
      return new BrokerConfig(this);
    }
  }
}
