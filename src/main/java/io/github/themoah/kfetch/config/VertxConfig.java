package io.github.themoah.kfetch.config;

import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x instance options. A single consumer needs very few event loops.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_EVENT_LOOP_POOL_SIZE = "VERTX_EVENT_LOOP_POOL_SIZE";
  private static final int DEFAULT_EVENT_LOOP_POOL_SIZE = 2;

  private VertxConfig() {}

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setEventLoopPoolSize(eventLoopPoolSize());
    return options;
  }

  static int eventLoopPoolSize() {
    String value = System.getenv(ENV_EVENT_LOOP_POOL_SIZE);
    if (value == null || value.isBlank()) {
      return DEFAULT_EVENT_LOOP_POOL_SIZE;
    }
    int size;
    try {
      size = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid integer for {}: {}", ENV_EVENT_LOOP_POOL_SIZE, value);
      size = -1;
    }
    if (size > 0) {
      return size;
    }
    log.warn("Invalid {}: {}, using default: {}", ENV_EVENT_LOOP_POOL_SIZE, value, DEFAULT_EVENT_LOOP_POOL_SIZE);
    return DEFAULT_EVENT_LOOP_POOL_SIZE;
  }
}
