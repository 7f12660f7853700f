package io.github.themoah.kfetch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port for health and metrics
 * @param pollIntervalMs delay between consume polls in milliseconds
 * @param healthCheckIntervalMs broker heartbeat interval in milliseconds
 */
public record AppConfig(
  int httpPort,
  long pollIntervalMs,
  long healthCheckIntervalMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_POLL_INTERVAL_MS = 1_000L;
  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;

  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long pollInterval = getEnvLong("CONSUMER_POLL_INTERVAL_MS", DEFAULT_POLL_INTERVAL_MS);
    long healthInterval = getEnvLong("BROKER_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);

    if (pollInterval < 1) {
      log.warn("CONSUMER_POLL_INTERVAL_MS must be >= 1, using default: {}", DEFAULT_POLL_INTERVAL_MS);
      pollInterval = DEFAULT_POLL_INTERVAL_MS;
    }

    log.info("AppConfig loaded: httpPort={}, pollIntervalMs={}, healthCheckIntervalMs={}",
      port, pollInterval, healthInterval);
    return new AppConfig(port, pollInterval, healthInterval);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
