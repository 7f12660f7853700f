package io.github.themoah.kfetch.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics settings loaded from environment variables.
 *
 * @param enabled whether consumer metrics are recorded at all
 * @param reporterType registry backend, see {@link MicrometerConfig#createRegistry(String)}
 * @param jvmMetricsEnabled whether JVM metrics are bound to the registry
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  public boolean isEnabled() {
    return enabled;
  }

  public static MetricsConfig fromEnvironment() {
    boolean enabled = !"false".equalsIgnoreCase(System.getenv("METRICS_ENABLED"));
    String reporter = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = "true".equalsIgnoreCase(System.getenv("METRICS_JVM_ENABLED"));

    log.info("MetricsConfig loaded: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }
}
