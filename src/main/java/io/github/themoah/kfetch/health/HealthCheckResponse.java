package io.github.themoah.kfetch.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param broker broker reachability (null for liveness check)
 * @param latestOffset latest offset from the last successful heartbeat (null if unknown)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String broker,
  Long latestOffset
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null);
  }

  /**
   * Creates a readiness response from the heartbeat state.
   *
   * @param brokerReachable true if the last heartbeat succeeded
   * @param latestOffset latest offset seen, or null
   */
  public static HealthCheckResponse readiness(boolean brokerReachable, Long latestOffset) {
    String broker = brokerReachable ? "reachable" : "unreachable";
    return new HealthCheckResponse(HealthStatus.of(brokerReachable), broker, latestOffset);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (broker != null) {
      json.put("broker", broker);
    }
    if (latestOffset != null) {
      json.put("latestOffset", latestOffset);
    }
    return json;
  }
}
