package io.github.themoah.kfetch.health;

/**
 * Health of the broker link as seen by the heartbeat.
 */
public enum HealthStatus {
  UP("UP"),
  DOWN("DOWN");

  private final String value;

  HealthStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static HealthStatus of(boolean up) {
    return up ? UP : DOWN;
  }
}
