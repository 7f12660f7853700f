package io.github.themoah.kfetch.health;

import io.github.themoah.kfetch.consumer.BrokerConsumer;
import io.github.themoah.kfetch.metrics.ConsumerMetrics;
import io.github.themoah.kfetch.protocol.WireCodec;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monitors broker reachability with a periodic latest-offset query.
 * Each heartbeat uses its own short-lived connection.
 */
public class BrokerHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(BrokerHealthMonitor.class);

  private final Vertx vertx;
  private final BrokerConsumer consumer;
  private final ConsumerMetrics metrics;
  private final long heartbeatIntervalMs;
  private final AtomicReference<HealthStatus> brokerStatus = new AtomicReference<>(HealthStatus.DOWN);
  private final AtomicReference<Long> latestOffset = new AtomicReference<>();

  private Long timerId;

  public BrokerHealthMonitor(Vertx vertx, BrokerConsumer consumer, ConsumerMetrics metrics, long heartbeatIntervalMs) {
    this.vertx = vertx;
    this.consumer = consumer;
    this.metrics = metrics;
    this.heartbeatIntervalMs = heartbeatIntervalMs;
  }

  /**
   * Starts the monitor with an initial check and a periodic heartbeat.
   *
   * @return Future that completes when the initial check finishes, whatever its result
   */
  public Future<Void> start() {
    log.info("Starting broker health monitor with heartbeat interval: {}ms", heartbeatIntervalMs);

    return performHealthCheck()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(heartbeatIntervalMs, id -> performHealthCheck());
        log.info("Broker health monitor started, timer ID: {}", timerId);
      })
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping broker health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    brokerStatus.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public HealthStatus getBrokerStatus() {
    return brokerStatus.get();
  }

  public boolean isBrokerReachable() {
    return brokerStatus.get() == HealthStatus.UP;
  }

  /**
   * Latest offset from the last successful heartbeat, or null if none yet.
   */
  public Long getLatestOffset() {
    return latestOffset.get();
  }

  Future<Void> performHealthCheck() {
    log.debug("Performing broker health check");

    return consumer.getOffsets(WireCodec.LATEST_TIME, 1)
      .onSuccess(this::markUp)
      .onFailure(this::markDown)
      .<Void>mapEmpty()
      .otherwiseEmpty();
  }

  private void markUp(List<Long> offsets) {
    if (!offsets.isEmpty()) {
      long offset = offsets.get(0);
      latestOffset.set(offset);
      metrics.recordLatestOffset(offset);
    }
    HealthStatus previous = brokerStatus.getAndSet(HealthStatus.UP);
    if (previous == HealthStatus.DOWN) {
      log.info("Broker reachable, latest offset: {}", latestOffset.get());
    } else {
      log.debug("Broker health check passed, latest offset: {}", latestOffset.get());
    }
  }

  private void markDown(Throwable err) {
    HealthStatus previous = brokerStatus.getAndSet(HealthStatus.DOWN);
    if (previous == HealthStatus.UP) {
      log.warn("Broker unreachable: {}", err.getMessage());
    } else {
      log.debug("Broker health check failed: {}", err.getMessage());
    }
  }
}
