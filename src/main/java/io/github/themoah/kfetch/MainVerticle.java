package io.github.themoah.kfetch;

import io.github.themoah.kfetch.broker.Broker;
import io.github.themoah.kfetch.broker.BrokerConfig;
import io.github.themoah.kfetch.config.AppConfig;
import io.github.themoah.kfetch.consumer.BrokerConsumer;
import io.github.themoah.kfetch.consumer.ConsumeSummary;
import io.github.themoah.kfetch.health.BrokerHealthMonitor;
import io.github.themoah.kfetch.health.HealthCheckHandler;
import io.github.themoah.kfetch.metrics.ConsumerMetrics;
import io.github.themoah.kfetch.metrics.MetricsConfig;
import io.github.themoah.kfetch.metrics.MicrometerConfig;
import io.github.themoah.kfetch.metrics.MicrometerConsumerMetrics;
import io.github.themoah.kfetch.metrics.PrometheusHandler;
import io.github.themoah.kfetch.protocol.Message;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tails one topic partition, logging every message, and serves health and metrics over HTTP.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private Broker broker;
  private ConsumerMetrics metrics = ConsumerMetrics.NOOP;
  private BrokerHealthMonitor healthMonitor;
  private HttpServer httpServer;
  private Promise<Void> quit;
  private Future<ConsumeSummary> consumption;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting kfetch MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    BrokerConfig brokerConfig;
    try {
      brokerConfig = loadBrokerConfig();
    } catch (IllegalStateException | IllegalArgumentException e) {
      log.error("Invalid broker configuration", e);
      startPromise.fail(e);
      return;
    }

    Router router = Router.router(vertx);
    metrics = createMetrics(metricsConfig, brokerConfig, router);

    broker = new Broker(vertx, brokerConfig);
    BrokerConsumer consumer = new BrokerConsumer(
      vertx, broker, brokerConfig.getStartOffset(), brokerConfig.getMaxFetchSize(), metrics);
    metrics.recordCursor(consumer.offset());

    healthMonitor = new BrokerHealthMonitor(
      vertx, BrokerConsumer.forOffsets(vertx, broker), metrics, appConfig.healthCheckIntervalMs());
    new HealthCheckHandler(healthMonitor).registerRoutes(router);

    router.route().handler(ctx -> ctx.response()
      .setStatusCode(404)
      .putHeader("content-type", "application/json")
      .end("{\"error\": \"Not Found\"}"));

    healthMonitor.start()
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        startConsuming(consumer, appConfig.pollIntervalMs());
        log.info("kfetch started on port {}, consuming {}-{} from offset {}",
          appConfig.httpPort(), brokerConfig.getTopic(), brokerConfig.getPartition(), consumer.offset());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start kfetch", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping kfetch MainVerticle");

    if (quit != null) {
      quit.tryComplete();
    }
    Future<Void> stopConsumer = (consumption != null)
      ? consumption.<Void>mapEmpty().otherwiseEmpty()
      : Future.succeededFuture();

    Future<Void> stopHealthMonitor = (healthMonitor != null)
      ? healthMonitor.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    Future<Void> closeBroker = (broker != null)
      ? broker.close()
      : Future.succeededFuture();

    stopConsumer
      .compose(v -> stopHealthMonitor)
      .compose(v -> stopHttpServer)
      .compose(v -> closeBroker)
      .compose(v -> metrics.close())
      .onSuccess(v -> {
        log.info("kfetch stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during kfetch shutdown", err);
        stopPromise.fail(err);
      });
  }

  private void startConsuming(BrokerConsumer consumer, long pollIntervalMs) {
    quit = Promise.promise();
    consumption = consumer.consumeUntilQuit(pollIntervalMs, quit.future(), this::logMessage)
      .onSuccess(summary -> log.info("Consumer finished: {} messages, {} failed polls",
        summary.messageCount(), summary.failedPolls()))
      .onFailure(err -> {
        log.error("Consumer could not start, undeploying", err);
        vertx.undeploy(deploymentID());
      });
  }

  private void logMessage(Message message) {
    if (!message.isValid()) {
      log.warn("Checksum mismatch for message at offset {}", message.offset());
    }
    log.info("offset={} size={} payload={}", message.offset(), message.payloadLength(),
      new String(message.payload(), StandardCharsets.UTF_8));
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private BrokerConfig loadBrokerConfig() {
    try {
      return BrokerConfig.fromClasspath();
    } catch (Exception e) {
      log.info("No usable classpath config, loading from environment: {}", e.getMessage());
      return BrokerConfig.fromEnvironment();
    }
  }

  private ConsumerMetrics createMetrics(MetricsConfig config, BrokerConfig brokerConfig, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return ConsumerMetrics.NOOP;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return ConsumerMetrics.NOOP;
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerConsumerMetrics(registry, brokerConfig.getTopic(), brokerConfig.getPartition());
  }
}
