package io.github.themoah.kfetch.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final BrokerHealthMonitor healthMonitor;

  public HealthCheckHandler(BrokerHealthMonitor healthMonitor) {
    this.healthMonitor = healthMonitor;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    respond(ctx, 200, HealthCheckResponse.liveness());
  }

  /**
   * 200 while the broker answers heartbeats, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    boolean reachable = healthMonitor.isBrokerReachable();
    respond(ctx, reachable ? 200 : 503,
      HealthCheckResponse.readiness(reachable, healthMonitor.getLatestOffset()));
  }

  private void respond(RoutingContext ctx, int statusCode, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(response.toJson().encode());
  }
}
