package io.github.themoah.kfetch;

import io.github.themoah.kfetch.config.VertxConfig;
import io.vertx.core.Vertx;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: deploys the consumer verticle and undeploys it on JVM shutdown.
 */
public class KfetchLauncher {

  private static final Logger log = LoggerFactory.getLogger(KfetchLauncher.class);

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());

    vertx.deployVerticle(new MainVerticle())
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutdown requested, stopping consumer");
      CountDownLatch closed = new CountDownLatch(1);
      vertx.close().onComplete(ar -> closed.countDown());
      try {
        if (!closed.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Vert.x did not close within {}s", SHUTDOWN_TIMEOUT_SECONDS);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "kfetch-shutdown"));
  }
}
