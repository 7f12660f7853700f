package io.github.themoah.kfetch.consumer;

import io.github.themoah.kfetch.broker.Broker;
import io.github.themoah.kfetch.protocol.WireCodec;
import io.vertx.core.Future;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the broker for valid offsets before a point in time.
 */
public class OffsetQuery {

  private static final Logger log = LoggerFactory.getLogger(OffsetQuery.class);

  private final Broker broker;

  public OffsetQuery(Broker broker) {
    this.broker = Objects.requireNonNull(broker, "broker cannot be null");
  }

  /**
   * Gets up to {@code maxNumOffsets} valid offsets before {@code time}, in descending order.
   * Uses a dedicated connection that is closed before the future completes.
   *
   * @param time millisecond timestamp, {@link WireCodec#LATEST_TIME} or {@link WireCodec#EARLIEST_TIME}
   * @param maxNumOffsets maximum number of offsets to return
   * @return Future containing the offsets, empty if the broker returned none
   */
  public Future<List<Long>> getOffsets(long time, int maxNumOffsets) {
    log.debug("Getting up to {} offsets before {} for {}-{}",
      maxNumOffsets, time, broker.topic(), broker.partition());

    return broker.connect()
      .compose(connection -> connection.closeAfter(
        connection.exchange(WireCodec.encodeOffsetRequest(broker.topic(), broker.partition(), time, maxNumOffsets))
          .map(frame -> WireCodec.decodeOffsets(frame.body(), frame.length(), maxNumOffsets))))
      .onSuccess(offsets -> log.debug("Broker returned {} offsets for {}-{}",
        offsets.size(), broker.topic(), broker.partition()))
      .onFailure(err -> log.error("Failed to get offsets for {}-{}",
        broker.topic(), broker.partition(), err));
  }
}
