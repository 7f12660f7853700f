package io.github.themoah.kfetch.consumer;

/**
 * Outcome of a continuous consume loop.
 *
 * @param messageCount messages delivered while the loop ran
 * @param failedPolls polls that ended with an error other than end-of-stream
 * @param lastError the most recent such error, or null
 */
public record ConsumeSummary(
  long messageCount,
  long failedPolls,
  Throwable lastError
) {

  public boolean hasError() {
    return lastError != null;
  }
}
