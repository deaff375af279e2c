package io.shortcast.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated outcome of one publish cycle.
 *
 * <p>An empty report with {@link #fatalError()} present means the cycle was aborted before
 * any channel attempt. An empty report without a fatal error means there was nothing to
 * publish.
 *
 * @param itemId     id of the selected item, empty when nothing was selected
 * @param outcomes   one outcome per enabled channel: primaries first, then secondaries, each in configuration order
 * @param startedAt  cycle start
 * @param finishedAt cycle end
 * @param fatalError message of the error that aborted the cycle, if any
 */
public record CycleReport(
    Optional<String> itemId,
    List<ChannelOutcome> outcomes,
    Instant startedAt,
    Instant finishedAt,
    Optional<String> fatalError
) {
  public CycleReport {
    Objects.requireNonNull(itemId, "itemId");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(finishedAt, "finishedAt");
    Objects.requireNonNull(fatalError, "fatalError");
    outcomes = List.copyOf(outcomes);
  }

  public static CycleReport completed(String itemId, List<ChannelOutcome> outcomes,
      Instant startedAt, Instant finishedAt) {
    return new CycleReport(Optional.of(itemId), outcomes, startedAt, finishedAt, Optional.empty());
  }

  public static CycleReport nothingToPublish(Instant startedAt, Instant finishedAt) {
    return new CycleReport(Optional.empty(), List.of(), startedAt, finishedAt, Optional.empty());
  }

  public static CycleReport aborted(String itemId, String error, Instant startedAt, Instant finishedAt) {
    return new CycleReport(Optional.ofNullable(itemId), List.of(), startedAt, finishedAt,
        Optional.of(error == null ? "unknown error" : error));
  }

  public boolean anySuccess() {
    return successCount() > 0;
  }

  public long successCount() {
    return outcomes.stream().filter(ChannelOutcome::success).count();
  }

  public boolean isAborted() {
    return fatalError.isPresent();
  }

  public Duration elapsed() {
    return Duration.between(startedAt, finishedAt);
  }
}
