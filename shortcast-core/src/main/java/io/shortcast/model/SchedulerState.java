package io.shortcast.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of the persisted scheduler state. Values are immutable; stores hand out a
 * fresh snapshot on every {@link io.shortcast.spi.StateStore#load()}.
 *
 * @param lastFetchTime   completion time of the last successful fetch, empty before the first one
 * @param consumedItemIds ids of items that have been published at least once
 */
public record SchedulerState(Optional<Instant> lastFetchTime, Set<String> consumedItemIds) {

  public static final SchedulerState INITIAL = new SchedulerState(Optional.empty(), Set.of());

  public SchedulerState {
    Objects.requireNonNull(lastFetchTime, "lastFetchTime");
    consumedItemIds = Set.copyOf(Objects.requireNonNull(consumedItemIds, "consumedItemIds"));
  }

  public SchedulerState withLastFetchTime(Instant fetchedAt) {
    return new SchedulerState(Optional.of(fetchedAt), consumedItemIds);
  }

  public SchedulerState withConsumed(String itemId) {
    if (consumedItemIds.contains(itemId)) {
      return this;
    }
    Set<String> next = new HashSet<>(consumedItemIds);
    next.add(itemId);
    return new SchedulerState(lastFetchTime, next);
  }

  public boolean isConsumed(String itemId) {
    return consumedItemIds.contains(itemId);
  }
}
