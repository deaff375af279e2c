package io.shortcast.cooldown;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether a fetch workflow is due.
 *
 * <p>Pure: no clock access and no state writes. The caller records the new fetch time only
 * after discovery has completed successfully.
 */
public final class CooldownGate {

  private CooldownGate() {}

  /**
   * Returns whether a fetch should run now.
   *
   * @param now                the current instant
   * @param lastFetchTime      completion time of the last successful fetch
   * @param fetchIntervalHours cooldown in hours
   * @param force              bypasses the cooldown for this invocation
   * @return {@code true} when forced, on the first run, or once at least
   *     {@code fetchIntervalHours} have elapsed since the last fetch
   */
  public static boolean shouldFetch(Instant now, Optional<Instant> lastFetchTime,
      int fetchIntervalHours, boolean force) {
    if (force || lastFetchTime.isEmpty()) {
      return true;
    }
    Duration elapsed = Duration.between(lastFetchTime.get(), now);
    return elapsed.compareTo(Duration.ofHours(fetchIntervalHours)) >= 0;
  }

  /**
   * Time left until the next fetch is allowed.
   *
   * @param now                the current instant
   * @param lastFetchTime      completion time of the last successful fetch
   * @param fetchIntervalHours cooldown in hours
   * @return the remaining cooldown, {@link Duration#ZERO} if a fetch is already due
   */
  public static Duration remaining(Instant now, Optional<Instant> lastFetchTime, int fetchIntervalHours) {
    if (lastFetchTime.isEmpty()) {
      return Duration.ZERO;
    }
    Duration left = Duration.ofHours(fetchIntervalHours).minus(Duration.between(lastFetchTime.get(), now));
    return left.isNegative() ? Duration.ZERO : left;
  }
}
