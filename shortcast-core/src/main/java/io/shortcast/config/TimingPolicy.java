package io.shortcast.config;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Canonical timing policy: when publish cycles fire, when the daily fetch fires, and how
 * long the fetch cooldown lasts.
 *
 * <p>{@code publishTimes} is always non-empty, distinct and sorted ascending. Use
 * {@link #normalizePublishTimes(List, String)} to turn the configured list-or-legacy-scalar
 * shape into this canonical form before building a policy.
 *
 * @param publishTimes       times of day (in {@code zone}) at which a publish cycle is triggered
 * @param fetchIntervalHours minimum number of hours between two fetch workflows
 * @param fetchTime          time of day (in {@code zone}) at which the daily fetch is triggered
 * @param zone               zone in which the times of day are interpreted
 */
public record TimingPolicy(
    List<LocalTime> publishTimes,
    int fetchIntervalHours,
    LocalTime fetchTime,
    ZoneId zone
) {
  public static final LocalTime DEFAULT_PUBLISH_TIME = LocalTime.of(0, 30);
  public static final LocalTime DEFAULT_FETCH_TIME = LocalTime.of(0, 10);
  public static final int DEFAULT_FETCH_INTERVAL_HOURS = 24;

  public TimingPolicy {
    Objects.requireNonNull(publishTimes, "publishTimes");
    Objects.requireNonNull(fetchTime, "fetchTime");
    Objects.requireNonNull(zone, "zone");
    if (publishTimes.isEmpty()) {
      throw new IllegalArgumentException("publishTimes must not be empty");
    }
    if (fetchIntervalHours <= 0) {
      throw new IllegalArgumentException("fetchIntervalHours must be > 0, got: " + fetchIntervalHours);
    }
    publishTimes = List.copyOf(new TreeSet<>(publishTimes));
  }

  /**
   * Policy with the default fetch time, interval and the UTC zone.
   *
   * @param publishTimes the publish times of day
   * @return a new policy
   */
  public static TimingPolicy of(Collection<LocalTime> publishTimes) {
    return new TimingPolicy(new ArrayList<>(publishTimes), DEFAULT_FETCH_INTERVAL_HOURS,
        DEFAULT_FETCH_TIME, ZoneOffset.UTC);
  }

  /**
   * Normalizes the configured publish times. A non-empty list wins; otherwise the legacy
   * single value becomes a one-element list; when neither is set the default
   * {@code 00:30} is used.
   *
   * @param publishTimes      configured {@code HH:mm} list (may be {@code null} or empty)
   * @param legacyPublishTime configured legacy {@code HH:mm} scalar (may be {@code null} or blank)
   * @return the canonical, sorted and distinct publish times
   * @throws IllegalArgumentException if any value is not a valid {@code HH:mm} time
   */
  public static List<LocalTime> normalizePublishTimes(List<String> publishTimes, String legacyPublishTime) {
    if (publishTimes != null && !publishTimes.isEmpty()) {
      TreeSet<LocalTime> times = new TreeSet<>();
      for (String value : publishTimes) {
        times.add(parseTimeOfDay(value));
      }
      return List.copyOf(times);
    }
    if (legacyPublishTime != null && !legacyPublishTime.isBlank()) {
      return List.of(parseTimeOfDay(legacyPublishTime));
    }
    return List.of(DEFAULT_PUBLISH_TIME);
  }

  /**
   * Parses an {@code H:mm} or {@code HH:mm} time of day.
   *
   * @param value the text to parse
   * @return the parsed time
   * @throws IllegalArgumentException if the value is malformed or out of range
   */
  public static LocalTime parseTimeOfDay(String value) {
    if (value == null) {
      throw new IllegalArgumentException("time of day must not be null");
    }
    String[] parts = value.trim().split(":");
    if (parts.length != 2) {
      throw new IllegalArgumentException("Expected HH:mm but got: " + value);
    }
    try {
      return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    } catch (NumberFormatException | DateTimeException e) {
      throw new IllegalArgumentException("Expected HH:mm but got: " + value, e);
    }
  }
}
