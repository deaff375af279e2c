package io.shortcast.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Computes trigger instants from times of day. Pure: no clock access.
 *
 * <p>Times of day are interpreted in the given zone. A time that falls into a daylight-saving
 * gap fires at the instant of the transition, so it never lands on a later configured time.
 * Several times inside the same gap resolve to that one instant and fire once. A time inside
 * an overlap uses the earlier offset.
 */
public final class TriggerCalculator {

  private TriggerCalculator() {}

  /**
   * Returns the first trigger strictly after {@code now}, wrapping to the next calendar day
   * when every time of today has passed.
   *
   * @param now   the reference instant
   * @param zone  zone of the times of day
   * @param times the times of day, non-empty
   * @return the next trigger instant
   */
  public static Instant nextTrigger(Instant now, ZoneId zone, Collection<LocalTime> times) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(zone, "zone");
    TreeSet<LocalTime> sorted = new TreeSet<>(times);
    if (sorted.isEmpty()) {
      throw new IllegalArgumentException("times must not be empty");
    }
    LocalDate day = now.atZone(zone).toLocalDate();
    // two days ahead covers any zone offset transition
    for (int offset = 0; offset <= 2; offset++) {
      LocalDate date = day.plusDays(offset);
      for (LocalTime time : sorted) {
        Instant candidate = resolve(date, time, zone);
        if (candidate.isAfter(now)) {
          return candidate;
        }
      }
    }
    throw new IllegalStateException("No trigger found after " + now);
  }

  /**
   * Resolves a local date and time in the zone. Gap times map to the start of the gap.
   */
  static Instant resolve(LocalDate date, LocalTime time, ZoneId zone) {
    LocalDateTime local = LocalDateTime.of(date, time);
    ZoneRules rules = zone.getRules();
    if (rules.getValidOffsets(local).isEmpty()) {
      return rules.getTransition(local).getInstant();
    }
    return ZonedDateTime.ofLocal(local, zone, null).toInstant();
  }

  /**
   * Enumerates the triggers in {@code [from, to)}.
   *
   * @param from  start of the window, inclusive
   * @param to    end of the window, exclusive
   * @param zone  zone of the times of day
   * @param times the times of day, non-empty
   * @return the triggers in ascending order
   */
  public static List<Instant> triggersBetween(Instant from, Instant to, ZoneId zone, Collection<LocalTime> times) {
    List<Instant> result = new ArrayList<>();
    Instant cursor = from.minusNanos(1);
    while (true) {
      Instant next = nextTrigger(cursor, zone, times);
      if (!next.isBefore(to)) {
        return result;
      }
      result.add(next);
      cursor = next;
    }
  }
}
