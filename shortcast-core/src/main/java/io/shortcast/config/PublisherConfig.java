package io.shortcast.config;

import io.shortcast.select.QueueOrdering;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validated, normalized configuration: the destination channels and the timing policy.
 *
 * <p>Immutable once built. The builder accepts the raw document shape (platform strings,
 * {@code HH:mm} strings, the legacy single publish time) and {@link Builder#build()} applies
 * the one-time normalization before any scheduling logic sees the values. All validation
 * problems are collected and reported together in a {@link ConfigInvalidException}.
 *
 * <pre>{@code
 * PublisherConfig config = PublisherConfig.builder()
 *     .channel("main-yt", "youtube", true, "tokens/main.json", "assets/main")
 *     .channel("tt", "tiktok", true, "cookies/tt.txt", null)
 *     .publishTimes(List.of("09:00", "17:00"))
 *     .fetchIntervalHours(24)
 *     .build();
 * }</pre>
 */
public final class PublisherConfig {
  private final List<ChannelConfig> channels;
  private final TimingPolicy timing;
  private final QueueOrdering ordering;
  private final boolean refillOnEmpty;

  private PublisherConfig(List<ChannelConfig> channels, TimingPolicy timing,
      QueueOrdering ordering, boolean refillOnEmpty) {
    this.channels = List.copyOf(channels);
    this.timing = timing;
    this.ordering = ordering;
    this.refillOnEmpty = refillOnEmpty;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** All configured channels in configuration order, enabled or not. */
  public List<ChannelConfig> channels() {
    return channels;
  }

  /**
   * Enabled channels of the given kind, in configuration order.
   *
   * @param kind the platform kind
   * @return matching enabled channels
   */
  public List<ChannelConfig> enabledChannels(PlatformKind kind) {
    List<ChannelConfig> result = new ArrayList<>();
    for (ChannelConfig channel : channels) {
      if (channel.enabled() && channel.platformKind() == kind) {
        result.add(channel);
      }
    }
    return result;
  }

  public TimingPolicy timing() {
    return timing;
  }

  public QueueOrdering ordering() {
    return ordering;
  }

  /** Whether a scheduled publish cycle refills an empty queue through discovery before giving up. */
  public boolean refillOnEmpty() {
    return refillOnEmpty;
  }

  /** Builder for {@link PublisherConfig}. */
  public static final class Builder {
    private final List<ChannelConfig> channels = new ArrayList<>();
    private final List<String> problems = new ArrayList<>();
    private int declared;
    private List<String> publishTimes;
    private String legacyPublishTime;
    private String fetchTime;
    private int fetchIntervalHours = TimingPolicy.DEFAULT_FETCH_INTERVAL_HOURS;
    private String zone;
    private QueueOrdering ordering = QueueOrdering.SCORE_DESC;
    private boolean refillOnEmpty = true;

    private Builder() {}

    /**
     * Appends an already-typed channel.
     *
     * @param channel the channel
     * @return this builder
     */
    public Builder channel(ChannelConfig channel) {
      channels.add(Objects.requireNonNull(channel, "channel"));
      declared++;
      return this;
    }

    /**
     * Appends a channel from its document representation. Problems (blank id, unknown
     * platform) are collected and reported by {@link #build()}.
     *
     * @param id             channel id
     * @param platform       platform string ({@code primary}, {@code secondary} or an alias)
     * @param enabled        whether the channel is enabled
     * @param credentialRef  credential reference
     * @param mediaFolderRef media folder reference
     * @return this builder
     */
    public Builder channel(String id, String platform, boolean enabled,
        String credentialRef, String mediaFolderRef) {
      int index = declared++;
      if (id == null || id.isBlank()) {
        problems.add("channels[" + index + "].id is required");
        return this;
      }
      PlatformKind kind;
      try {
        kind = PlatformKind.parse(platform);
      } catch (IllegalArgumentException e) {
        problems.add("channels[" + id + "].platform: " + e.getMessage());
        return this;
      }
      channels.add(new ChannelConfig(id.trim(), kind, enabled, credentialRef, mediaFolderRef));
      return this;
    }

    /**
     * Sets the publish times of day ({@code HH:mm}).
     *
     * @param publishTimes publish times; a non-empty list takes precedence over the legacy value
     * @return this builder
     */
    public Builder publishTimes(List<String> publishTimes) {
      this.publishTimes = publishTimes == null ? null : new ArrayList<>(publishTimes);
      return this;
    }

    /**
     * Sets the legacy single publish time, used only when no publish time list is configured.
     *
     * @param legacyPublishTime a single {@code HH:mm} value
     * @return this builder
     */
    public Builder legacyPublishTime(String legacyPublishTime) {
      this.legacyPublishTime = legacyPublishTime;
      return this;
    }

    /**
     * Sets the daily fetch time ({@code HH:mm}). Optional, defaults to {@code 00:10}.
     *
     * @param fetchTime the fetch time of day
     * @return this builder
     */
    public Builder fetchTime(String fetchTime) {
      this.fetchTime = fetchTime;
      return this;
    }

    /**
     * Sets the fetch cooldown in hours. Optional, defaults to {@code 24}. Must be &gt; 0.
     *
     * @param fetchIntervalHours cooldown in hours
     * @return this builder
     */
    public Builder fetchIntervalHours(int fetchIntervalHours) {
      this.fetchIntervalHours = fetchIntervalHours;
      return this;
    }

    /**
     * Sets the zone the times of day are interpreted in. Optional, defaults to UTC.
     *
     * @param zone a zone id such as {@code Europe/Bucharest}
     * @return this builder
     */
    public Builder zone(String zone) {
      this.zone = zone;
      return this;
    }

    /**
     * Sets the queue ordering policy. Optional, defaults to {@link QueueOrdering#SCORE_DESC}.
     *
     * @param ordering the ordering
     * @return this builder
     */
    public Builder ordering(QueueOrdering ordering) {
      this.ordering = Objects.requireNonNull(ordering, "ordering");
      return this;
    }

    /**
     * Sets the queue ordering policy from its configured name ({@code score-desc} or {@code fifo}).
     * An unknown name is reported by {@link #build()}.
     *
     * @param ordering the ordering name
     * @return this builder
     */
    public Builder ordering(String ordering) {
      try {
        this.ordering = QueueOrdering.parse(ordering);
      } catch (IllegalArgumentException e) {
        problems.add("selection.ordering: " + e.getMessage());
      }
      return this;
    }

    /**
     * Sets whether scheduled publish cycles refill an empty queue. Optional, defaults to {@code true}.
     *
     * @param refillOnEmpty whether to refill
     * @return this builder
     */
    public Builder refillOnEmpty(boolean refillOnEmpty) {
      this.refillOnEmpty = refillOnEmpty;
      return this;
    }

    /**
     * Validates and normalizes the collected values.
     *
     * @return the configuration
     * @throws ConfigInvalidException if any value is invalid
     */
    public PublisherConfig build() {
      List<String> errors = new ArrayList<>(problems);

      Set<String> ids = new HashSet<>();
      for (ChannelConfig channel : channels) {
        if (!ids.add(channel.id())) {
          errors.add("duplicate channel id: " + channel.id());
        }
      }

      List<LocalTime> times = null;
      try {
        times = TimingPolicy.normalizePublishTimes(publishTimes, legacyPublishTime);
      } catch (IllegalArgumentException e) {
        errors.add("scheduler.publish-times: " + e.getMessage());
      }

      LocalTime fetchAt = TimingPolicy.DEFAULT_FETCH_TIME;
      if (fetchTime != null && !fetchTime.isBlank()) {
        try {
          fetchAt = TimingPolicy.parseTimeOfDay(fetchTime);
        } catch (IllegalArgumentException e) {
          errors.add("scheduler.fetch-time: " + e.getMessage());
        }
      }

      if (fetchIntervalHours <= 0) {
        errors.add("scheduler.fetch-interval-hours must be > 0, got: " + fetchIntervalHours);
      }

      ZoneId zoneId = ZoneOffset.UTC;
      if (zone != null && !zone.isBlank()) {
        try {
          zoneId = ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
          errors.add("scheduler.timezone: unknown zone " + zone);
        }
      }

      if (!errors.isEmpty()) {
        throw new ConfigInvalidException(errors);
      }
      TimingPolicy timing = new TimingPolicy(times, fetchIntervalHours, fetchAt, zoneId);
      return new PublisherConfig(channels, timing, ordering, refillOnEmpty);
    }
  }
}
