package io.shortcast.model;

import io.shortcast.config.PlatformKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one channel's part in a publish cycle.
 *
 * <p>{@code attempted=false} means the channel was skipped without contacting the platform
 * (a secondary channel with no primary video to re-publish). A failed attempt always
 * carries an {@link ErrorKind}.
 *
 * @param channelId    the channel id
 * @param platformKind the channel's platform kind
 * @param attempted    whether a publish was attempted
 * @param success      whether the publish succeeded
 * @param errorKind    failure classification, empty on success
 * @param media        the artifact that was (or would have been) published
 * @param link         public link returned by the platform, when known
 * @param message      human-readable detail (error message or skip reason), may be {@code null}
 */
public record ChannelOutcome(
    String channelId,
    PlatformKind platformKind,
    boolean attempted,
    boolean success,
    Optional<ErrorKind> errorKind,
    Optional<MediaRef> media,
    Optional<String> link,
    String message
) {
  public ChannelOutcome {
    Objects.requireNonNull(channelId, "channelId");
    Objects.requireNonNull(platformKind, "platformKind");
    Objects.requireNonNull(errorKind, "errorKind");
    Objects.requireNonNull(media, "media");
    Objects.requireNonNull(link, "link");
    if (success && !attempted) {
      throw new IllegalArgumentException("an unattempted channel cannot succeed");
    }
    if (!success && errorKind.isEmpty()) {
      throw new IllegalArgumentException("a failed or skipped channel needs an errorKind");
    }
  }

  public static ChannelOutcome succeeded(String channelId, PlatformKind kind, MediaRef media, String link) {
    return new ChannelOutcome(channelId, kind, true, true, Optional.empty(),
        Optional.of(media), Optional.ofNullable(link), null);
  }

  public static ChannelOutcome failed(String channelId, PlatformKind kind, ErrorKind errorKind,
      MediaRef media, String message) {
    return new ChannelOutcome(channelId, kind, true, false, Optional.of(errorKind),
        Optional.ofNullable(media), Optional.empty(), message);
  }

  public static ChannelOutcome skipped(String channelId, PlatformKind kind, ErrorKind reason, String message) {
    return new ChannelOutcome(channelId, kind, false, false, Optional.of(reason),
        Optional.empty(), Optional.empty(), message);
  }
}
