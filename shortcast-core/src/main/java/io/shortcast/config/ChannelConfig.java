package io.shortcast.config;

import java.util.Objects;

/**
 * One configured publishing destination.
 *
 * @param id             unique channel identifier
 * @param platformKind   destination platform kind
 * @param enabled        whether the channel takes part in publish cycles
 * @param credentialRef  opaque reference resolved by the platform publisher (token file, cookie jar...)
 * @param mediaFolderRef opaque reference to the channel's background media assets (may be {@code null})
 */
public record ChannelConfig(
    String id,
    PlatformKind platformKind,
    boolean enabled,
    String credentialRef,
    String mediaFolderRef
) {
  public ChannelConfig {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(platformKind, "platformKind");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
  }

  public static ChannelConfig primary(String id, String credentialRef, String mediaFolderRef) {
    return new ChannelConfig(id, PlatformKind.PRIMARY, true, credentialRef, mediaFolderRef);
  }

  public static ChannelConfig secondary(String id, String credentialRef) {
    return new ChannelConfig(id, PlatformKind.SECONDARY, true, credentialRef, null);
  }

  public ChannelConfig disabled() {
    return new ChannelConfig(id, platformKind, false, credentialRef, mediaFolderRef);
  }
}
