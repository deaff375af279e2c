package io.shortcast.config;

import java.util.Locale;

/**
 * Destination platform kinds. A {@link #SECONDARY} channel never triggers its own media
 * generation; it re-publishes the first video generated for a {@link #PRIMARY} channel.
 */
public enum PlatformKind {
  PRIMARY("primary", "youtube"),
  SECONDARY("secondary", "tiktok");

  private final String code;
  private final String alias;

  PlatformKind(String code, String alias) {
    this.code = code;
    this.alias = alias;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a configured platform string. Matching is case-insensitive and ignores
   * surrounding whitespace; both the canonical code and the platform alias are accepted.
   *
   * @param value the configured platform
   * @return the platform kind
   * @throws IllegalArgumentException if the value matches no platform kind
   */
  public static PlatformKind parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("platform must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (PlatformKind kind : values()) {
      if (kind.code.equals(normalized) || kind.alias.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown platform: " + value);
  }
}
