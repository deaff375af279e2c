package io.shortcast;

import java.util.Locale;

/**
 * Invocation modes of the orchestrator.
 */
public enum RunMode {
  /** Keep running and publish at every configured publish time. */
  CONTINUOUS("continuous"),
  /** Run one fetch cycle and exit. */
  FETCH_ONLY("fetch-only"),
  /** Run one fetch cycle, then one publish cycle, and exit. */
  RUN_ONCE("run-once");

  private final String code;

  RunMode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a mode from its command-line form. {@code null} or blank selects
   * {@link #CONTINUOUS}; underscores are accepted in place of dashes.
   *
   * @param value the command-line value
   * @return the mode
   * @throws IllegalArgumentException if the value names no mode
   */
  public static RunMode parse(String value) {
    if (value == null || value.isBlank()) {
      return CONTINUOUS;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (RunMode mode : values()) {
      if (mode.code.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown mode: " + value + " (expected continuous, fetch-only or run-once)");
  }
}
