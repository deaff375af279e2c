package io.shortcast.config;

import java.util.List;

/**
 * Thrown when the configuration document fails validation. Carries every problem found,
 * not just the first one. Terminal for the process at startup.
 */
public final class ConfigInvalidException extends RuntimeException {
  private final List<String> problems;

  public ConfigInvalidException(List<String> problems) {
    super("Invalid shortcast configuration: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> problems() {
    return problems;
  }
}
