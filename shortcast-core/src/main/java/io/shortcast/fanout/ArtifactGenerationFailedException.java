package io.shortcast.fanout;

/**
 * The shared narration could not be generated. Fatal for the current cycle: no channel is
 * attempted and no state is written.
 */
public class ArtifactGenerationFailedException extends RuntimeException {

  public ArtifactGenerationFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
