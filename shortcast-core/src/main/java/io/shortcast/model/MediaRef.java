package io.shortcast.model;

import java.util.Objects;

/**
 * Identity of a generated media artifact. Artifacts live only for the duration of one
 * publish cycle and are never persisted by the orchestrator.
 *
 * @param kind        artifact kind
 * @param location    collaborator-defined location (file path, object key...)
 * @param producedFor id of the channel the artifact was generated for, or {@code null} for shared artifacts
 */
public record MediaRef(Kind kind, String location, String producedFor) {

  public enum Kind {
    AUDIO,
    VIDEO
  }

  public MediaRef {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(location, "location");
  }

  public static MediaRef sharedAudio(String location) {
    return new MediaRef(Kind.AUDIO, location, null);
  }

  public static MediaRef video(String location, String channelId) {
    return new MediaRef(Kind.VIDEO, location, channelId);
  }
}
