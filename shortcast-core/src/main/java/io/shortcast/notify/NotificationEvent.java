package io.shortcast.notify;

import io.shortcast.config.PlatformKind;
import io.shortcast.model.ErrorKind;
import io.shortcast.spi.CredentialHealth;

import java.time.Instant;
import java.util.Objects;

/**
 * Operator-facing events emitted by the orchestrator.
 *
 * <ul>
 *   <li>{@link ChannelUploadSucceeded}: one channel published the item.</li>
 *   <li>{@link ChannelUploadFailed}: one channel failed or was skipped.</li>
 *   <li>{@link FatalPipelineError}: a fetch or publish cycle was aborted.</li>
 *   <li>{@link CredentialWarning}: a channel's credentials need operator attention.</li>
 * </ul>
 */
public sealed interface NotificationEvent permits NotificationEvent.ChannelUploadSucceeded,
    NotificationEvent.ChannelUploadFailed, NotificationEvent.FatalPipelineError,
    NotificationEvent.CredentialWarning {

  /** When the event occurred. */
  Instant occurredAt();

  /** One-line subject suitable for an e-mail or chat message. */
  String subject();

  record ChannelUploadSucceeded(String channelId, PlatformKind platformKind, String itemId,
      String itemTitle, String link, Instant occurredAt) implements NotificationEvent {
    public ChannelUploadSucceeded {
      Objects.requireNonNull(channelId, "channelId");
      Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public String subject() {
      return "Upload succeeded on " + channelId + ": " + itemTitle;
    }
  }

  record ChannelUploadFailed(String channelId, PlatformKind platformKind, String itemId,
      String itemTitle, ErrorKind errorKind, String message, Instant occurredAt) implements NotificationEvent {
    public ChannelUploadFailed {
      Objects.requireNonNull(channelId, "channelId");
      Objects.requireNonNull(errorKind, "errorKind");
      Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public String subject() {
      return "Upload failed on " + channelId + " (" + errorKind + ")";
    }
  }

  /**
   * @param context where the error happened ({@code fetch} or {@code publish})
   * @param itemId  the item being processed, {@code null} if none was selected yet
   * @param message error detail
   */
  record FatalPipelineError(String context, String itemId, String message,
      Instant occurredAt) implements NotificationEvent {
    public FatalPipelineError {
      Objects.requireNonNull(context, "context");
      Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public String subject() {
      return "Pipeline error during " + context;
    }
  }

  record CredentialWarning(String channelId, CredentialHealth health,
      Instant occurredAt) implements NotificationEvent {
    public CredentialWarning {
      Objects.requireNonNull(channelId, "channelId");
      Objects.requireNonNull(health, "health");
      Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public String subject() {
      return "Credentials " + health.status() + " for " + channelId;
    }
  }
}
