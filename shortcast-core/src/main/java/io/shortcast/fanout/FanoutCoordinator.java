package io.shortcast.fanout;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.ConfigInvalidException;
import io.shortcast.config.PublisherConfig;
import io.shortcast.model.ChannelOutcome;
import io.shortcast.model.ErrorKind;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;
import io.shortcast.notify.NotificationBridge;
import io.shortcast.notify.NotificationEvent;
import io.shortcast.registry.PublisherRegistry;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.MediaGenerator;
import io.shortcast.spi.MetricsExporter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the per-channel publish attempts for one selected item.
 *
 * <ol>
 *   <li>Generates the shared narration exactly once. Failure aborts the cycle with
 *       {@link ArtifactGenerationFailedException} before any channel is attempted.</li>
 *   <li>For each primary channel in configuration order, renders that channel's video and
 *       publishes it. The first video rendered successfully is retained.</li>
 *   <li>For each secondary channel in configuration order, publishes the retained video.
 *       Without one, the channel is skipped ({@code attempted=false}).</li>
 * </ol>
 *
 * <p>Channels are processed sequentially on the calling thread. A failing channel is
 * recorded as a failed {@link ChannelOutcome} and the remaining channels still run.
 * Generated artifacts are handed back to {@link MediaGenerator#discard} once every channel
 * has been processed.
 */
public final class FanoutCoordinator {
  private static final Logger logger = Logger.getLogger(FanoutCoordinator.class.getName());

  private final List<PrimaryChannel> primaries;
  private final List<SecondaryChannel> secondaries;
  private final MediaGenerator generator;
  private final NotificationBridge notifications;
  private final MetricsExporter metrics;
  private final Clock clock;

  private FanoutCoordinator(Builder builder) {
    this.generator = Objects.requireNonNull(builder.generator, "generator");
    Objects.requireNonNull(builder.channels, "channels");
    List<PrimaryChannel> primaries = new ArrayList<>();
    List<SecondaryChannel> secondaries = new ArrayList<>();
    for (Channel channel : builder.channels) {
      if (channel instanceof PrimaryChannel primary) {
        primaries.add(primary);
      } else if (channel instanceof SecondaryChannel secondary) {
        secondaries.add(secondary);
      }
    }
    this.primaries = List.copyOf(primaries);
    this.secondaries = List.copyOf(secondaries);
    this.notifications = builder.notifications;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Binds every enabled channel of the configuration to its publisher, in configuration order.
   *
   * @param config   the configuration
   * @param registry the publisher registry
   * @return the bound channels
   * @throws ConfigInvalidException if an enabled channel's platform kind has no publisher
   */
  public static List<Channel> bind(PublisherConfig config, PublisherRegistry registry) {
    List<Channel> channels = new ArrayList<>();
    List<String> problems = new ArrayList<>();
    for (ChannelConfig channel : config.channels()) {
      if (!channel.enabled()) {
        continue;
      }
      Optional<ChannelPublisher> publisher = registry.publisherFor(channel.platformKind());
      if (publisher.isEmpty()) {
        problems.add("no publisher registered for platform " + channel.platformKind().code()
            + " (channel " + channel.id() + ")");
        continue;
      }
      channels.add(Channel.of(channel, publisher.get()));
    }
    if (!problems.isEmpty()) {
      throw new ConfigInvalidException(problems);
    }
    return channels;
  }

  /** Number of channels taking part in each cycle. */
  public int channelCount() {
    return primaries.size() + secondaries.size();
  }

  /**
   * Publishes the item to every channel.
   *
   * @param item the selected item
   * @return one outcome per channel: primaries first, then secondaries, each in configuration order
   * @throws ArtifactGenerationFailedException if the shared narration cannot be generated
   */
  public List<ChannelOutcome> publish(QueueItem item) {
    Objects.requireNonNull(item, "item");
    int total = channelCount();
    if (total == 0) {
      logger.log(Level.WARNING, "No enabled channels configured, nothing to publish for {0}", item.id());
      return List.of();
    }

    logger.log(Level.INFO, "Pipeline stage 2/4: generating shared audio for {0}", item.id());
    MediaRef audio;
    try {
      audio = generator.generateSharedAudio(item);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new ArtifactGenerationFailedException(
          "Shared audio generation failed for item " + item.id() + ": " + Channel.describe(e), e);
    }
    if (audio == null) {
      throw new ArtifactGenerationFailedException(
          "Shared audio generation returned nothing for item " + item.id(), null);
    }

    List<MediaRef> generated = new ArrayList<>();
    generated.add(audio);
    List<ChannelOutcome> outcomes = new ArrayList<>(total);
    try {
      logger.log(Level.INFO, "Pipeline stage 3/4: publishing to {0} channel(s)", total);
      MediaRef firstVideo = null;
      int position = 0;
      for (PrimaryChannel channel : primaries) {
        position++;
        logger.log(Level.INFO, "Channel {0}/{1} [{2}]: rendering video",
            new Object[]{position, total, channel.id()});
        MediaRef video;
        try {
          video = channel.renderVariant(generator, item, audio);
        } catch (VirtualMachineError e) {
          throw e;
        } catch (Throwable t) {
          if (t instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          record(item, ChannelOutcome.failed(channel.id(), channel.platformKind(),
              ErrorKind.GENERATION, null, Channel.describe(t)), outcomes, t);
          continue;
        }
        generated.add(video);
        if (firstVideo == null) {
          firstVideo = video;
        }
        record(item, channel.publish(item, video), outcomes, null);
      }

      for (SecondaryChannel channel : secondaries) {
        position++;
        if (firstVideo == null) {
          logger.log(Level.WARNING, "Channel {0}/{1} [{2}]: no primary video to re-publish, skipping",
              new Object[]{position, total, channel.id()});
          record(item, channel.skipWithoutSource(), outcomes, null);
          continue;
        }
        logger.log(Level.INFO, "Channel {0}/{1} [{2}]: re-publishing {3}",
            new Object[]{position, total, channel.id(), firstVideo.location()});
        record(item, channel.publish(item, firstVideo), outcomes, null);
      }
    } finally {
      discardAll(generated);
    }
    return outcomes;
  }

  private void record(QueueItem item, ChannelOutcome outcome, List<ChannelOutcome> outcomes, Throwable cause) {
    outcomes.add(outcome);
    if (outcome.success()) {
      recordMetric(() -> metrics.incrementChannelSuccess(outcome.platformKind()));
      logger.log(Level.INFO, "Channel [{0}] published {1}{2}", new Object[]{
          outcome.channelId(), item.id(), outcome.link().map(link -> " at " + link).orElse("")});
      emit(new NotificationEvent.ChannelUploadSucceeded(outcome.channelId(), outcome.platformKind(),
          item.id(), item.title(), outcome.link().orElse(null), clock.instant()));
      return;
    }
    ErrorKind errorKind = outcome.errorKind().orElse(ErrorKind.UNKNOWN);
    recordMetric(() -> metrics.incrementChannelFailure(outcome.platformKind(), errorKind));
    if (cause != null) {
      logger.log(Level.WARNING, "Channel [" + outcome.channelId() + "] failed (" + errorKind + ")", cause);
    } else if (outcome.attempted()) {
      logger.log(Level.WARNING, "Channel [{0}] failed ({1}): {2}",
          new Object[]{outcome.channelId(), errorKind, outcome.message()});
    }
    emit(new NotificationEvent.ChannelUploadFailed(outcome.channelId(), outcome.platformKind(),
        item.id(), item.title(), errorKind, outcome.message(), clock.instant()));
  }

  private static void recordMetric(Runnable update) {
    try {
      update.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics exporter failed", e);
    }
  }

  private void emit(NotificationEvent event) {
    if (notifications != null) {
      notifications.notify(event);
    }
  }

  private void discardAll(List<MediaRef> generated) {
    for (MediaRef media : generated) {
      try {
        generator.discard(media);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to discard generated media " + media.location(), e);
      }
    }
  }

  /** Builder for {@link FanoutCoordinator}. */
  public static final class Builder {
    private List<Channel> channels;
    private MediaGenerator generator;
    private NotificationBridge notifications;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the channels, in configuration order. See {@link FanoutCoordinator#bind}.
     *
     * <p><b>Required.</b>
     *
     * @param channels the bound channels
     * @return this builder
     */
    public Builder channels(List<Channel> channels) {
      this.channels = channels;
      return this;
    }

    /**
     * Sets the media generator.
     *
     * <p><b>Required.</b>
     *
     * @param generator the media generator
     * @return this builder
     */
    public Builder generator(MediaGenerator generator) {
      this.generator = generator;
      return this;
    }

    /**
     * Sets the bridge that receives per-channel notifications.
     *
     * <p>Optional. Without one no notifications are emitted.
     *
     * @param notifications the notification bridge
     * @return this builder
     */
    public Builder notifications(NotificationBridge notifications) {
      this.notifications = notifications;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public FanoutCoordinator build() {
      return new FanoutCoordinator(this);
    }
  }
}
