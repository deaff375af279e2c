package io.shortcast.fanout;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.PlatformKind;
import io.shortcast.model.ChannelOutcome;
import io.shortcast.model.ErrorKind;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;
import io.shortcast.spi.ChannelPublishException;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.PublishResult;

import java.io.IOException;
import java.util.Objects;

/**
 * One enabled destination bound to the publisher of its platform kind.
 *
 * <p>{@link #publish} never throws: whatever the publisher returns or throws is captured as a
 * {@link ChannelOutcome}.
 */
public abstract sealed class Channel permits PrimaryChannel, SecondaryChannel {
  private final ChannelConfig config;
  private final ChannelPublisher publisher;

  Channel(ChannelConfig config, ChannelPublisher publisher) {
    this.config = Objects.requireNonNull(config, "config");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    if (publisher.platform() != config.platformKind()) {
      throw new IllegalArgumentException("Publisher for " + publisher.platform()
          + " cannot serve channel " + config.id() + " (" + config.platformKind() + ")");
    }
  }

  /**
   * Binds a channel configuration to its variant.
   *
   * @param config    the channel configuration
   * @param publisher publisher for the channel's platform kind
   * @return a {@link PrimaryChannel} or {@link SecondaryChannel}
   */
  public static Channel of(ChannelConfig config, ChannelPublisher publisher) {
    return switch (config.platformKind()) {
      case PRIMARY -> new PrimaryChannel(config, publisher);
      case SECONDARY -> new SecondaryChannel(config, publisher);
    };
  }

  public ChannelConfig config() {
    return config;
  }

  public String id() {
    return config.id();
  }

  public PlatformKind platformKind() {
    return config.platformKind();
  }

  ChannelPublisher publisher() {
    return publisher;
  }

  /**
   * Publishes the media and classifies the result.
   *
   * @param item  the item being published
   * @param media the video to upload
   * @return the channel outcome
   */
  public ChannelOutcome publish(QueueItem item, MediaRef media) {
    try {
      PublishResult result = publisher.publish(config, item, media);
      if (result instanceof PublishResult.Published published) {
        return ChannelOutcome.succeeded(id(), platformKind(), media, published.link());
      }
      if (result instanceof PublishResult.Rejected rejected) {
        return ChannelOutcome.failed(id(), platformKind(), rejected.errorKind(), media, rejected.message());
      }
      return ChannelOutcome.failed(id(), platformKind(), ErrorKind.UPLOAD, media, "publisher returned no result");
    } catch (ChannelPublishException e) {
      return ChannelOutcome.failed(id(), platformKind(), e.errorKind(), media, e.getMessage());
    } catch (IOException e) {
      return ChannelOutcome.failed(id(), platformKind(), ErrorKind.NETWORK, media, describe(e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ChannelOutcome.failed(id(), platformKind(), ErrorKind.UNKNOWN, media, "interrupted");
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable t) {
      // includes linkage errors from a publisher whose upload library is missing
      return ChannelOutcome.failed(id(), platformKind(), ErrorKind.UNKNOWN, media, describe(t));
    }
  }

  static String describe(Throwable t) {
    return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id() + "]";
  }
}
