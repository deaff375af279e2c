package io.shortcast.fanout;

import io.shortcast.config.ChannelConfig;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.MediaGenerator;

/**
 * A primary-platform channel. Each one gets its own video variant, rendered on top of the
 * cycle's shared narration.
 */
public final class PrimaryChannel extends Channel {

  PrimaryChannel(ChannelConfig config, ChannelPublisher publisher) {
    super(config, publisher);
  }

  /**
   * Renders this channel's video variant.
   *
   * @param generator the media generator
   * @param item      the item being published
   * @param audio     the cycle's shared narration
   * @return the rendered video
   * @throws Exception whatever the generator throws
   */
  MediaRef renderVariant(MediaGenerator generator, QueueItem item, MediaRef audio) throws Exception {
    MediaRef video = generator.generateVideo(item, config(), audio);
    if (video == null) {
      throw new IllegalStateException("generator returned no video for " + id());
    }
    return video;
  }
}
