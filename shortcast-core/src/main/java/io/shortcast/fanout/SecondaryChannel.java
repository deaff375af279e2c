package io.shortcast.fanout;

import io.shortcast.config.ChannelConfig;
import io.shortcast.model.ChannelOutcome;
import io.shortcast.model.ErrorKind;
import io.shortcast.spi.ChannelPublisher;

/**
 * A secondary-platform channel. Never triggers generation; it re-publishes the first video
 * rendered for a primary channel in the same cycle.
 */
public final class SecondaryChannel extends Channel {

  SecondaryChannel(ChannelConfig config, ChannelPublisher publisher) {
    super(config, publisher);
  }

  /** Outcome recorded when no primary video exists to re-publish. */
  ChannelOutcome skipWithoutSource() {
    return ChannelOutcome.skipped(id(), platformKind(), ErrorKind.NO_SOURCE_VIDEO,
        "no primary video was generated in this cycle");
  }
}
