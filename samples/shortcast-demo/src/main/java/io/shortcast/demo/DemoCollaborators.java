package io.shortcast.demo;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.PlatformKind;
import io.shortcast.model.ErrorKind;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;
import io.shortcast.spi.ChannelPublishException;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.CredentialHealth;
import io.shortcast.spi.DiscoveryClient;
import io.shortcast.spi.MediaGenerator;
import io.shortcast.spi.PublishResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in collaborators. Discovery invents a few stories, media generation only names
 * files, and the publishers log instead of uploading.
 */
@Configuration
public class DemoCollaborators {

  private static final Logger log = LoggerFactory.getLogger(DemoCollaborators.class);

  private static final List<String> HEADLINES = List.of(
      "Local bakery runs out of bread before noon",
      "City council votes to repaint every bench blue",
      "Stray cat elected honorary library mascot",
      "Marathon postponed after runners find better shortcut");

  @Bean
  public DiscoveryClient discoveryClient() {
    return queue -> {
      int queued = 0;
      for (String headline : HEADLINES) {
        QueueItem item = QueueItem.builder(headline)
            .body(headline + ". More at eleven.")
            .score(ThreadLocalRandom.current().nextInt(100))
            .metadata(Map.of("hashtags", "#news #shorts"))
            .createdAt(Instant.now())
            .build();
        if (queue.enqueue(item)) {
          queued++;
        }
      }
      log.info("[Discovery] queued {} stories", queued);
      return queued;
    };
  }

  @Bean
  public MediaGenerator mediaGenerator() {
    return new MediaGenerator() {
      @Override
      public MediaRef generateSharedAudio(QueueItem item) {
        log.info("[Media] narrating '{}'", item.title());
        return MediaRef.sharedAudio("build/media/" + item.id() + ".mp3");
      }

      @Override
      public MediaRef generateVideo(QueueItem item, ChannelConfig channel, MediaRef audio) {
        log.info("[Media] rendering {} for {} over {}", item.id(), channel.id(), audio.location());
        return MediaRef.video("build/media/" + item.id() + "-" + channel.id() + ".mp4", channel.id());
      }

      @Override
      public void discard(MediaRef media) {
        log.info("[Media] discarding {}", media.location());
      }
    };
  }

  @Bean
  public ChannelPublisher primaryPublisher() {
    return new LoggingPublisher(PlatformKind.PRIMARY, "https://youtube.example/shorts/");
  }

  @Bean
  public ChannelPublisher secondaryPublisher() {
    return new LoggingPublisher(PlatformKind.SECONDARY, "https://tiktok.example/@demo/video/");
  }

  static final class LoggingPublisher implements ChannelPublisher {
    private final PlatformKind platform;
    private final String linkPrefix;

    LoggingPublisher(PlatformKind platform, String linkPrefix) {
      this.platform = platform;
      this.linkPrefix = linkPrefix;
    }

    @Override
    public PlatformKind platform() {
      return platform;
    }

    @Override
    public PublishResult publish(ChannelConfig channel, QueueItem item, MediaRef media)
        throws ChannelPublishException {
      if (channel.credentialRef() == null) {
        throw new ChannelPublishException(ErrorKind.CREDENTIAL, "no credentials configured for " + channel.id());
      }
      log.info("[{}] uploading {} to {}", channel.id(), media.location(), platform.code());
      return PublishResult.published(linkPrefix + item.id());
    }

    @Override
    public CredentialHealth inspectCredentials(ChannelConfig channel) {
      return channel.credentialRef() == null
          ? new CredentialHealth(CredentialHealth.Status.MISSING, "no credential-ref set")
          : new CredentialHealth(CredentialHealth.Status.OK, channel.credentialRef());
    }
  }
}
