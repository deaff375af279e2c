package io.shortcast.spring.boot;

import io.shortcast.Shortcast;
import io.shortcast.config.PublisherConfig;
import io.shortcast.notify.LoggingNotificationTransport;
import io.shortcast.registry.DefaultPublisherRegistry;
import io.shortcast.registry.PublisherRegistry;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.DiscoveryClient;
import io.shortcast.spi.ItemQueue;
import io.shortcast.spi.MediaGenerator;
import io.shortcast.spi.MetricsExporter;
import io.shortcast.spi.NotificationTransport;
import io.shortcast.spi.StateStore;
import io.shortcast.store.InMemoryItemQueue;
import io.shortcast.store.InMemoryStateStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for shortcast.
 *
 * <p>Wires a {@link Shortcast} composite from {@link ShortcastProperties} and the
 * application's {@link DiscoveryClient}, {@link MediaGenerator} and {@link ChannelPublisher}
 * beans. Without a JDBC store (see {@link ShortcastJdbcStoreAutoConfiguration}) state is
 * kept in memory and lost on restart.
 *
 * @see ShortcastProperties
 * @see ShortcastMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Shortcast.class)
@ConditionalOnBean({DiscoveryClient.class, MediaGenerator.class})
@EnableConfigurationProperties(ShortcastProperties.class)
public class ShortcastAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(ShortcastAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public PublisherConfig publisherConfig(ShortcastProperties props) {
    return props.toPublisherConfig();
  }

  @Bean
  @ConditionalOnMissingBean(PublisherRegistry.class)
  public DefaultPublisherRegistry publisherRegistry(ObjectProvider<ChannelPublisher> publishers) {
    DefaultPublisherRegistry registry = new DefaultPublisherRegistry();
    publishers.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean(ItemQueue.class)
  public InMemoryItemQueue itemQueue() {
    log.warn("No DataSource for shortcast; queue and state are kept in memory only");
    return new InMemoryItemQueue();
  }

  @Bean
  @ConditionalOnMissingBean(StateStore.class)
  public InMemoryStateStore stateStore(ItemQueue itemQueue) {
    return itemQueue instanceof InMemoryItemQueue inMemory
        ? new InMemoryStateStore(inMemory)
        : new InMemoryStateStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public NotificationTransport notificationTransport() {
    return new LoggingNotificationTransport();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Shortcast shortcast(ShortcastProperties props,
      PublisherConfig publisherConfig,
      PublisherRegistry publisherRegistry,
      DiscoveryClient discovery,
      MediaGenerator generator,
      StateStore stateStore,
      ItemQueue itemQueue,
      NotificationTransport notificationTransport,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {

    var builder = Shortcast.builder()
        .config(publisherConfig)
        .publishers(publisherRegistry)
        .discovery(discovery)
        .generator(generator)
        .stateStore(stateStore)
        .queue(itemQueue)
        .notificationTransport(notificationTransport)
        .recipients(props.getNotification().getRecipients())
        .notificationQueueCapacity(props.getNotification().getQueueCapacity());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Clock clock = clockProvider.getIfAvailable();
    if (clock != null) {
      builder.clock(clock);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "shortcast.runner", name = "enabled", matchIfMissing = true)
  public ShortcastRunner shortcastRunner(Shortcast shortcast, ShortcastProperties props) {
    return new ShortcastRunner(shortcast, props.getRunner().isAwaitTermination());
  }
}
