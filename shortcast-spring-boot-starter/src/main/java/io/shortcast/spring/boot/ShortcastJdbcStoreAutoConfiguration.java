package io.shortcast.spring.boot;

import io.shortcast.jdbc.ConnectionProvider;
import io.shortcast.jdbc.DataSourceConnectionProvider;
import io.shortcast.jdbc.JdbcItemQueue;
import io.shortcast.jdbc.JdbcStateStore;
import io.shortcast.jdbc.store.AbstractJdbcStateRepository;
import io.shortcast.jdbc.store.JdbcStateRepositories;
import io.shortcast.spi.ItemQueue;
import io.shortcast.spi.StateStore;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Durable state store and item queue on the application's {@link DataSource}.
 *
 * <p>Active when a DataSource exists and {@code shortcast.store.type} is {@code jdbc}
 * (the default). The SQL dialect is detected from the JDBC URL. Runs before
 * {@link ShortcastAutoConfiguration}, whose in-memory fallbacks back off once these
 * beans exist.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class, before = ShortcastAutoConfiguration.class)
@ConditionalOnClass(JdbcStateStore.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "shortcast.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
@EnableConfigurationProperties(ShortcastProperties.class)
public class ShortcastJdbcStoreAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcStateRepository stateRepository(DataSource dataSource, ShortcastProperties props) {
    AbstractJdbcStateRepository detected = JdbcStateRepositories.detect(dataSource);
    ShortcastProperties.Store store = props.getStore();
    if (store.hasDefaultTables()) {
      return detected;
    }
    return detected.withTables(store.getStateTable(), store.getConsumedTable(), store.getQueueTable());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider shortcastConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(StateStore.class)
  public JdbcStateStore stateStore(ConnectionProvider connectionProvider, AbstractJdbcStateRepository repository) {
    return new JdbcStateStore(connectionProvider, repository);
  }

  @Bean
  @ConditionalOnMissingBean(ItemQueue.class)
  public JdbcItemQueue itemQueue(ConnectionProvider connectionProvider, AbstractJdbcStateRepository repository) {
    return new JdbcItemQueue(connectionProvider, repository);
  }
}
