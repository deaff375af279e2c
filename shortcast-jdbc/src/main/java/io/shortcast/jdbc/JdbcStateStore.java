package io.shortcast.jdbc;

import io.shortcast.jdbc.store.AbstractJdbcStateRepository;
import io.shortcast.jdbc.store.JdbcStateRepositories;
import io.shortcast.model.QueueItem;
import io.shortcast.model.SchedulerState;
import io.shortcast.spi.StateStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StateStore} persisted in the {@code shortcast_state} and {@code shortcast_consumed}
 * tables. {@link #markConsumed} also flips the item's row in {@code shortcast_queue}, in the
 * same transaction, so the consumed set and the queue never disagree.
 *
 * <pre>{@code
 * StateStore store = new JdbcStateStore(dataSource);
 * }</pre>
 *
 * @see JdbcItemQueue
 */
public final class JdbcStateStore implements StateStore {
  private static final Logger logger = Logger.getLogger(JdbcStateStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcStateRepository repository;

  /**
   * Creates a store on the given data source, detecting the SQL dialect from its JDBC URL.
   *
   * @param dataSource the data source
   */
  public JdbcStateStore(DataSource dataSource) {
    this(new DataSourceConnectionProvider(dataSource), JdbcStateRepositories.detect(dataSource));
  }

  public JdbcStateStore(ConnectionProvider connectionProvider, AbstractJdbcStateRepository repository) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.repository = Objects.requireNonNull(repository, "repository");
  }

  @Override
  public SchedulerState load() {
    try (Connection conn = connectionProvider.getConnection()) {
      Optional<Instant> lastFetch = repository.readLastFetchTime(conn);
      return new SchedulerState(lastFetch, new LinkedHashSet<>(repository.selectConsumedIds(conn)));
    } catch (SQLException e) {
      throw new StateStoreException("Failed to load scheduler state", e);
    }
  }

  @Override
  public void recordFetch(Instant fetchedAt) {
    Objects.requireNonNull(fetchedAt, "fetchedAt");
    try (Connection conn = connectionProvider.getConnection()) {
      repository.writeLastFetchTime(conn, fetchedAt);
    } catch (SQLException e) {
      throw new StateStoreException("Failed to record fetch time", e);
    }
  }

  @Override
  public void markConsumed(QueueItem item, Instant consumedAt) {
    Objects.requireNonNull(item, "item");
    Objects.requireNonNull(consumedAt, "consumedAt");
    try (JdbcTransaction tx = JdbcTransaction.begin(connectionProvider)) {
      boolean added = repository.insertConsumedIfAbsent(tx.connection(), item.id(), consumedAt);
      int flipped = repository.markItemConsumed(tx.connection(), item.id(), consumedAt);
      tx.commit();
      if (!added) {
        logger.log(Level.FINE, "Item {0} was already consumed", item.id());
      } else if (flipped == 0) {
        logger.log(Level.FINE, "Item {0} has no queued row to flip", item.id());
      }
    } catch (SQLException e) {
      throw new StateStoreException("Failed to mark item " + item.id() + " consumed", e);
    }
  }
}
