package io.shortcast.jdbc;

import io.shortcast.jdbc.store.AbstractJdbcStateRepository;
import io.shortcast.jdbc.store.JdbcStateRepositories;
import io.shortcast.model.QueueItem;
import io.shortcast.spi.ItemQueue;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * {@link ItemQueue} persisted in the {@code shortcast_queue} table. Each enqueue assigns the
 * next insertion sequence inside one transaction; a duplicate id leaves the table untouched.
 *
 * <p>Writes assume a single writer, which holds because only the running cycle enqueues.
 */
public final class JdbcItemQueue implements ItemQueue {
  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcStateRepository repository;

  public JdbcItemQueue(DataSource dataSource) {
    this(new DataSourceConnectionProvider(dataSource), JdbcStateRepositories.detect(dataSource));
  }

  public JdbcItemQueue(ConnectionProvider connectionProvider, AbstractJdbcStateRepository repository) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.repository = Objects.requireNonNull(repository, "repository");
  }

  @Override
  public boolean enqueue(QueueItem item) {
    Objects.requireNonNull(item, "item");
    try (JdbcTransaction tx = JdbcTransaction.begin(connectionProvider)) {
      long sequence = repository.nextSequence(tx.connection());
      boolean inserted = repository.insertItemIfAbsent(tx.connection(), item, sequence);
      tx.commit();
      return inserted;
    } catch (SQLException e) {
      throw new StateStoreException("Failed to enqueue item " + item.id(), e);
    }
  }

  @Override
  public List<QueueItem> snapshot() {
    try (Connection conn = connectionProvider.getConnection()) {
      return List.copyOf(repository.selectItems(conn));
    } catch (SQLException e) {
      throw new StateStoreException("Failed to read item queue", e);
    }
  }

  @Override
  public int countQueued() {
    try (Connection conn = connectionProvider.getConnection()) {
      return repository.countQueued(conn);
    } catch (SQLException e) {
      throw new StateStoreException("Failed to count queued items", e);
    }
  }
}
