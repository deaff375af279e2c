package io.shortcast.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A connection with auto-commit disabled. Use with try-with-resources; if neither
 * {@link #commit()} nor {@link #rollback()} is called, {@link #close()} rolls back.
 *
 * <pre>{@code
 * try (JdbcTransaction tx = JdbcTransaction.begin(connectionProvider)) {
 *     repository.insertConsumed(tx.connection(), itemId, now);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransaction implements AutoCloseable {
  private final Connection connection;
  private boolean completed;

  private JdbcTransaction(Connection connection) {
    this.connection = connection;
  }

  /**
   * Obtains a connection and disables auto-commit on it.
   *
   * @param connectionProvider the connection source
   * @return a new transaction handle
   * @throws SQLException if a connection cannot be obtained or configured
   */
  public static JdbcTransaction begin(ConnectionProvider connectionProvider) throws SQLException {
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new JdbcTransaction(connection);
  }

  public Connection connection() {
    return connection;
  }

  public void commit() throws SQLException {
    if (completed) {
      return;
    }
    try {
      connection.commit();
    } catch (SQLException e) {
      safeRollback(e);
      throw e;
    } finally {
      finish();
    }
  }

  public void rollback() throws SQLException {
    if (completed) {
      return;
    }
    try {
      connection.rollback();
    } finally {
      finish();
    }
  }

  @Override
  public void close() throws SQLException {
    if (!completed) {
      rollback();
    }
  }

  private void finish() throws SQLException {
    completed = true;
    try {
      connection.setAutoCommit(true);
    } finally {
      connection.close();
    }
  }

  private void safeRollback(SQLException failure) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }
}
