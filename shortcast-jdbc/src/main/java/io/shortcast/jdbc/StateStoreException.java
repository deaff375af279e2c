package io.shortcast.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised by {@link JdbcStateStore},
 * {@link JdbcItemQueue} and the {@link io.shortcast.jdbc.store.AbstractJdbcStateRepository}
 * dialects.
 */
public final class StateStoreException extends RuntimeException {
  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
