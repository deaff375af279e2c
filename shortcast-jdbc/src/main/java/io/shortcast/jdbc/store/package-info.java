/**
 * SQL dialects for the JDBC state store and item queue.
 *
 * <p>{@link io.shortcast.jdbc.store.AbstractJdbcStateRepository} provides portable SQL and
 * row mapping; subclasses supply database-specific idempotent writes: H2 ({@code MERGE}),
 * MySQL ({@code INSERT IGNORE}, {@code ON DUPLICATE KEY UPDATE}) and PostgreSQL
 * ({@code ON CONFLICT}).
 *
 * @see io.shortcast.jdbc.store.JdbcStateRepositories
 */
package io.shortcast.jdbc.store;
