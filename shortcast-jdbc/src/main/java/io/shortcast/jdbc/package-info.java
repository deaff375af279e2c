/**
 * Durable {@link io.shortcast.spi.StateStore} and {@link io.shortcast.spi.ItemQueue} on JDBC.
 *
 * <p>DDL for H2, MySQL and PostgreSQL ships under {@code schema/} on the classpath.
 *
 * @see io.shortcast.jdbc.JdbcStateStore
 * @see io.shortcast.jdbc.JdbcItemQueue
 * @see io.shortcast.jdbc.store.JdbcStateRepositories
 */
package io.shortcast.jdbc;
