/**
 * In-memory state store and item queue, for tests and ephemeral runs. Durable
 * implementations live in {@code shortcast-jdbc}.
 */
package io.shortcast.store;
