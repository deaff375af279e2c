/**
 * Service provider interfaces: discovery, media generation, channel publishing,
 * notification transport, state and queue storage, and metrics export.
 *
 * <p>Implementations of {@link io.shortcast.spi.StateStore} and
 * {@link io.shortcast.spi.ItemQueue} ship in this module (in-memory) and in
 * {@code shortcast-jdbc} (durable).
 */
package io.shortcast.spi;
