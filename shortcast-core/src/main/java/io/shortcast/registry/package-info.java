/**
 * Publisher registry: maps platform kinds to {@link io.shortcast.spi.ChannelPublisher}s.
 *
 * @see io.shortcast.registry.PublisherRegistry
 * @see io.shortcast.registry.DefaultPublisherRegistry
 */
package io.shortcast.registry;
