/**
 * Recurring content-publishing orchestrator.
 *
 * <p>{@link io.shortcast.Shortcast} is the entry point. It periodically fetches content
 * items, generates media for one item at a time, and fans the result out to primary and
 * secondary channels. An item is marked consumed once at least one channel published it.
 *
 * @see io.shortcast.config.PublisherConfig
 * @see io.shortcast.spi
 */
package io.shortcast;
