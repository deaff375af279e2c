package io.shortcast.spi;

/**
 * External content discovery (scraping, ranking, filtering). Invoked by the fetch cycle
 * when the cooldown allows, and by a publish cycle that finds the queue empty.
 */
@FunctionalInterface
public interface DiscoveryClient {

    /**
     * Discovers new content and enqueues it.
     *
     * @param queue the queue to append discovered items to
     * @return the number of items enqueued
     * @throws Exception if discovery fails; the fetch is then treated as not having happened
     */
    int fetchAndQueueItems(ItemQueue queue) throws Exception;
}
