package io.shortcast.spi;

import io.shortcast.config.PlatformKind;
import io.shortcast.model.ErrorKind;

/**
 * Observability hook for exporting shortcast counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of fetch workflows that ran to completion.
     *
     * @param itemsQueued number of items the discovery collaborator reported as queued
     */
    void incrementFetchRan(int itemsQueued);

    /**
     * Increments the count of fetch triggers skipped because of the cooldown.
     */
    void incrementFetchSkipped();

    /**
     * Increments the count of fetch workflows whose discovery collaborator failed.
     */
    void incrementFetchFailed();

    /**
     * Increments the count of publish cycles that ran the fan-out.
     */
    void incrementCycleCompleted();

    /**
     * Increments the count of publish cycles that found no eligible item.
     */
    void incrementCycleEmpty();

    /**
     * Increments the count of publish cycles aborted by a fatal error.
     */
    void incrementCycleAborted();

    /**
     * Increments the count of successful channel uploads.
     *
     * @param platformKind the channel's platform kind
     */
    void incrementChannelSuccess(PlatformKind platformKind);

    /**
     * Increments the count of failed channel attempts, including channels that were skipped.
     *
     * @param platformKind the channel's platform kind
     * @param errorKind    the failure classification
     */
    void incrementChannelFailure(PlatformKind platformKind, ErrorKind errorKind);

    /**
     * Increments the count of scheduler triggers dropped because a cycle was still in flight.
     */
    default void incrementTriggerDropped() {
    }

    /**
     * Increments the count of notifications dropped because the notification queue was full.
     */
    default void incrementNotificationDropped() {
    }

    /**
     * Records the number of items still waiting in the queue.
     *
     * @param depth queued item count
     */
    void recordQueueDepth(int depth);

    /**
     * Records the wall-clock duration of a publish cycle.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordCycleDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementFetchRan(int itemsQueued) {
        }

        @Override
        public void incrementFetchSkipped() {
        }

        @Override
        public void incrementFetchFailed() {
        }

        @Override
        public void incrementCycleCompleted() {
        }

        @Override
        public void incrementCycleEmpty() {
        }

        @Override
        public void incrementCycleAborted() {
        }

        @Override
        public void incrementChannelSuccess(PlatformKind platformKind) {
        }

        @Override
        public void incrementChannelFailure(PlatformKind platformKind, ErrorKind errorKind) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
