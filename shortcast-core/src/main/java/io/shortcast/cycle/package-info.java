/**
 * The two workflows the scheduler triggers: {@link io.shortcast.cycle.FetchCycle} and
 * {@link io.shortcast.cycle.PublishCycle}.
 */
package io.shortcast.cycle;
