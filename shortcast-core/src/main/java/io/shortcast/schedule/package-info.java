/**
 * Trigger computation and the job scheduler.
 */
package io.shortcast.schedule;
