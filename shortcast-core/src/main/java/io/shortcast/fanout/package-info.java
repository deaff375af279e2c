/**
 * Fan-out of one item to every enabled channel, with artifact reuse from primary to
 * secondary channels and per-channel failure isolation.
 */
package io.shortcast.fanout;
