/**
 * Fetch cooldown decision.
 */
package io.shortcast.cooldown;
