/**
 * Small internal helpers: thread factory, duration formatting and the metadata codec.
 */
package io.shortcast.util;
