/**
 * Operator notifications: event types, the asynchronous bridge and the logging transport.
 */
package io.shortcast.notify;
