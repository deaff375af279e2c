/**
 * Next-item selection over a queue snapshot.
 */
package io.shortcast.select;
