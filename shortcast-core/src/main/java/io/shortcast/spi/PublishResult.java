package io.shortcast.spi;

import io.shortcast.model.ErrorKind;

import java.util.Objects;

/**
 * Result returned by {@link ChannelPublisher#publish}.
 *
 * <ul>
 *   <li>{@link Published}: the platform accepted the upload.</li>
 *   <li>{@link Rejected}: the upload did not go through; the channel is recorded as failed.</li>
 * </ul>
 */
public sealed interface PublishResult permits PublishResult.Published, PublishResult.Rejected {

    static Published published(String link) {
        return new Published(link);
    }

    static Rejected rejected(ErrorKind errorKind, String message) {
        return new Rejected(errorKind, message);
    }

    /**
     * Upload accepted.
     *
     * @param link public link to the post, or {@code null} if the platform did not return one
     */
    record Published(String link) implements PublishResult {
    }

    /**
     * Upload not accepted.
     *
     * @param errorKind failure classification
     * @param message   detail for logs and notifications
     */
    record Rejected(ErrorKind errorKind, String message) implements PublishResult {
        public Rejected {
            Objects.requireNonNull(errorKind, "errorKind");
        }
    }
}
