package io.shortcast.spi;

import io.shortcast.model.ErrorKind;

import java.util.Objects;

/**
 * Thrown by a {@link ChannelPublisher} to report a classified failure. Captured by the
 * fan-out as a failed channel outcome; never propagates past it.
 */
public class ChannelPublishException extends Exception {
    private final ErrorKind errorKind;

    public ChannelPublishException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    public ChannelPublishException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    public ErrorKind errorKind() {
        return errorKind;
    }
}
