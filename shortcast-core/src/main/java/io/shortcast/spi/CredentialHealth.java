package io.shortcast.spi;

import java.util.Objects;

/**
 * Result of a publisher's credential inspection at startup.
 *
 * @param status the credential status
 * @param detail human-readable detail (expiry time, missing file...)
 */
public record CredentialHealth(Status status, String detail) {

    public enum Status {
        OK,
        /** Usable now but expiring without a way to refresh. */
        EXPIRING,
        EXPIRED,
        MISSING,
        UNKNOWN
    }

    public static final CredentialHealth UNKNOWN = new CredentialHealth(Status.UNKNOWN, "not inspected");

    public CredentialHealth {
        Objects.requireNonNull(status, "status");
    }

    /** Whether the status warrants an operator notification. */
    public boolean needsAttention() {
        return status == Status.EXPIRED || status == Status.MISSING;
    }
}
