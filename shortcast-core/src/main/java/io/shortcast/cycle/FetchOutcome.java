package io.shortcast.cycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one {@link FetchCycle#run(boolean)}.
 *
 * <ul>
 *   <li>{@link Ran}: discovery completed and the fetch time was recorded.</li>
 *   <li>{@link Skipped}: the cooldown has not elapsed; nothing was called.</li>
 *   <li>{@link Failed}: discovery threw; the fetch time was not advanced.</li>
 * </ul>
 */
public sealed interface FetchOutcome permits FetchOutcome.Ran, FetchOutcome.Skipped, FetchOutcome.Failed {

    /**
     * @param itemsQueued number of items discovery reported as queued
     */
    record Ran(int itemsQueued) implements FetchOutcome {
    }

    /**
     * @param remaining time left until the cooldown elapses
     */
    record Skipped(Duration remaining) implements FetchOutcome {
        public Skipped {
            Objects.requireNonNull(remaining, "remaining");
        }
    }

    /**
     * @param cause the discovery failure
     */
    record Failed(Throwable cause) implements FetchOutcome {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
