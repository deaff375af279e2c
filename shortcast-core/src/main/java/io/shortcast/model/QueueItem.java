package io.shortcast.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable content item waiting in the publish queue.
 *
 * <p>Items are produced by a {@link io.shortcast.spi.DiscoveryClient} and become
 * {@link ItemStatus#CONSUMED} only through {@link io.shortcast.spi.StateStore#markConsumed}.
 * Each item is assigned a ULID-based {@code id} unless the discovery collaborator sets one.
 * The {@code sequence} is the insertion rank assigned by the {@link io.shortcast.spi.ItemQueue}
 * and breaks ordering ties.
 */
public final class QueueItem {
    public static final int MAX_TITLE_LENGTH = 300;

    private final String id;
    private final String title;
    private final String body;
    private final int score;
    private final Map<String, String> metadata;
    private final Instant createdAt;
    private final long sequence;
    private final ItemStatus status;

    private QueueItem(Builder builder) {
        this.id = builder.id == null ? UlidCreator.getMonotonicUlid().toString() : builder.id;
        if (this.id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        this.title = Objects.requireNonNull(builder.title, "title");
        if (this.title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        this.body = builder.body == null ? "" : builder.body;
        this.score = builder.score;
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
        this.sequence = builder.sequence;
        this.status = builder.status == null ? ItemStatus.QUEUED : builder.status;

        Map<String, String> metadataCopy = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (metadataCopy.containsKey(null) || metadataCopy.containsValue(null)) {
            throw new IllegalArgumentException("metadata cannot contain null keys or values");
        }
        this.metadata = metadataCopy;
    }

    /**
     * Creates a builder for an item with the given title.
     *
     * @param title the item title
     * @return a new builder
     */
    public static Builder builder(String title) {
        return new Builder(title);
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String body() {
        return body;
    }

    /** Ranking score assigned by the discovery collaborator; higher ranks first under score ordering. */
    public int score() {
        return score;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public long sequence() {
        return sequence;
    }

    public ItemStatus status() {
        return status;
    }

    public boolean isQueued() {
        return status == ItemStatus.QUEUED;
    }

    /**
     * Returns a copy carrying the given insertion rank.
     *
     * @param sequence the rank assigned by the queue
     * @return the copy
     */
    public QueueItem withSequence(long sequence) {
        return toBuilder().sequence(sequence).build();
    }

    /**
     * Returns a copy with the given status.
     *
     * @param status the new status
     * @return the copy
     */
    public QueueItem withStatus(ItemStatus status) {
        return toBuilder().status(status).build();
    }

    private Builder toBuilder() {
        return new Builder(title)
                .id(id)
                .body(body)
                .score(score)
                .metadata(metadata)
                .createdAt(createdAt)
                .sequence(sequence)
                .status(status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueueItem other)) return false;
        return id.equals(other.id) && status == other.status && sequence == other.sequence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, sequence);
    }

    @Override
    public String toString() {
        return "QueueItem{id=" + id
                + ", title=" + (title.length() > 80 ? title.substring(0, 80) : title)
                + ", score=" + score
                + ", sequence=" + sequence
                + ", status=" + status + '}';
    }

    /**
     * Builder for {@link QueueItem}.
     */
    public static final class Builder {
        private String id;
        private final String title;
        private String body;
        private int score;
        private Map<String, String> metadata;
        private Instant createdAt;
        private long sequence;
        private ItemStatus status;

        private Builder(String title) {
            this.title = title;
        }

        /**
         * Sets the item id. Optional, defaults to a new ULID.
         *
         * @param id the item id
         * @return this builder
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder score(int score) {
            this.score = score;
            return this;
        }

        /**
         * Sets free-form metadata (descriptions, hashtags...) forwarded to publishers.
         *
         * @param metadata the metadata map; keys and values must not be null
         * @return this builder
         */
        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Sets the creation time. Optional, defaults to {@link Instant#now()}.
         *
         * @param createdAt the creation time
         * @return this builder
         */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder status(ItemStatus status) {
            this.status = status;
            return this;
        }

        public QueueItem build() {
            return new QueueItem(this);
        }
    }
}
