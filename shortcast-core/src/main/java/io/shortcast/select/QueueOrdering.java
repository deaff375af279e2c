package io.shortcast.select;

import io.shortcast.model.QueueItem;

import java.util.Comparator;
import java.util.Locale;

/**
 * Built-in ranking policies for choosing the next queued item.
 *
 * <p>Whatever the policy, {@link ItemSelector} breaks remaining ties on the item's insertion
 * {@link QueueItem#sequence()}.
 */
public enum QueueOrdering {
  /** Insertion order: the oldest queued item first. */
  FIFO(Comparator.comparingLong(QueueItem::sequence)),

  /** Highest score first, then the earliest created. */
  SCORE_DESC(Comparator.comparingInt(QueueItem::score).reversed()
      .thenComparing(QueueItem::createdAt));

  private final Comparator<QueueItem> comparator;

  QueueOrdering(Comparator<QueueItem> comparator) {
    this.comparator = comparator;
  }

  public Comparator<QueueItem> comparator() {
    return comparator;
  }

  /**
   * Resolves a configured ordering name ({@code fifo}, {@code score-desc} or {@code score_desc}).
   *
   * @param value the configured name
   * @return the ordering
   * @throws IllegalArgumentException if the name is unknown
   */
  public static QueueOrdering parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("ordering must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (QueueOrdering ordering : values()) {
      if (ordering.name().equals(normalized)) {
        return ordering;
      }
    }
    throw new IllegalArgumentException("Unknown queue ordering: " + value);
  }
}
