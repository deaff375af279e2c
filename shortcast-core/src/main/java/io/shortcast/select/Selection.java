package io.shortcast.select;

import io.shortcast.model.QueueItem;

import java.util.Objects;

/**
 * Result of {@link ItemSelector#selectNext}.
 *
 * <ul>
 *   <li>{@link Selected}: an eligible item was found.</li>
 *   <li>{@link NoItemAvailable}: the queue holds no queued, unconsumed item.</li>
 * </ul>
 */
public sealed interface Selection permits Selection.Selected, Selection.NoItemAvailable {

  NoItemAvailable NONE = new NoItemAvailable();

  static Selection of(QueueItem item) {
    return item == null ? NONE : new Selected(item);
  }

  /**
   * @param item the selected item
   */
  record Selected(QueueItem item) implements Selection {
    public Selected {
      Objects.requireNonNull(item, "item");
    }
  }

  record NoItemAvailable() implements Selection {
  }
}
