package io.shortcast.jdbc;

import io.shortcast.jdbc.store.AbstractJdbcStateRepository;
import io.shortcast.model.ItemStatus;
import io.shortcast.model.QueueItem;
import io.shortcast.model.SchedulerState;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour shared by every dialect. Subclasses provide a DataSource with the schema applied
 * and empty tables before each test.
 */
abstract class AbstractJdbcStoreTest {
  static final Instant CREATED = Instant.parse("2024-03-01T08:00:00Z");

  abstract DataSource dataSource();

  abstract AbstractJdbcStateRepository repository();

  JdbcStateStore stateStore() {
    return new JdbcStateStore(new DataSourceConnectionProvider(dataSource()), repository());
  }

  JdbcItemQueue queue() {
    return new JdbcItemQueue(new DataSourceConnectionProvider(dataSource()), repository());
  }

  static QueueItem item(String id, int score) {
    return QueueItem.builder("Story " + id)
        .id(id)
        .body("body of " + id)
        .score(score)
        .createdAt(CREATED)
        .build();
  }

  // ── State ──────────────────────────────────────────────────────

  @Test
  void emptyDatabaseLoadsInitialState() {
    SchedulerState state = stateStore().load();

    assertEquals(Optional.empty(), state.lastFetchTime());
    assertTrue(state.consumedItemIds().isEmpty());
  }

  @Test
  void recordFetchOverwritesPreviousValue() {
    JdbcStateStore store = stateStore();
    store.recordFetch(Instant.parse("2024-05-01T09:00:00Z"));
    store.recordFetch(Instant.parse("2024-05-02T09:00:00Z"));

    assertEquals(Optional.of(Instant.parse("2024-05-02T09:00:00Z")), stateStore().load().lastFetchTime());
  }

  @Test
  void markConsumedFlipsQueueRowAndIsIdempotent() throws Exception {
    JdbcItemQueue queue = queue();
    JdbcStateStore store = stateStore();
    QueueItem a = item("A", 5);
    queue.enqueue(a);
    queue.enqueue(item("B", 1));

    store.markConsumed(a, Instant.parse("2024-05-01T09:05:00Z"));
    store.markConsumed(a, Instant.parse("2024-05-01T13:05:00Z"));

    assertEquals(Set.of("A"), stateStore().load().consumedItemIds());
    assertEquals(1, queue.countQueued());
    assertEquals(ItemStatus.CONSUMED, queue.snapshot().get(0).status());
    try (Connection conn = dataSource().getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "SELECT consumed_at FROM shortcast_consumed WHERE item_id = ?")) {
      ps.setString(1, "A");
      try (ResultSet rs = ps.executeQuery()) {
        assertTrue(rs.next());
        assertEquals(Instant.parse("2024-05-01T09:05:00Z"), rs.getTimestamp("consumed_at").toInstant());
      }
    }
  }

  @Test
  void markConsumedWithoutQueueRowStillRecordsId() {
    stateStore().markConsumed(item("ghost", 0), Instant.parse("2024-05-01T09:05:00Z"));

    assertTrue(stateStore().load().isConsumed("ghost"));
  }

  // ── Queue ──────────────────────────────────────────────────────

  @Test
  void enqueueAssignsIncreasingSequence() {
    JdbcItemQueue queue = queue();

    assertTrue(queue.enqueue(item("A", 1)));
    assertTrue(queue.enqueue(item("B", 9)));

    List<QueueItem> items = queue.snapshot();
    assertEquals(List.of("A", "B"), items.stream().map(QueueItem::id).toList());
    assertEquals(1L, items.get(0).sequence());
    assertEquals(2L, items.get(1).sequence());
    assertEquals(9, items.get(1).score());
    assertEquals(CREATED, items.get(1).createdAt());
  }

  @Test
  void duplicateIdIsRejected() {
    JdbcItemQueue queue = queue();
    queue.enqueue(item("A", 1));

    assertFalse(queue.enqueue(item("A", 7)));
    assertEquals(1, queue.snapshot().size());
    assertEquals(1, queue.snapshot().get(0).score());
  }

  @Test
  void metadataSurvivesStorage() {
    JdbcItemQueue queue = queue();
    queue.enqueue(QueueItem.builder("Tagged")
        .id("T")
        .metadata(Map.of("hashtags", "#one \"two\"", "lang", "ro"))
        .createdAt(CREATED)
        .build());

    QueueItem stored = queue.snapshot().get(0);
    assertEquals("#one \"two\"", stored.metadata().get("hashtags"));
    assertEquals("ro", stored.metadata().get("lang"));
    assertEquals("", stored.body());
  }

  @Test
  void consumedItemCannotBeQueuedAgain() {
    JdbcItemQueue queue = queue();
    QueueItem a = item("A", 1);
    queue.enqueue(a);
    stateStore().markConsumed(a, Instant.parse("2024-05-01T09:05:00Z"));

    assertFalse(queue.enqueue(item("A", 1)));
    assertEquals(0, queue.countQueued());
  }
}
