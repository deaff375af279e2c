package io.shortcast.jdbc.store;

import io.shortcast.jdbc.JdbcTemplate;
import io.shortcast.jdbc.TableNames;
import io.shortcast.model.ItemStatus;
import io.shortcast.model.QueueItem;
import io.shortcast.util.MetadataCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC repository for scheduler state, the consumed set and the item queue, with
 * portable SQL implementations.
 *
 * <p>Subclasses override {@link #upsertState} and the {@code insert...IfAbsent} methods with
 * database-specific statements. Register custom implementations via
 * {@code META-INF/services/io.shortcast.jdbc.store.AbstractJdbcStateRepository}.
 *
 * <p>All methods run on the caller's connection and never commit; transaction boundaries
 * belong to {@link io.shortcast.jdbc.JdbcStateStore} and {@link io.shortcast.jdbc.JdbcItemQueue}.
 *
 * @see JdbcStateRepositories
 */
public abstract class AbstractJdbcStateRepository {
  public static final String LAST_FETCH_TIME_KEY = "last_fetch_time";

  protected static final JdbcTemplate.RowMapper<QueueItem> ITEM_ROW_MAPPER = rs -> QueueItem.builder(rs.getString("title"))
      .id(rs.getString("item_id"))
      .body(rs.getString("body"))
      .score(rs.getInt("score"))
      .metadata(MetadataCodec.decode(rs.getString("metadata")))
      .createdAt(rs.getTimestamp("created_at").toInstant())
      .sequence(rs.getLong("seq"))
      .status(ItemStatus.fromCode(rs.getInt("status")))
      .build();

  private final String stateTable;
  private final String consumedTable;
  private final String queueTable;

  protected AbstractJdbcStateRepository() {
    this(TableNames.DEFAULT_STATE_TABLE, TableNames.DEFAULT_CONSUMED_TABLE, TableNames.DEFAULT_QUEUE_TABLE);
  }

  protected AbstractJdbcStateRepository(String stateTable, String consumedTable, String queueTable) {
    this.stateTable = TableNames.validate(stateTable);
    this.consumedTable = TableNames.validate(consumedTable);
    this.queueTable = TableNames.validate(queueTable);
  }

  /**
   * Unique identifier for this repository (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this repository handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a repository of the same dialect bound to other table names.
   *
   * @param stateTable    key/value state table
   * @param consumedTable consumed item table
   * @param queueTable    item queue table
   * @return the new repository
   */
  public abstract AbstractJdbcStateRepository withTables(String stateTable, String consumedTable, String queueTable);

  protected String stateTable() {
    return stateTable;
  }

  protected String consumedTable() {
    return consumedTable;
  }

  protected String queueTable() {
    return queueTable;
  }

  // ── State ──────────────────────────────────────────────────────

  public Optional<String> readState(Connection conn, String key) {
    return JdbcTemplate.queryOne(conn,
        "SELECT state_value FROM " + stateTable() + " WHERE state_key=?",
        rs -> rs.getString("state_value"), key);
  }

  /**
   * Inserts or replaces a state entry. The default issues an UPDATE followed by an INSERT
   * when no row matched.
   */
  public void upsertState(Connection conn, String key, String value) {
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + stateTable() + " SET state_value=? WHERE state_key=?", value, key);
    if (updated == 0) {
      JdbcTemplate.update(conn,
          "INSERT INTO " + stateTable() + " (state_key, state_value) VALUES (?,?)", key, value);
    }
  }

  public Optional<Instant> readLastFetchTime(Connection conn) {
    return readState(conn, LAST_FETCH_TIME_KEY).map(Instant::parse);
  }

  public void writeLastFetchTime(Connection conn, Instant fetchedAt) {
    upsertState(conn, LAST_FETCH_TIME_KEY, fetchedAt.toString());
  }

  // ── Consumed set ───────────────────────────────────────────────

  public List<String> selectConsumedIds(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT item_id FROM " + consumedTable() + " ORDER BY consumed_at, item_id",
        rs -> rs.getString("item_id"));
  }

  /**
   * Adds an item id to the consumed set, keeping the first consumption time.
   *
   * @return {@code true} if the id was not consumed before
   */
  public boolean insertConsumedIfAbsent(Connection conn, String itemId, Instant consumedAt) {
    boolean exists = !JdbcTemplate.query(conn,
        "SELECT item_id FROM " + consumedTable() + " WHERE item_id=?",
        rs -> rs.getString("item_id"), itemId).isEmpty();
    if (exists) {
      return false;
    }
    return JdbcTemplate.update(conn,
        "INSERT INTO " + consumedTable() + " (item_id, consumed_at) VALUES (?,?)",
        itemId, Timestamp.from(consumedAt)) > 0;
  }

  // ── Queue ──────────────────────────────────────────────────────

  public List<QueueItem> selectItems(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT item_id, seq, title, body, score, metadata, status, created_at FROM " + queueTable() +
            " ORDER BY seq",
        ITEM_ROW_MAPPER);
  }

  public int countQueued(Connection conn) {
    return JdbcTemplate.queryOne(conn,
        "SELECT COUNT(*) AS queued FROM " + queueTable() + " WHERE status=" + ItemStatus.QUEUED.code(),
        rs -> rs.getInt("queued")).orElse(0);
  }

  public long nextSequence(Connection conn) {
    return JdbcTemplate.queryOne(conn,
        "SELECT COALESCE(MAX(seq), 0) AS max_seq FROM " + queueTable(),
        rs -> rs.getLong("max_seq")).orElse(0L) + 1;
  }

  /**
   * Inserts a queue row unless one with the same id exists.
   *
   * @param item     the item
   * @param sequence insertion rank to store
   * @return {@code true} if a row was inserted
   */
  public boolean insertItemIfAbsent(Connection conn, QueueItem item, long sequence) {
    boolean exists = !JdbcTemplate.query(conn,
        "SELECT item_id FROM " + queueTable() + " WHERE item_id=?",
        rs -> rs.getString("item_id"), item.id()).isEmpty();
    if (exists) {
      return false;
    }
    return JdbcTemplate.update(conn, insertItemSql(""), itemParams(item, sequence)) > 0;
  }

  public int markItemConsumed(Connection conn, String itemId, Instant consumedAt) {
    return JdbcTemplate.update(conn,
        "UPDATE " + queueTable() + " SET status=" + ItemStatus.CONSUMED.code() + ", consumed_at=?" +
            " WHERE item_id=? AND status=" + ItemStatus.QUEUED.code(),
        Timestamp.from(consumedAt), itemId);
  }

  protected String insertItemSql(String verbModifier) {
    return "INSERT " + verbModifier + "INTO " + queueTable() +
        " (item_id, seq, title, body, score, metadata, status, created_at, consumed_at)" +
        " VALUES (?,?,?,?,?,?,?,?,NULL)";
  }

  protected Object[] itemParams(QueueItem item, long sequence) {
    Objects.requireNonNull(item, "item");
    return new Object[]{
        item.id(), sequence, item.title(), item.body(), item.score(),
        MetadataCodec.encode(item.metadata()), ItemStatus.QUEUED.code(),
        Timestamp.from(item.createdAt())};
  }
}
