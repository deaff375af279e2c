package io.shortcast.jdbc.store;

import io.shortcast.jdbc.JdbcTemplate;
import io.shortcast.model.QueueItem;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * MySQL state repository. Also compatible with TiDB.
 *
 * <p>State writes use {@code INSERT ... ON DUPLICATE KEY UPDATE}; consumed ids and queue
 * rows use {@code INSERT IGNORE}, so a duplicate id reports zero affected rows.
 */
public final class MySqlStateRepository extends AbstractJdbcStateRepository {

  public MySqlStateRepository() {
    super();
  }

  public MySqlStateRepository(String stateTable, String consumedTable, String queueTable) {
    super(stateTable, consumedTable, queueTable);
  }

  @Override
  public AbstractJdbcStateRepository withTables(String stateTable, String consumedTable, String queueTable) {
    return new MySqlStateRepository(stateTable, consumedTable, queueTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public void upsertState(Connection conn, String key, String value) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + stateTable() + " (state_key, state_value) VALUES (?,?)" +
            " ON DUPLICATE KEY UPDATE state_value=VALUES(state_value)",
        key, value);
  }

  @Override
  public boolean insertConsumedIfAbsent(Connection conn, String itemId, Instant consumedAt) {
    return JdbcTemplate.update(conn,
        "INSERT IGNORE INTO " + consumedTable() + " (item_id, consumed_at) VALUES (?,?)",
        itemId, Timestamp.from(consumedAt)) > 0;
  }

  @Override
  public boolean insertItemIfAbsent(Connection conn, QueueItem item, long sequence) {
    return JdbcTemplate.update(conn, insertItemSql("IGNORE "), itemParams(item, sequence)) > 0;
  }
}
