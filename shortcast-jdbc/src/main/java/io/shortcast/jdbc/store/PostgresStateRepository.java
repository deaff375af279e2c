package io.shortcast.jdbc.store;

import io.shortcast.jdbc.JdbcTemplate;
import io.shortcast.model.QueueItem;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL state repository using {@code INSERT ... ON CONFLICT} for every idempotent write.
 */
public final class PostgresStateRepository extends AbstractJdbcStateRepository {

  public PostgresStateRepository() {
    super();
  }

  public PostgresStateRepository(String stateTable, String consumedTable, String queueTable) {
    super(stateTable, consumedTable, queueTable);
  }

  @Override
  public AbstractJdbcStateRepository withTables(String stateTable, String consumedTable, String queueTable) {
    return new PostgresStateRepository(stateTable, consumedTable, queueTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void upsertState(Connection conn, String key, String value) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + stateTable() + " (state_key, state_value) VALUES (?,?)" +
            " ON CONFLICT (state_key) DO UPDATE SET state_value=EXCLUDED.state_value",
        key, value);
  }

  @Override
  public boolean insertConsumedIfAbsent(Connection conn, String itemId, Instant consumedAt) {
    return JdbcTemplate.update(conn,
        "INSERT INTO " + consumedTable() + " (item_id, consumed_at) VALUES (?,?)" +
            " ON CONFLICT (item_id) DO NOTHING",
        itemId, Timestamp.from(consumedAt)) > 0;
  }

  @Override
  public boolean insertItemIfAbsent(Connection conn, QueueItem item, long sequence) {
    return JdbcTemplate.update(conn, insertItemSql("") + " ON CONFLICT (item_id) DO NOTHING",
        itemParams(item, sequence)) > 0;
  }
}
