package io.shortcast.jdbc.store;

import io.shortcast.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * H2 state repository. Primarily for tests and single-process deployments.
 *
 * <p>Uses {@code MERGE INTO ... KEY} for state writes and the default
 * check-then-insert for the consumed set and the queue.
 */
public final class H2StateRepository extends AbstractJdbcStateRepository {

  public H2StateRepository() {
    super();
  }

  public H2StateRepository(String stateTable, String consumedTable, String queueTable) {
    super(stateTable, consumedTable, queueTable);
  }

  @Override
  public AbstractJdbcStateRepository withTables(String stateTable, String consumedTable, String queueTable) {
    return new H2StateRepository(stateTable, consumedTable, queueTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public void upsertState(Connection conn, String key, String value) {
    JdbcTemplate.update(conn,
        "MERGE INTO " + stateTable() + " (state_key, state_value) KEY (state_key) VALUES (?,?)",
        key, value);
  }
}
