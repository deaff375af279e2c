package io.shortcast.jdbc;

import io.shortcast.jdbc.store.AbstractJdbcStateRepository;
import io.shortcast.jdbc.store.H2StateRepository;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class H2JdbcStoreTest extends AbstractJdbcStoreTest {
  private static final H2StateRepository REPOSITORY = new H2StateRepository();
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    Schemas.apply(dataSource, "/schema/h2.sql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcStateRepository repository() {
    return REPOSITORY;
  }

  @Test
  void autoDetectsDialectFromDataSource() {
    JdbcStateStore store = new JdbcStateStore(dataSource);
    store.recordFetch(Instant.parse("2024-05-01T09:00:00Z"));

    assertEquals(Instant.parse("2024-05-01T09:00:00Z"),
        new JdbcStateStore(dataSource).load().lastFetchTime().orElseThrow());
  }

  @Test
  void missingTablesSurfaceAsStateStoreException() {
    JdbcDataSource empty = new JdbcDataSource();
    empty.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    JdbcStateStore store = new JdbcStateStore(new DataSourceConnectionProvider(empty), REPOSITORY);

    StateStoreException e = assertThrows(StateStoreException.class, store::load);
    assertInstanceOf(SQLException.class, e.getCause());
  }

  @Test
  void failedConsumeLeavesStateUntouched() {
    JdbcStateStore store = new JdbcStateStore(
        new DataSourceConnectionProvider(dataSource),
        REPOSITORY.withTables("shortcast_state", "shortcast_consumed", "missing_queue"));

    assertThrows(StateStoreException.class,
        () -> store.markConsumed(item("A", 1), Instant.parse("2024-05-01T09:05:00Z")));
    assertEquals(0, stateStore().load().consumedItemIds().size());
  }

  @Test
  void customTableNamesAreValidated() {
    assertThrows(IllegalArgumentException.class,
        () -> REPOSITORY.withTables("state; DROP TABLE x", "c", "q"));
  }
}
