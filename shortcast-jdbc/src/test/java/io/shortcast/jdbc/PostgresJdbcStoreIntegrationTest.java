package io.shortcast.jdbc;

import io.shortcast.jdbc.store.AbstractJdbcStateRepository;
import io.shortcast.jdbc.store.JdbcStateRepositories;
import io.shortcast.jdbc.store.PostgresStateRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@DockerAvailable
@Testcontainers
class PostgresJdbcStoreIntegrationTest extends AbstractJdbcStoreTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("shortcast_test");

  private static final PostgresStateRepository REPOSITORY = new PostgresStateRepository();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    Schemas.apply(dataSource, "/schema/postgresql.sql");
  }

  @BeforeEach
  void truncate() throws Exception {
    Schemas.truncateAll(dataSource);
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
  void detectsDialectFromContainerUrl() {
    assertInstanceOf(PostgresStateRepository.class, JdbcStateRepositories.detect(dataSource));
  }
}
