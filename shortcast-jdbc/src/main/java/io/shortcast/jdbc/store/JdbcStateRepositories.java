package io.shortcast.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC state repositories with auto-detection support.
 *
 * <p>Repositories are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.shortcast.jdbc.store.AbstractJdbcStateRepository}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcStateRepository repository = JdbcStateRepositories.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcStateRepository repository = JdbcStateRepositories.detect("jdbc:mysql://localhost/shortcast");
 *
 * // Get by name
 * AbstractJdbcStateRepository repository = JdbcStateRepositories.get("postgresql");
 * }</pre>
 */
public final class JdbcStateRepositories {

  private static final List<AbstractJdbcStateRepository> REPOSITORIES;
  private static final Map<String, AbstractJdbcStateRepository> BY_NAME = new ConcurrentHashMap<>();

  static {
    REPOSITORIES = ServiceLoader.load(AbstractJdbcStateRepository.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcStateRepository repository : REPOSITORIES) {
      BY_NAME.put(repository.name().toLowerCase(Locale.ROOT), repository);
    }
  }

  private JdbcStateRepositories() {
  }

  /**
   * Returns all registered repositories.
   */
  public static List<AbstractJdbcStateRepository> all() {
    return REPOSITORIES;
  }

  /**
   * Gets a repository by name.
   *
   * @param name repository name (case-insensitive)
   * @return the repository
   * @throws IllegalArgumentException if no repository is registered under that name
   */
  public static AbstractJdbcStateRepository get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcStateRepository repository = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (repository == null) {
      throw new IllegalArgumentException("Unknown state repository: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return repository;
  }

  /**
   * Auto-detects the repository from a DataSource.
   *
   * @param dataSource the data source
   * @return detected repository
   * @throws IllegalStateException if detection fails or no repository matches
   */
  public static AbstractJdbcStateRepository detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect state repository from DataSource", e);
    }
  }

  /**
   * Auto-detects the repository from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected repository
   * @throws IllegalArgumentException if no repository matches
   */
  public static AbstractJdbcStateRepository detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcStateRepository repository : REPOSITORIES) {
      for (String prefix : repository.jdbcUrlPrefixes()) {
        if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return repository;
        }
      }
    }
    throw new IllegalArgumentException("No state repository found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return REPOSITORIES.stream()
        .flatMap(r -> r.jdbcUrlPrefixes().stream())
        .toList();
  }
}
