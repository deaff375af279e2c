package io.shortcast.jdbc;

import java.util.Objects;

/**
 * Default table names and identifier validation. Table names are concatenated into SQL,
 * so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_STATE_TABLE = "shortcast_state";
  public static final String DEFAULT_CONSUMED_TABLE = "shortcast_consumed";
  public static final String DEFAULT_QUEUE_TABLE = "shortcast_queue";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
