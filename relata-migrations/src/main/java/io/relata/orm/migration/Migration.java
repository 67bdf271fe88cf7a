package io.relata.orm.migration;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * A named unit of schema-change SQL.
 *
 * @param sql        statement applied by {@link MigrationManager#executeMigration(Migration)}
 * @param downSql    reverse statement kept for callers; never persisted and never run by the manager, may be null
 * @param executedAt null while pending
 */
public record Migration(String id, String name, String sql, String downSql,
                        OffsetDateTime createdAt, OffsetDateTime executedAt) {
  public Migration {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public boolean isExecuted() {
    return executedAt != null;
  }

  public Migration withExecutedAt(OffsetDateTime at) {
    return new Migration(id, name, sql, downSql, createdAt, at);
  }
}
