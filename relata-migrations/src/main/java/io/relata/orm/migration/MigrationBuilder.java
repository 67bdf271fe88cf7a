package io.relata.orm.migration;

import java.time.Clock;
import java.util.Objects;

/**
 * <pre>
 * Migration m = new MigrationBuilder("add_user_email_index")
 *     .up("CREATE UNIQUE INDEX idx_users_email ON users(email)")
 *     .down("DROP INDEX idx_users_email")
 *     .build();
 * </pre>
 */
public final class MigrationBuilder {
  private final String name;
  private final Clock clock;
  private String upSql = "";
  private String downSql;

  public MigrationBuilder(String name) {
    this(name, Clock.systemUTC());
  }

  public MigrationBuilder(String name, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public MigrationBuilder up(String sql) {
    this.upSql = Objects.requireNonNull(sql, "sql");
    return this;
  }

  public MigrationBuilder down(String sql) {
    this.downSql = sql;
    return this;
  }

  public Migration build() {
    Migration m = MigrationManager.createMigration(name, upSql, clock);
    return new Migration(m.id(), m.name(), m.sql(), downSql, m.createdAt(), null);
  }
}
