package io.relata.orm.jdbc.sqlite;

import io.relata.orm.exec.Database;
import io.relata.orm.exec.DatabaseConfig;

/** Shortcuts for opening SQLite databases without going through provider discovery. */
public final class SqliteDatabases {
  public static final String MEMORY = ":memory:";

  private SqliteDatabases() {}

  /** A database file at {@code path}, created when missing. {@code :memory:} opens a private in-memory database. */
  public static Database local(String path) {
    return new SqliteDatabaseProvider().open(DatabaseConfig.of(SqliteDatabaseProvider.DRIVER, path));
  }

  public static Database inMemory() {
    return local(MEMORY);
  }
}
