package io.relata.orm.jdbc.sqlite;

import io.relata.orm.exec.Database;
import io.relata.orm.exec.DatabaseConfig;
import io.relata.orm.exec.Databases;
import io.relata.orm.jdbc.JdbcDatabase;
import io.relata.orm.value.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteDatabasesTest {
  @Test
  void inMemoryDatabaseAnswers() {
    try (Database db = SqliteDatabases.inMemory()) {
      assertTrue(db.query("SELECT 1", List.of()).next().isPresent());
    }
  }

  @Test
  void modelCreateTableCreatesTable() {
    try (Database db = SqliteDatabases.inMemory()) {
      db.execute(User.MODEL.migrationSql(), List.of());
      assertTrue(db.query("SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'users'", List.of())
          .next().isPresent());
      // IF NOT EXISTS makes a second run harmless
      assertDoesNotThrow(() -> db.execute(User.MODEL.migrationSql(), List.of()));
    }
  }

  @Test
  void providerIsDiscoveredByDriverId() {
    try (Database db = Databases.open(DatabaseConfig.of("sqlite", ":memory:"))) {
      assertTrue(db instanceof JdbcDatabase);
      assertEquals("sqlite::memory:", ((JdbcDatabase) db).id());
    }
  }

  @Test
  void fileDatabaseSurvivesReopen(@TempDir Path dir) {
    String path = dir.resolve("app.db").toString();
    try (Database db = SqliteDatabases.local(path)) {
      db.execute("CREATE TABLE notes (body TEXT)", List.of());
      db.execute("INSERT INTO notes (body) VALUES (?)", List.of(Value.of("kept")));
    }
    try (Database db = SqliteDatabases.local(path)) {
      assertEquals("kept", db.query("SELECT body FROM notes", List.of()).next().orElseThrow().getText(0));
    }
  }

  @Test
  void inMemoryDatabasesAreIndependent() {
    try (Database a = SqliteDatabases.inMemory(); Database b = SqliteDatabases.inMemory()) {
      a.execute("CREATE TABLE only_a (x INTEGER)", List.of());
      assertTrue(b.query("SELECT name FROM sqlite_master WHERE name = 'only_a'", List.of()).next().isEmpty());
    }
  }

  @Test
  void acceptsFullJdbcUrl() {
    assertEquals("jdbc:sqlite::memory:",
        new SqliteDatabaseProvider().jdbcUrl(DatabaseConfig.of("sqlite", "jdbc:sqlite::memory:")));
    assertEquals("jdbc:sqlite:data/app.db",
        new SqliteDatabaseProvider().jdbcUrl(DatabaseConfig.of("sqlite", "data/app.db")));
  }
}
