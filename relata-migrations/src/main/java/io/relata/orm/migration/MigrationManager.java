package io.relata.orm.migration;

import io.relata.orm.error.MigrationException;
import io.relata.orm.exec.Database;
import io.relata.orm.exec.Row;
import io.relata.orm.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Applies migrations and records them in the {@code migrations} tracking table.
 * <p>
 * Each migration runs between a BEGIN and a COMMIT together with its tracking row; a failure after BEGIN
 * issues ROLLBACK before the error is rethrown. The manager owns its {@link Database} and closes it.
 */
public final class MigrationManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

  public static final String TABLE = "migrations";

  static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
      + "id TEXT PRIMARY KEY, "
      + "name TEXT NOT NULL, "
      + "sql TEXT NOT NULL, "
      + "created_at TEXT NOT NULL, "
      + "executed_at TEXT)";
  static final String SELECT_ALL = "SELECT id, name, sql, created_at, executed_at FROM " + TABLE + " ORDER BY created_at";
  static final String INSERT = "INSERT INTO " + TABLE + " (id, name, sql, created_at, executed_at) VALUES (?, ?, ?, ?, ?)";
  static final String DELETE = "DELETE FROM " + TABLE + " WHERE id = ?";

  /** Fixed-width UTC form, so text order in the tracking table is time order. */
  private static final DateTimeFormatter WRITE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSXXX");
  private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final Database db;
  private final Clock clock;

  public MigrationManager(Database db) {
    this(db, Clock.systemUTC());
  }

  public MigrationManager(Database db, Clock clock) {
    this.db = Objects.requireNonNull(db, "db");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Database database() {
    return db;
  }

  /** Creates the tracking table when missing; safe to call repeatedly. */
  public void init() {
    db.execute(CREATE_TABLE, List.of());
  }

  public static Migration createMigration(String name, String sql) {
    return createMigration(name, sql, Clock.systemUTC());
  }

  public static Migration createMigration(String name, String sql, Clock clock) {
    return new Migration(UUID.randomUUID().toString(), name, sql, null, now(clock), null);
  }

  public static Migration createMigrationFromFile(String name, Path file) {
    Objects.requireNonNull(file, "file");
    String sql;
    try {
      sql = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new MigrationException("Failed to read migration file: " + file, e);
    }
    return createMigration(name, sql);
  }

  public static String generateMigrationName(String description) {
    return generateMigrationName(description, Clock.systemUTC());
  }

  /** {@code yyyyMMdd_HHmmss_<description>}, lower-cased, spaces and dashes as underscores, other symbols dropped. */
  public static String generateMigrationName(String description, Clock clock) {
    String lowered = description.toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    StringBuilder sanitized = new StringBuilder(lowered.length());
    lowered.codePoints()
        .filter(cp -> Character.isLetterOrDigit(cp) || cp == '_')
        .forEach(sanitized::appendCodePoint);
    return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).format(NAME_FORMAT) + "_" + sanitized;
  }

  /**
   * Every tracked migration, oldest first. A null or empty {@code executed_at} means pending. An unreadable
   * timestamp fails the whole read.
   */
  public List<Migration> getMigrations() {
    List<Migration> out = new ArrayList<>();
    for (Row row : db.query(SELECT_ALL, List.of()).remaining()) {
      String executedAt = row.getTextOrNull(4);
      out.add(new Migration(
          row.getText(0),
          row.getText(1),
          row.getText(2),
          null,
          parseTimestamp(row.getText(3)),
          (executedAt == null || executedAt.isEmpty()) ? null : parseTimestamp(executedAt)));
    }
    return out;
  }

  /**
   * Runs the migration SQL and records it, both inside one transaction. A statement the driver rejects
   * surfaces as the driver's {@link io.relata.orm.error.QueryException} after the ROLLBACK.
   *
   * @return the migration with its execution time set
   */
  public Migration executeMigration(Migration migration) {
    Objects.requireNonNull(migration, "migration");
    if (migration.sql().isBlank()) {
      throw new MigrationException("Migration '" + migration.name() + "' has no SQL");
    }

    OffsetDateTime executedAt = now(clock);
    db.execute("BEGIN", List.of());
    try {
      db.execute(migration.sql(), List.of());
      db.execute(INSERT, List.of(
          Value.of(migration.id()),
          Value.of(migration.name()),
          Value.of(migration.sql()),
          Value.of(format(migration.createdAt())),
          Value.of(format(executedAt))));
      db.execute("COMMIT", List.of());
    } catch (RuntimeException e) {
      log.warn("relata.migration failed id={} name={}: {}", migration.id(), migration.name(), e.getMessage());
      rollbackAfter(migration, e);
      throw e;
    }
    log.info("relata.migration executed id={} name={}", migration.id(), migration.name());
    return migration.withExecutedAt(executedAt);
  }

  /**
   * Forgets that a migration ran by removing its tracking row. The schema is left as it is.
   *
   * @return whether a tracking row was removed
   */
  public boolean rollbackMigration(String id) {
    Objects.requireNonNull(id, "id");
    long n = db.execute(DELETE, List.of(Value.of(id)));
    log.info("relata.migration rolled back id={} removed={}", id, n);
    return n > 0;
  }

  public List<Migration> getPendingMigrations() {
    List<Migration> out = new ArrayList<>();
    for (Migration m : getMigrations()) if (!m.isExecuted()) out.add(m);
    return out;
  }

  public List<Migration> getExecutedMigrations() {
    List<Migration> out = new ArrayList<>();
    for (Migration m : getMigrations()) if (m.isExecuted()) out.add(m);
    return out;
  }

  /**
   * Executes, in order, every given migration whose own {@code executedAt} is unset. The tracking
   * table is not consulted. Stops at the first failure.
   *
   * @return the migrations that ran, with execution times set
   */
  public List<Migration> runMigrations(List<Migration> migrations) {
    Objects.requireNonNull(migrations, "migrations");
    List<Migration> ran = new ArrayList<>();
    for (Migration m : migrations) {
      if (m.isExecuted()) continue;
      ran.add(executeMigration(m));
    }
    return ran;
  }

  @Override
  public void close() {
    db.close();
  }

  private void rollbackAfter(Migration migration, RuntimeException failure) {
    try {
      db.execute("ROLLBACK", List.of());
    } catch (RuntimeException e) {
      log.warn("relata.migration rollback failed id={} name={}: {}", migration.id(), migration.name(), e.getMessage());
      failure.addSuppressed(e);
    }
  }

  static OffsetDateTime now(Clock clock) {
    return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
  }

  static String format(OffsetDateTime t) {
    return t.withOffsetSameInstant(ZoneOffset.UTC).format(WRITE_FORMAT);
  }

  static OffsetDateTime parseTimestamp(String s) {
    try {
      return OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).withOffsetSameInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new MigrationException("Invalid datetime format in " + TABLE + ": '" + s + "'", e);
    }
  }
}
