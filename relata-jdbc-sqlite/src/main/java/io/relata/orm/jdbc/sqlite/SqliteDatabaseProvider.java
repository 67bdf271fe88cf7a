package io.relata.orm.jdbc.sqlite;

import com.zaxxer.hikari.HikariConfig;
import io.relata.orm.exec.DatabaseConfig;
import io.relata.orm.jdbc.JdbcDatabaseProvider;

/**
 * {@code driver: sqlite}. The configured url is a file path or {@code :memory:}; a full
 * {@code jdbc:sqlite:} URL is accepted as is.
 */
public final class SqliteDatabaseProvider extends JdbcDatabaseProvider {
  public static final String DRIVER = "sqlite";
  static final String URL_PREFIX = "jdbc:sqlite:";

  @Override
  public String driver() {
    return DRIVER;
  }

  @Override
  protected String jdbcUrl(DatabaseConfig config) {
    String url = config.url().trim();
    return url.startsWith(URL_PREFIX) ? url : URL_PREFIX + url;
  }

  @Override
  protected void configure(HikariConfig hc, DatabaseConfig config) {
    // An in-memory database lives exactly as long as its connection, so never retire it.
    hc.setMaxLifetime(0);
    hc.setIdleTimeout(0);
  }
}
