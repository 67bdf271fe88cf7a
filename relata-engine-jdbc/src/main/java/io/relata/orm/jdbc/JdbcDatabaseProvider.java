package io.relata.orm.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.relata.orm.error.ConnectionException;
import io.relata.orm.exec.Database;
import io.relata.orm.exec.DatabaseConfig;
import io.relata.orm.exec.DatabaseProvider;

import java.util.Map;

/**
 * Opens a {@link JdbcDatabase} for a plain JDBC URL ({@code driver: jdbc}).
 * <p>
 * The HikariCP data source is capped at one connection, which the database holds for its whole life.
 * Subclasses adapt the URL and settings for a specific database.
 */
public class JdbcDatabaseProvider implements DatabaseProvider {
  /** Extra property read as the JDBC user name; every other property goes to the driver. */
  public static final String USERNAME = "username";

  @Override
  public String driver() {
    return "jdbc";
  }

  @Override
  public Database open(DatabaseConfig config) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("relata-" + driver());
    hc.setJdbcUrl(jdbcUrl(config));
    hc.setMaximumPoolSize(1);
    hc.setMinimumIdle(1);
    if (config.authToken() != null) hc.setPassword(config.authToken());
    for (Map.Entry<String, String> e : config.properties().entrySet()) {
      if (USERNAME.equals(e.getKey())) hc.setUsername(e.getValue());
      else hc.addDataSourceProperty(e.getKey(), e.getValue());
    }
    configure(hc, config);

    HikariDataSource ds;
    try {
      ds = new HikariDataSource(hc);
    } catch (RuntimeException e) {
      throw new ConnectionException("Failed to open " + driver() + " database at " + config.url(), e);
    }
    return new JdbcDatabase(driver() + ":" + config.url(), ds);
  }

  protected String jdbcUrl(DatabaseConfig config) {
    return config.url();
  }

  /** Hook for driver-specific pool settings. */
  protected void configure(HikariConfig hc, DatabaseConfig config) {
  }
}
