package io.relata.orm.exec;

import io.relata.orm.error.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings handed to a {@link DatabaseProvider}.
 *
 * @param driver     provider id, e.g. {@code sqlite}
 * @param url        driver-specific location (a file path, {@code :memory:}, or a JDBC URL)
 * @param authToken  optional credential for remote databases, may be null
 * @param properties extra driver properties passed through unchanged
 */
public record DatabaseConfig(String driver, String url, String authToken, Map<String, String> properties) {
  public DatabaseConfig {
    Objects.requireNonNull(driver, "driver");
    Objects.requireNonNull(url, "url");
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  public static DatabaseConfig of(String driver, String url) {
    return new DatabaseConfig(driver, url, null, Map.of());
  }

  /**
   * Reads {@code <prefix>.driver}, {@code <prefix>.url}, {@code <prefix>.auth-token} and every
   * {@code <prefix>.properties.*} key.
   */
  public static DatabaseConfig fromProperties(Properties p, String prefix) {
    Objects.requireNonNull(p, "properties");
    String base = (prefix == null || prefix.isBlank()) ? "" : prefix + ".";
    String driver = trimToNull(p.getProperty(base + "driver"));
    String url = trimToNull(p.getProperty(base + "url"));
    if (driver == null) throw new ConfigurationException("Missing property " + base + "driver");
    if (url == null) throw new ConfigurationException("Missing property " + base + "url");

    String extraPrefix = base + "properties.";
    Map<String, String> extra = new LinkedHashMap<>();
    for (String name : p.stringPropertyNames()) {
      if (name.startsWith(extraPrefix) && name.length() > extraPrefix.length()) {
        extra.put(name.substring(extraPrefix.length()), p.getProperty(name));
      }
    }
    return new DatabaseConfig(driver, url, trimToNull(p.getProperty(base + "auth-token")), extra);
  }

  private static String trimToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }

  @Override
  public String toString() {
    return "DatabaseConfig[driver=" + driver + ", url=" + url + ", authToken=" + (authToken == null ? "null" : "***")
        + ", properties=" + properties.keySet() + "]";
  }
}
