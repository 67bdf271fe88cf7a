package io.relata.examples.config;

import io.relata.orm.exec.DatabaseConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "relata")
public class RelataProperties {
  private String driver = "sqlite";
  private String url = "relata-examples.db";
  private String authToken;
  private final Map<String, String> properties = new LinkedHashMap<>();

  /** Apply the model tables on startup. */
  private boolean migrateOnStartup = true;

  public String getDriver() { return driver; }
  public void setDriver(String driver) { this.driver = driver; }
  public String getUrl() { return url; }
  public void setUrl(String url) { this.url = url; }
  public String getAuthToken() { return authToken; }
  public void setAuthToken(String authToken) { this.authToken = authToken; }
  public Map<String, String> getProperties() { return properties; }
  public boolean isMigrateOnStartup() { return migrateOnStartup; }
  public void setMigrateOnStartup(boolean migrateOnStartup) { this.migrateOnStartup = migrateOnStartup; }

  public DatabaseConfig toDatabaseConfig() {
    String token = (authToken == null || authToken.isBlank()) ? null : authToken;
    return new DatabaseConfig(driver, url, token, properties);
  }
}
