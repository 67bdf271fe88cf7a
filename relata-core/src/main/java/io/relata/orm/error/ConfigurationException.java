package io.relata.orm.error;

/** Raised for wiring mistakes: unknown driver ids, models without a primary key, duplicate registrations. */
public final class ConfigurationException extends OrmException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
