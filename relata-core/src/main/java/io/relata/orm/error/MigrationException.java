package io.relata.orm.error;

/** Raised when a migration cannot be read, tracked or applied. */
public final class MigrationException extends OrmException {
  public MigrationException(String message) {
    super(message);
  }

  public MigrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
