package io.relata.orm.error;

/** Raised when a database cannot be opened or its connection is unusable. */
public final class ConnectionException extends OrmException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
