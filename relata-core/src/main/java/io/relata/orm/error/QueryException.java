package io.relata.orm.error;

/** Raised when the driver rejects a statement; usually wraps the driver's own exception. */
public final class QueryException extends OrmException {
  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
