package io.relata.orm.error;

/** Raised when a lookup that must find a row finds none. */
public final class NotFoundException extends OrmException {
  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
