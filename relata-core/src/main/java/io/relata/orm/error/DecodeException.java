package io.relata.orm.error;

/** Raised when a stored value cannot be read back as the requested type. */
public final class DecodeException extends OrmException {
  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
