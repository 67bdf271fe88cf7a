package io.relata.orm.error;

/**
 * Root of every failure raised by the mapping layer.
 * <p>
 * Caller mistakes (a bad page number, wrong operand count, missing primary key value) are reported as
 * {@link IllegalArgumentException} instead and never extend this type.
 */
public class OrmException extends RuntimeException {
  public OrmException(String message) {
    super(message);
  }

  public OrmException(String message, Throwable cause) {
    super(message, cause);
  }
}
