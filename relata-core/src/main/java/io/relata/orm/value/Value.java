package io.relata.orm.value;

import io.relata.orm.error.DecodeException;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A single column value as stored by the database: null, a 64-bit integer, a double, text or bytes.
 * <p>
 * Every conversion between Java objects and stored values goes through {@link #from(Object)} on the way in
 * and the {@code as*} accessors on the way out.
 */
public sealed interface Value permits Value.NullValue, Value.IntegerValue, Value.RealValue, Value.TextValue, Value.BlobValue {
  NullValue NULL = new NullValue();

  static Value from(Object o) {
    if (o == null) return NULL;
    if (o instanceof Value v) return v;
    if (o instanceof Optional<?> opt) return opt.isPresent() ? from(opt.get()) : NULL;
    if (o instanceof Boolean b) return new IntegerValue(b ? 1L : 0L);
    if (o instanceof Long l) return new IntegerValue(l);
    if (o instanceof Integer i) return new IntegerValue(i);
    if (o instanceof Short s) return new IntegerValue(s);
    if (o instanceof Byte b) return new IntegerValue(b);
    if (o instanceof Double d) return new RealValue(d);
    if (o instanceof Float f) return new RealValue(f);
    if (o instanceof BigDecimal bd) return new RealValue(bd.doubleValue());
    if (o instanceof CharSequence cs) return new TextValue(cs.toString());
    if (o instanceof UUID u) return new TextValue(u.toString());
    if (o instanceof Enum<?> e) return new TextValue(e.name());
    if (o instanceof byte[] bytes) return new BlobValue(bytes);
    throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getName());
  }

  static Value of(long v) { return new IntegerValue(v); }
  static Value of(double v) { return new RealValue(v); }
  static Value of(String v) { return v == null ? NULL : new TextValue(v); }

  /** Short variant name, used in error messages and logs. */
  String typeName();

  default boolean isNull() {
    return this instanceof NullValue;
  }

  default long asLong() {
    if (this instanceof IntegerValue i) return i.value();
    throw mismatch("INTEGER");
  }

  default double asDouble() {
    if (this instanceof RealValue r) return r.value();
    if (this instanceof IntegerValue i) return i.value();
    throw mismatch("REAL");
  }

  default String asText() {
    if (this instanceof TextValue t) return t.value();
    throw mismatch("TEXT");
  }

  default byte[] asBlob() {
    if (this instanceof BlobValue b) return b.value();
    throw mismatch("BLOB");
  }

  default boolean asBoolean() {
    if (this instanceof IntegerValue i) {
      if (i.value() == 0L) return false;
      if (i.value() == 1L) return true;
      throw new DecodeException("Expected boolean 0/1 but got " + i.value());
    }
    throw mismatch("INTEGER(0/1)");
  }

  private DecodeException mismatch(String expected) {
    return new DecodeException("Expected " + expected + " but got " + typeName());
  }

  record NullValue() implements Value {
    @Override public String typeName() { return "NULL"; }
  }

  record IntegerValue(long value) implements Value {
    @Override public String typeName() { return "INTEGER"; }
  }

  record RealValue(double value) implements Value {
    @Override public String typeName() { return "REAL"; }
  }

  record TextValue(String value) implements Value {
    public TextValue {
      Objects.requireNonNull(value, "value");
    }

    @Override public String typeName() { return "TEXT"; }
  }

  record BlobValue(byte[] value) implements Value {
    public BlobValue {
      Objects.requireNonNull(value, "value");
      value = value.clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    @Override public String typeName() { return "BLOB"; }

    @Override
    public boolean equals(Object o) {
      return o instanceof BlobValue other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "BlobValue[" + Base64.getEncoder().encodeToString(value) + "]";
    }
  }
}
