package io.relata.orm.model;

import io.relata.orm.value.Value;

import java.util.Objects;

public record ColumnValue(String column, Value value) {
  public ColumnValue {
    Objects.requireNonNull(column, "column");
    value = value == null ? Value.NULL : value;
  }
}
