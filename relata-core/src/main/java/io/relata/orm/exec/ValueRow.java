package io.relata.orm.exec;

import io.relata.orm.error.DecodeException;
import io.relata.orm.value.Value;

import java.util.List;

/** A row already read into memory. */
public record ValueRow(List<String> columnNames, List<Value> values) implements Row {
  public ValueRow {
    columnNames = List.copyOf(columnNames);
    values = List.copyOf(values);
    if (columnNames.size() != values.size()) {
      throw new IllegalArgumentException("columnNames and values differ in size: "
          + columnNames.size() + " vs " + values.size());
    }
  }

  @Override
  public Value get(int index) {
    if (index < 0 || index >= values.size()) {
      throw new DecodeException("Column index " + index + " out of range, row has " + values.size() + " column(s)");
    }
    return values.get(index);
  }
}
