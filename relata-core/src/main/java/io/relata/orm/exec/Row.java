package io.relata.orm.exec;

import io.relata.orm.error.DecodeException;
import io.relata.orm.value.Value;

import java.util.List;

/**
 * One result row. Indexes are 0-based and follow the select list.
 * <p>
 * Every getter raises {@link DecodeException} for an index out of range or a stored value of the wrong type.
 */
public interface Row {
  List<String> columnNames();

  Value get(int index);

  default int columnCount() {
    return columnNames().size();
  }

  default Value get(String column) {
    int idx = columnNames().indexOf(column);
    if (idx < 0) throw new DecodeException("No column '" + column + "' in row " + columnNames());
    return get(idx);
  }

  default long getLong(int index) { return get(index).asLong(); }
  default double getDouble(int index) { return get(index).asDouble(); }
  default String getText(int index) { return get(index).asText(); }
  default byte[] getBlob(int index) { return get(index).asBlob(); }
  default boolean getBoolean(int index) { return get(index).asBoolean(); }

  default Long getLongOrNull(int index) {
    Value v = get(index);
    return v.isNull() ? null : v.asLong();
  }

  default Double getDoubleOrNull(int index) {
    Value v = get(index);
    return v.isNull() ? null : v.asDouble();
  }

  default String getTextOrNull(int index) {
    Value v = get(index);
    return v.isNull() ? null : v.asText();
  }
}
