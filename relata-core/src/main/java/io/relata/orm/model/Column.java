package io.relata.orm.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A mapped column.
 *
 * @param sqlType  declared type, possibly with constraints (e.g. {@code INTEGER PRIMARY KEY AUTOINCREMENT})
 * @param optional whether the entity may leave the value unset (stored as NULL)
 */
public record Column(String name, String sqlType, boolean primaryKey, boolean optional) {
  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(sqlType, "sqlType");
    if (name.isBlank()) throw new IllegalArgumentException("column name must not be blank");
    if (sqlType.isBlank()) throw new IllegalArgumentException("sqlType of '" + name + "' must not be blank");
  }

  /** Column definition as used in CREATE TABLE. */
  public String definition() {
    String upper = sqlType.toUpperCase(Locale.ROOT);
    StringBuilder sb = new StringBuilder(name).append(' ').append(sqlType);
    if (primaryKey) {
      if (!upper.contains("PRIMARY KEY")) sb.append(" PRIMARY KEY");
    } else if (!optional && !upper.contains("NOT NULL")) {
      sb.append(" NOT NULL");
    }
    return sb.toString();
  }
}
