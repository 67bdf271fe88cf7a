package io.relata.orm.model;

import io.relata.orm.error.DecodeException;
import io.relata.orm.exec.Row;
import io.relata.orm.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * How an entity type maps onto one table.
 * <p>
 * Column order matters: {@link #encode(Object)} returns values in {@link #columns()} order and
 * {@link #decode(Row)} reads a row selected with the same column list.
 */
public interface Model<T> {
  Class<T> entityType();

  String tableName();

  List<Column> columns();

  default Optional<Column> primaryKey() {
    return columns().stream().filter(Column::primaryKey).findFirst();
  }

  /** The entity's primary key, {@link Value#NULL} when unset. */
  Value primaryKeyValue(T entity);

  List<ColumnValue> encode(T entity);

  T decode(Row row) throws DecodeException;

  default List<String> columnNames() {
    List<String> out = new ArrayList<>(columns().size());
    for (Column c : columns()) out.add(c.name());
    return out;
  }

  default String migrationSql() {
    List<String> defs = new ArrayList<>(columns().size());
    for (Column c : columns()) defs.add(c.definition());
    return "CREATE TABLE IF NOT EXISTS " + tableName() + " (" + String.join(", ", defs) + ")";
  }

  static <T> ModelBuilder<T> builder(Class<T> entityType, String tableName) {
    return new ModelBuilder<>(entityType, tableName);
  }
}
