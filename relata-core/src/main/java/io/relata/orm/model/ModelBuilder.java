package io.relata.orm.model;

import io.relata.orm.error.ConfigurationException;
import io.relata.orm.exec.Row;

import java.util.*;
import java.util.function.Function;

/**
 * Explicit registration of an entity: one accessor per column plus a row decoder.
 *
 * <pre>
 * Model&lt;User&gt; users = Model.builder(User.class, "users")
 *     .primaryKey("id", "INTEGER PRIMARY KEY AUTOINCREMENT", User::id)
 *     .column("name", "TEXT", User::name)
 *     .nullableColumn("age", "INTEGER", User::age)
 *     .decoder(r -&gt; new User(r.getLongOrNull(0), r.getText(1), r.getLongOrNull(2)))
 *     .build();
 * </pre>
 */
public final class ModelBuilder<T> {
  private final Class<T> entityType;
  private final String tableName;
  private final List<Column> columns = new ArrayList<>();
  private final List<Function<T, ?>> accessors = new ArrayList<>();
  private Function<Row, T> decoder;

  ModelBuilder(Class<T> entityType, String tableName) {
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.tableName = tableName;
  }

  /** Primary key column. It may be unset (null) on new entities so the database can assign it. */
  public ModelBuilder<T> primaryKey(String name, String sqlType, Function<T, ?> accessor) {
    return add(new Column(name, sqlType, true, true), accessor);
  }

  public ModelBuilder<T> column(String name, String sqlType, Function<T, ?> accessor) {
    return add(new Column(name, sqlType, false, false), accessor);
  }

  public ModelBuilder<T> nullableColumn(String name, String sqlType, Function<T, ?> accessor) {
    return add(new Column(name, sqlType, false, true), accessor);
  }

  public ModelBuilder<T> decoder(Function<Row, T> decoder) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    return this;
  }

  private ModelBuilder<T> add(Column column, Function<T, ?> accessor) {
    columns.add(column);
    accessors.add(Objects.requireNonNull(accessor, "accessor for " + column.name()));
    return this;
  }

  public Model<T> build() {
    if (tableName == null || tableName.isBlank()) {
      throw new ConfigurationException("Model for " + entityType.getName() + " has no table name");
    }
    if (columns.isEmpty()) throw new ConfigurationException("Model '" + tableName + "' has no columns");
    if (decoder == null) throw new ConfigurationException("Model '" + tableName + "' has no decoder");

    Set<String> seen = new HashSet<>();
    int pkIndex = -1;
    for (int i = 0; i < columns.size(); i++) {
      Column c = columns.get(i);
      if (!seen.add(c.name())) {
        throw new ConfigurationException("Duplicate column '" + c.name() + "' in model '" + tableName + "'");
      }
      if (c.primaryKey()) {
        if (pkIndex >= 0) throw new ConfigurationException("Model '" + tableName + "' declares more than one primary key");
        pkIndex = i;
      }
    }
    return new RegisteredModel<>(entityType, tableName, columns, accessors, decoder, pkIndex);
  }
}
