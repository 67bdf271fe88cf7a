package io.relata.orm.model;

import io.relata.orm.error.ConfigurationException;
import io.relata.orm.error.DecodeException;
import io.relata.orm.exec.Row;
import io.relata.orm.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/** Immutable {@link Model} produced by {@link ModelBuilder}. */
final class RegisteredModel<T> implements Model<T> {
  private final Class<T> entityType;
  private final String tableName;
  private final List<Column> columns;
  private final List<Function<T, ?>> accessors;
  private final Function<Row, T> decoder;
  private final int pkIndex;

  RegisteredModel(Class<T> entityType, String tableName, List<Column> columns,
                  List<Function<T, ?>> accessors, Function<Row, T> decoder, int pkIndex) {
    this.entityType = entityType;
    this.tableName = tableName;
    this.columns = List.copyOf(columns);
    this.accessors = List.copyOf(accessors);
    this.decoder = decoder;
    this.pkIndex = pkIndex;
  }

  @Override public Class<T> entityType() { return entityType; }
  @Override public String tableName() { return tableName; }
  @Override public List<Column> columns() { return columns; }

  @Override
  public Optional<Column> primaryKey() {
    return pkIndex < 0 ? Optional.empty() : Optional.of(columns.get(pkIndex));
  }

  @Override
  public Value primaryKeyValue(T entity) {
    Objects.requireNonNull(entity, "entity");
    if (pkIndex < 0) throw new ConfigurationException("Model '" + tableName + "' has no primary key");
    return Value.from(accessors.get(pkIndex).apply(entity));
  }

  @Override
  public List<ColumnValue> encode(T entity) {
    Objects.requireNonNull(entity, "entity");
    List<ColumnValue> out = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      out.add(new ColumnValue(columns.get(i).name(), Value.from(accessors.get(i).apply(entity))));
    }
    return out;
  }

  @Override
  public T decode(Row row) {
    try {
      T out = decoder.apply(row);
      if (out == null) throw new DecodeException("Decoder for '" + tableName + "' returned null");
      return out;
    } catch (DecodeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DecodeException("Failed to decode row of '" + tableName + "': " + e.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return "Model[" + entityType.getSimpleName() + " -> " + tableName + "]";
  }
}
