package io.relata.orm.sql;

import io.relata.orm.exec.Database;
import io.relata.orm.exec.Row;
import io.relata.orm.exec.Rows;
import io.relata.orm.model.Model;
import io.relata.orm.query.FilterOperator;
import io.relata.orm.query.Sort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fluent SELECT over one table.
 * <p>
 * {@link #where(FilterOperator)} replaces any earlier filter; {@link #orderBy(Sort)} appends.
 * Not thread-safe; build one per query.
 */
public final class QueryBuilder {
  private final String table;
  private FilterOperator where;
  private final List<Sort> sort = new ArrayList<>();
  private Long limit;
  private Long offset;

  public QueryBuilder(String table) {
    Objects.requireNonNull(table, "table");
    if (table.isBlank()) throw new IllegalArgumentException("table must not be blank");
    this.table = table;
  }

  public QueryBuilder where(FilterOperator filter) {
    this.where = filter;
    return this;
  }

  public QueryBuilder orderBy(Sort s) {
    sort.add(Objects.requireNonNull(s, "sort"));
    return this;
  }

  public QueryBuilder limit(long n) {
    if (n < 0) throw new IllegalArgumentException("limit must be >= 0");
    this.limit = n;
    return this;
  }

  public QueryBuilder offset(long n) {
    if (n < 0) throw new IllegalArgumentException("offset must be >= 0");
    this.offset = n;
    return this;
  }

  public SqlStatement build(List<String> columns) {
    return SqlBuilder.select(table, columns, where, sort, limit, offset);
  }

  /** Count of matching rows; sort, limit and offset do not apply. */
  public SqlStatement buildCount() {
    return SqlBuilder.count(table, where);
  }

  /** Runs the query and decodes every row. A row that fails to decode fails the whole call. */
  public <T> List<T> execute(Database db, Model<T> model) {
    Objects.requireNonNull(db, "db");
    Objects.requireNonNull(model, "model");
    Rows rows = db.query(build(model.columnNames()));
    List<T> out = new ArrayList<>();
    for (Optional<Row> r = rows.next(); r.isPresent(); r = rows.next()) {
      out.add(model.decode(r.get()));
    }
    return out;
  }

  public long executeCount(Database db) {
    Objects.requireNonNull(db, "db");
    Optional<Row> first = db.query(buildCount()).next();
    return first.isEmpty() ? 0L : first.get().getLong(0);
  }
}
