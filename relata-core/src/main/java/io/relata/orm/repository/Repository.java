package io.relata.orm.repository;

import io.relata.orm.error.ConfigurationException;
import io.relata.orm.error.NotFoundException;
import io.relata.orm.exec.Database;
import io.relata.orm.model.Column;
import io.relata.orm.model.ColumnValue;
import io.relata.orm.model.Model;
import io.relata.orm.query.Filter;
import io.relata.orm.query.FilterOperator;
import io.relata.orm.query.PaginatedResult;
import io.relata.orm.query.Pagination;
import io.relata.orm.query.SearchFilter;
import io.relata.orm.sql.QueryBuilder;
import io.relata.orm.sql.SqlBuilder;
import io.relata.orm.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CRUD for one {@link Model} against one {@link Database}.
 * <p>
 * Operations that address a single row by key need a model with a primary key and fail with
 * {@link ConfigurationException} otherwise.
 */
public final class Repository<T> {
  private static final Logger log = LoggerFactory.getLogger(Repository.class);

  private final Database db;
  private final Model<T> model;

  public Repository(Database db, Model<T> model) {
    this.db = Objects.requireNonNull(db, "db");
    this.model = Objects.requireNonNull(model, "model");
  }

  /**
   * Inserts the entity. A primary key left unset is omitted so the database assigns it; the assigned key
   * is not written back, so re-query to learn it.
   */
  public T create(T entity) {
    Objects.requireNonNull(entity, "entity");
    String pk = model.primaryKey().map(Column::name).orElse(null);
    List<ColumnValue> values = new ArrayList<>();
    for (ColumnValue cv : model.encode(entity)) {
      if (cv.column().equals(pk) && cv.value().isNull()) continue;
      values.add(cv);
    }
    db.execute(SqlBuilder.insert(model.tableName(), values));
    return entity;
  }

  public Optional<T> findById(Object id) {
    List<T> found = query().where(byPk(Value.from(id))).limit(1).execute(db, model);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  /** Like {@link #findById(Object)} but treats absence as an error. */
  public T getById(Object id) {
    return findById(id).orElseThrow(
        () -> new NotFoundException("No row in '" + model.tableName() + "' with key " + id));
  }

  public List<T> findAll() {
    return query().execute(db, model);
  }

  public List<T> findWhere(FilterOperator filter) {
    return query().where(filter).execute(db, model);
  }

  public PaginatedResult<T> findPaginated(Pagination pagination) {
    return findWherePaginated(null, pagination);
  }

  public PaginatedResult<T> findWherePaginated(FilterOperator filter, Pagination pagination) {
    Objects.requireNonNull(pagination, "pagination");
    long total = query().where(filter).executeCount(db);
    List<T> data = query().where(filter)
        .limit(pagination.limit())
        .offset(pagination.offset())
        .execute(db, model);
    return new PaginatedResult<>(data, pagination.withTotal(total));
  }

  /** Updates every non-key column of the row with the entity's key; no matching row is not an error. */
  public T update(T entity) {
    Objects.requireNonNull(entity, "entity");
    Column pk = requirePrimaryKey();
    Value id = requireKeyValue(entity, "update");
    List<ColumnValue> set = new ArrayList<>();
    for (ColumnValue cv : model.encode(entity)) {
      if (!cv.column().equals(pk.name())) set.add(cv);
    }
    if (set.isEmpty()) return entity;
    db.execute(SqlBuilder.update(model.tableName(), set, byPk(id)));
    return entity;
  }

  /** @return true once the DELETE has run, whether or not a row matched */
  public boolean delete(T entity) {
    Objects.requireNonNull(entity, "entity");
    requirePrimaryKey();
    Value id = requireKeyValue(entity, "delete");
    db.execute(SqlBuilder.delete(model.tableName(), byPk(id)));
    return true;
  }

  /** @return number of rows deleted */
  public long bulkDelete(Collection<?> ids) {
    Objects.requireNonNull(ids, "ids");
    Column pk = requirePrimaryKey();
    if (ids.isEmpty()) return 0L;
    return db.execute(SqlBuilder.delete(model.tableName(), FilterOperator.single(Filter.in(pk.name(), ids))));
  }

  /** @return number of rows deleted */
  public long deleteWhere(FilterOperator filter) {
    Objects.requireNonNull(filter, "filter");
    return db.execute(SqlBuilder.delete(model.tableName(), filter));
  }

  public long count() {
    return query().executeCount(db);
  }

  public long countWhere(FilterOperator filter) {
    return query().where(filter).executeCount(db);
  }

  /** Updates when the entity carries a primary key, inserts otherwise. Existence is not checked. */
  public T createOrUpdate(T entity) {
    Objects.requireNonNull(entity, "entity");
    requirePrimaryKey();
    if (model.primaryKeyValue(entity).isNull()) {
      log.debug("relata.repository createOrUpdate table={} branch=create", model.tableName());
      return create(entity);
    }
    log.debug("relata.repository createOrUpdate table={} branch=update", model.tableName());
    return update(entity);
  }

  /**
   * Substring search over the filter's columns. Without a pagination every match is returned and the
   * result reports a single page sized to the total.
   */
  public PaginatedResult<T> search(SearchFilter search, Pagination pagination) {
    Objects.requireNonNull(search, "search");
    FilterOperator filter = search.toFilterOperator();
    if (pagination != null) return findWherePaginated(filter, pagination);

    List<T> data = findWhere(filter);
    long total = data.size();
    Pagination all = new Pagination(1, (int) Math.max(total, 1L)).withTotal(total);
    return new PaginatedResult<>(data, all);
  }

  private QueryBuilder query() {
    return new QueryBuilder(model.tableName());
  }

  private FilterOperator byPk(Value id) {
    return FilterOperator.single(Filter.eq(requirePrimaryKey().name(), id));
  }

  private Column requirePrimaryKey() {
    return model.primaryKey().orElseThrow(
        () -> new ConfigurationException("Model '" + model.tableName() + "' has no primary key"));
  }

  private Value requireKeyValue(T entity, String op) {
    Value id = model.primaryKeyValue(entity);
    if (id.isNull()) {
      throw new IllegalArgumentException("Cannot " + op + " " + model.tableName() + " row without a primary key value");
    }
    return id;
  }
}
