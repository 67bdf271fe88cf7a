package io.relata.orm.sql;

import io.relata.orm.model.ColumnValue;
import io.relata.orm.query.Filter;
import io.relata.orm.query.FilterOperator;
import io.relata.orm.query.Sort;
import io.relata.orm.query.SortOrder;
import io.relata.orm.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders predicate trees and statements into parameterized SQL.
 * <p>
 * Parameters are collected depth-first, left to right, so the i-th {@code ?} in the text always binds
 * the i-th parameter. Table and column names are trusted identifiers and are emitted as given.
 */
public final class SqlBuilder {
  static final String ALWAYS_TRUE = "1 = 1";
  static final String ALWAYS_FALSE = "1 = 0";

  private SqlBuilder() {}

  private static final class RenderCtx {
    private final List<Value> params = new ArrayList<>();

    String add(Value v) {
      params.add(v);
      return "?";
    }
  }

  public static SqlStatement render(FilterOperator filter) {
    Objects.requireNonNull(filter, "filter");
    RenderCtx ctx = new RenderCtx();
    String sql = renderNode(filter, ctx);
    return new SqlStatement(sql, ctx.params);
  }

  public static SqlStatement select(String table, List<String> columns, FilterOperator where,
                                    List<Sort> sort, Long limit, Long offset) {
    String projection = (columns == null || columns.isEmpty()) ? "*" : String.join(", ", columns);
    StringBuilder sql = new StringBuilder("SELECT ").append(projection).append(" FROM ").append(table);
    List<Value> params = appendWhere(sql, where);
    sql.append(orderBy(sort)).append(limitOffset(limit, offset));
    return new SqlStatement(sql.toString(), params);
  }

  public static SqlStatement count(String table, FilterOperator where) {
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(table);
    List<Value> params = appendWhere(sql, where);
    return new SqlStatement(sql.toString(), params);
  }

  public static SqlStatement insert(String table, List<ColumnValue> values) {
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("INSERT into " + table + " needs at least one column");
    }
    List<String> cols = new ArrayList<>(values.size());
    List<String> ph = new ArrayList<>(values.size());
    List<Value> params = new ArrayList<>(values.size());
    for (ColumnValue cv : values) {
      cols.add(cv.column());
      ph.add("?");
      params.add(cv.value());
    }
    String sql = "INSERT INTO " + table + " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, params);
  }

  public static SqlStatement update(String table, List<ColumnValue> set, FilterOperator where) {
    if (set == null || set.isEmpty()) {
      throw new IllegalArgumentException("UPDATE of " + table + " needs at least one column");
    }
    List<String> assignments = new ArrayList<>(set.size());
    List<Value> params = new ArrayList<>();
    for (ColumnValue cv : set) {
      assignments.add(cv.column() + " = ?");
      params.add(cv.value());
    }
    StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ").append(String.join(", ", assignments));
    params.addAll(appendWhere(sql, where));
    return new SqlStatement(sql.toString(), params);
  }

  public static SqlStatement delete(String table, FilterOperator where) {
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(table);
    List<Value> params = appendWhere(sql, where);
    return new SqlStatement(sql.toString(), params);
  }

  /** {@code " ORDER BY a ASC, b DESC"}, or empty when there is nothing to sort by. */
  public static String orderBy(List<Sort> sort) {
    if (sort == null || sort.isEmpty()) return "";
    List<String> parts = new ArrayList<>(sort.size());
    for (Sort s : sort) {
      parts.add(s.column() + (s.order() == SortOrder.DESC ? " DESC" : " ASC"));
    }
    return " ORDER BY " + String.join(", ", parts);
  }

  /** An offset without a limit uses {@code LIMIT -1}, which means "no limit". */
  public static String limitOffset(Long limit, Long offset) {
    StringBuilder sb = new StringBuilder();
    if (limit != null) sb.append(" LIMIT ").append(limit);
    if (offset != null) {
      if (limit == null) sb.append(" LIMIT -1");
      sb.append(" OFFSET ").append(offset);
    }
    return sb.toString();
  }

  private static List<Value> appendWhere(StringBuilder sql, FilterOperator where) {
    if (where == null) return new ArrayList<>();
    SqlStatement rendered = render(where);
    sql.append(" WHERE ").append(rendered.sql());
    return new ArrayList<>(rendered.params());
  }

  private static String renderNode(FilterOperator op, RenderCtx ctx) {
    if (op instanceof FilterOperator.Single s) return renderFilter(s.filter(), ctx);
    if (op instanceof FilterOperator.And a) return renderGroup(a.children(), " AND ", ALWAYS_TRUE, ctx);
    if (op instanceof FilterOperator.Or o) return renderGroup(o.children(), " OR ", ALWAYS_FALSE, ctx);
    throw new IllegalArgumentException("Unsupported filter node: " + op.getClass().getName());
  }

  private static String renderGroup(List<FilterOperator> children, String sep, String whenEmpty, RenderCtx ctx) {
    if (children.isEmpty()) return whenEmpty;
    List<String> parts = new ArrayList<>(children.size());
    for (FilterOperator c : children) {
      parts.add("(" + renderNode(c, ctx) + ")");
    }
    return String.join(sep, parts);
  }

  private static String renderFilter(Filter f, RenderCtx ctx) {
    String col = f.column();
    return switch (f.operator()) {
      case IS_NULL, IS_NOT_NULL -> col + " " + f.operator().sql();
      case IN -> listSql(col, f.operands(), ctx);
      default -> col + " " + f.operator().sql() + " " + ctx.add(f.operand());
    };
  }

  private static String listSql(String col, List<Value> values, RenderCtx ctx) {
    if (values.isEmpty()) return ALWAYS_FALSE;
    List<String> ph = new ArrayList<>(values.size());
    for (Value v : values) ph.add(ctx.add(v));
    return col + " IN (" + String.join(", ", ph) + ")";
  }
}
