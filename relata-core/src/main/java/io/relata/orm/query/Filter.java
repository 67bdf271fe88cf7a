package io.relata.orm.query;

import io.relata.orm.value.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One comparison of a column against its operands.
 * <p>
 * The operand count is checked against {@link Operator#arity()} here, so a Filter that exists can
 * always be rendered. Column names are trusted identifiers and are never escaped.
 */
public record Filter(String column, Operator operator, List<Value> operands) {
  public Filter {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
    if (column.isBlank()) throw new IllegalArgumentException("filter column must not be blank");
    operands = operands == null ? List.of() : List.copyOf(operands);
    int arity = operator.arity();
    if (arity >= 0 && operands.size() != arity) {
      throw new IllegalArgumentException(operator + " on '" + column + "' takes " + arity
          + " operand(s) but got " + operands.size());
    }
  }

  /** The single operand of a binary comparison. */
  public Value operand() {
    if (operator.arity() != 1) throw new IllegalStateException(operator + " has no single operand");
    return operands.get(0);
  }

  public static Filter eq(String column, Object value) { return binary(column, Operator.EQ, value); }
  public static Filter ne(String column, Object value) { return binary(column, Operator.NE, value); }
  public static Filter gt(String column, Object value) { return binary(column, Operator.GT, value); }
  public static Filter gte(String column, Object value) { return binary(column, Operator.GTE, value); }
  public static Filter lt(String column, Object value) { return binary(column, Operator.LT, value); }
  public static Filter lte(String column, Object value) { return binary(column, Operator.LTE, value); }
  public static Filter like(String column, Object pattern) { return binary(column, Operator.LIKE, pattern); }

  public static Filter in(String column, Collection<?> values) {
    Objects.requireNonNull(values, "values");
    List<Value> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(Value.from(v));
    return new Filter(column, Operator.IN, out);
  }

  public static Filter isNull(String column) {
    return new Filter(column, Operator.IS_NULL, List.of());
  }

  public static Filter isNotNull(String column) {
    return new Filter(column, Operator.IS_NOT_NULL, List.of());
  }

  private static Filter binary(String column, Operator op, Object value) {
    return new Filter(column, op, List.of(Value.from(value)));
  }
}
