package io.relata.orm.query;

public enum Operator {
  EQ("=", 1),
  NE("!=", 1),
  GT(">", 1),
  GTE(">=", 1),
  LT("<", 1),
  LTE("<=", 1),
  LIKE("LIKE", 1),

  /** Any number of operands, including none. */
  IN("IN", -1),

  IS_NULL("IS NULL", 0),
  IS_NOT_NULL("IS NOT NULL", 0);

  private final String sql;
  private final int arity;

  Operator(String sql, int arity) {
    this.sql = sql;
    this.arity = arity;
  }

  public String sql() {
    return sql;
  }

  /** Fixed operand count, or -1 for a list of any size. */
  public int arity() {
    return arity;
  }
}
