package io.relata.orm.sql;

import io.relata.orm.value.Value;

import java.util.List;
import java.util.Objects;

/** SQL text with positional {@code ?} placeholders and the values they bind, in placeholder order. */
public record SqlStatement(String sql, List<Value> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params = params == null ? List.of() : List.copyOf(params);
  }

  public SqlStatement(String sql) {
    this(sql, List.of());
  }
}
