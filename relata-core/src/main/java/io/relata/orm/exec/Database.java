package io.relata.orm.exec;

import io.relata.orm.sql.SqlStatement;
import io.relata.orm.value.Value;

import java.util.List;

/**
 * A connection to one database. Calls block until the driver answers.
 * <p>
 * Placeholders are positional {@code ?}; the i-th placeholder binds {@code params.get(i)}.
 * Driver failures surface as {@link io.relata.orm.error.QueryException}.
 */
public interface Database extends AutoCloseable {
  Rows query(String sql, List<Value> params);

  /** @return the number of rows the statement changed, as reported by the driver */
  long execute(String sql, List<Value> params);

  default Rows query(SqlStatement statement) {
    return query(statement.sql(), statement.params());
  }

  default long execute(SqlStatement statement) {
    return execute(statement.sql(), statement.params());
  }

  @Override
  void close();
}
