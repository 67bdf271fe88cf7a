package io.relata.orm.exec;

import io.relata.orm.sql.SqlStatement;
import io.relata.orm.value.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Records every statement and answers queries from a queue of canned results. */
public final class CapturingDatabase implements Database {
  public final List<SqlStatement> queries = new ArrayList<>();
  public final List<SqlStatement> executes = new ArrayList<>();
  private final Deque<List<Row>> results = new ArrayDeque<>();
  private long affected = 1L;
  private boolean closed;

  public CapturingDatabase willReturn(List<Row> rows) {
    results.addLast(rows);
    return this;
  }

  public CapturingDatabase willReturnCount(long n) {
    return willReturn(List.of(row(List.of("COUNT(*)"), Value.of(n))));
  }

  public CapturingDatabase willAffect(long n) {
    this.affected = n;
    return this;
  }

  public static Row row(List<String> columns, Value... values) {
    return new ValueRow(columns, List.of(values));
  }

  public boolean closed() {
    return closed;
  }

  @Override
  public Rows query(String sql, List<Value> params) {
    queries.add(new SqlStatement(sql, params));
    List<Row> next = results.pollFirst();
    return next == null ? ListRows.empty() : new ListRows(next);
  }

  @Override
  public long execute(String sql, List<Value> params) {
    executes.add(new SqlStatement(sql, params));
    return affected;
  }

  @Override
  public void close() {
    closed = true;
  }
}
