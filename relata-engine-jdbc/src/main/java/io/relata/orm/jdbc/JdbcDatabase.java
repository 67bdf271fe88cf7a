package io.relata.orm.jdbc;

import io.relata.orm.error.ConnectionException;
import io.relata.orm.error.QueryException;
import io.relata.orm.exec.Database;
import io.relata.orm.exec.ListRows;
import io.relata.orm.exec.Row;
import io.relata.orm.exec.Rows;
import io.relata.orm.exec.ValueRow;
import io.relata.orm.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link Database} over a single JDBC connection.
 * <p>
 * Owns both the {@link DataSource} and the one {@link Connection} taken from it. {@link #close()} releases
 * the connection first and the data source second. Results are read fully before a query returns.
 */
public final class JdbcDatabase implements Database {
  private static final Logger log = LoggerFactory.getLogger(JdbcDatabase.class);

  private final String id;
  private final DataSource ds;
  private final Connection conn;
  private boolean closed;

  public JdbcDatabase(String id, DataSource ds) {
    this.id = Objects.requireNonNull(id, "id");
    this.ds = Objects.requireNonNull(ds, "ds");
    try {
      this.conn = ds.getConnection();
    } catch (SQLException e) {
      closeQuietly(ds, e);
      throw new ConnectionException("Failed to open connection for " + id, e);
    }
  }

  public String id() {
    return id;
  }

  @Override
  public Rows query(String sql, List<Value> params) {
    Objects.requireNonNull(sql, "sql");
    List<Value> binds = params == null ? List.of() : params;
    ensureOpen();
    long start = System.nanoTime();
    debugSql("QUERY", sql, binds);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      JdbcValues.bindAll(ps, binds);
      if (!ps.execute()) {
        debugDone("QUERY", 0, System.nanoTime() - start);
        return ListRows.empty();
      }
      try (ResultSet rs = ps.getResultSet()) {
        List<String> labels = JdbcValues.columnLabels(rs.getMetaData());
        List<Row> out = new ArrayList<>();
        while (rs.next()) {
          List<Value> values = new ArrayList<>(labels.size());
          for (int i = 1; i <= labels.size(); i++) values.add(JdbcValues.read(rs, i));
          out.add(new ValueRow(labels, values));
        }
        debugDone("QUERY", out.size(), System.nanoTime() - start);
        return new ListRows(out);
      }
    } catch (SQLException e) {
      throw new QueryException("Query failed: " + e.getMessage() + " [sql=" + sql + "]", e);
    }
  }

  @Override
  public long execute(String sql, List<Value> params) {
    Objects.requireNonNull(sql, "sql");
    List<Value> binds = params == null ? List.of() : params;
    ensureOpen();
    long start = System.nanoTime();
    debugSql("EXECUTE", sql, binds);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      JdbcValues.bindAll(ps, binds);
      long n = ps.executeUpdate();
      debugDone("EXECUTE", n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw new QueryException("Statement failed: " + e.getMessage() + " [sql=" + sql + "]", e);
    }
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    ConnectionException failure = null;
    try {
      conn.close();
    } catch (SQLException e) {
      failure = new ConnectionException("Failed to close connection for " + id, e);
    }
    if (ds instanceof AutoCloseable c) {
      try {
        c.close();
      } catch (Exception e) {
        if (failure == null) failure = new ConnectionException("Failed to close data source for " + id, e);
        else failure.addSuppressed(e);
      }
    }
    log.debug("relata.jdbc closed handleId={}", id);
    if (failure != null) throw failure;
  }

  private void ensureOpen() {
    if (closed) throw new ConnectionException("Database " + id + " is closed");
  }

  private static void closeQuietly(DataSource ds, SQLException cause) {
    if (ds instanceof AutoCloseable c) {
      try {
        c.close();
      } catch (Exception e) {
        cause.addSuppressed(e);
      }
    }
  }

  private void debugSql(String op, String sql, List<Value> params) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.jdbc op={} paramCount={} handleId={} sql={}", op, params.size(), id, sql);

    // TRACE: variant and size only, never the value itself
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Value v : params) {
        int len = (v instanceof Value.TextValue t) ? t.value().length()
            : (v instanceof Value.BlobValue b) ? b.value().length : -1;
        log.trace("relata.jdbc param index={} type={} len={}", idx++, v.typeName(), len);
      }
    }
  }

  private void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.jdbc_done op={} handleId={} durationMs={} result={}",
        op, id, durationNanos / 1_000_000.0, result);
  }
}
