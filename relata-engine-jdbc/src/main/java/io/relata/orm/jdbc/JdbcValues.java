package io.relata.orm.jdbc;

import io.relata.orm.error.DecodeException;
import io.relata.orm.value.Value;

import java.math.BigDecimal;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * The one place where {@link Value}s meet JDBC types, in both directions.
 */
public final class JdbcValues {
  private JdbcValues() {}

  public static void bind(PreparedStatement ps, int index, Value v) throws SQLException {
    if (v == null || v instanceof Value.NullValue) {
      ps.setNull(index, Types.NULL);
    } else if (v instanceof Value.IntegerValue i) {
      ps.setLong(index, i.value());
    } else if (v instanceof Value.RealValue r) {
      ps.setDouble(index, r.value());
    } else if (v instanceof Value.TextValue t) {
      ps.setString(index, t.value());
    } else if (v instanceof Value.BlobValue b) {
      ps.setBytes(index, b.value());
    } else {
      throw new IllegalArgumentException("Unsupported value: " + v);
    }
  }

  public static void bindAll(PreparedStatement ps, List<Value> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      bind(ps, i + 1, params.get(i));
    }
  }

  /** Reads column {@code index} (1-based, as in JDBC) of the current row. */
  public static Value read(ResultSet rs, int index) throws SQLException {
    return toValue(rs.getObject(index));
  }

  public static List<String> columnLabels(ResultSetMetaData md) throws SQLException {
    int n = md.getColumnCount();
    List<String> out = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) out.add(md.getColumnLabel(i));
    return out;
  }

  static Value toValue(Object raw) {
    if (raw == null) return Value.NULL;
    if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return new Value.IntegerValue(((Number) raw).longValue());
    }
    if (raw instanceof Boolean b) return new Value.IntegerValue(b ? 1L : 0L);
    if (raw instanceof Double || raw instanceof Float) return new Value.RealValue(((Number) raw).doubleValue());
    if (raw instanceof BigDecimal bd) return new Value.RealValue(bd.doubleValue());
    if (raw instanceof String s) return new Value.TextValue(s);
    if (raw instanceof byte[] bytes) return new Value.BlobValue(bytes);
    if (raw instanceof Blob blob) {
      try {
        return new Value.BlobValue(blob.getBytes(1, (int) blob.length()));
      } catch (SQLException e) {
        throw new DecodeException("Failed to read BLOB column", e);
      }
    }
    if (raw instanceof Clob clob) {
      try {
        return new Value.TextValue(clob.getSubString(1, (int) clob.length()));
      } catch (SQLException e) {
        throw new DecodeException("Failed to read CLOB column", e);
      }
    }
    throw new DecodeException("Unsupported JDBC value type: " + raw.getClass().getName());
  }
}
