package io.relata.orm.migration;

import io.relata.orm.model.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Ready-made migrations for common schema changes. */
public final class MigrationTemplates {
  private MigrationTemplates() {}

  /** @param columns column name to full definition; iteration order is table order, so pass a LinkedHashMap */
  public static Migration createTable(String table, Map<String, String> columns) {
    if (columns == null || columns.isEmpty()) {
      throw new IllegalArgumentException("createTable " + table + " needs at least one column");
    }
    List<String> defs = new ArrayList<>(columns.size());
    for (Map.Entry<String, String> e : columns.entrySet()) defs.add(e.getKey() + " " + e.getValue());
    return new MigrationBuilder("create_table_" + table)
        .up("CREATE TABLE " + table + " (" + String.join(", ", defs) + ")")
        .down("DROP TABLE " + table)
        .build();
  }

  public static Migration addColumn(String table, String column, String definition) {
    return new MigrationBuilder("add_column_" + table + "_" + column)
        .up("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition)
        .down("ALTER TABLE " + table + " DROP COLUMN " + column)
        .build();
  }

  public static Migration dropColumn(String table, String column) {
    return new MigrationBuilder("drop_column_" + table + "_" + column)
        .up("ALTER TABLE " + table + " DROP COLUMN " + column)
        .build();
  }

  public static Migration createIndex(String index, String table, List<String> columns) {
    if (columns == null || columns.isEmpty()) {
      throw new IllegalArgumentException("createIndex " + index + " needs at least one column");
    }
    return new MigrationBuilder("create_index_" + index)
        .up("CREATE INDEX " + index + " ON " + table + " (" + String.join(", ", columns) + ")")
        .down("DROP INDEX " + index)
        .build();
  }

  public static Migration dropIndex(String index) {
    return new MigrationBuilder("drop_index_" + index)
        .up("DROP INDEX " + index)
        .build();
  }

  /** The model's own CREATE TABLE IF NOT EXISTS statement as a migration. */
  public static Migration forModel(Model<?> model) {
    return new MigrationBuilder("create_table_" + model.tableName())
        .up(model.migrationSql())
        .down("DROP TABLE IF EXISTS " + model.tableName())
        .build();
  }
}
