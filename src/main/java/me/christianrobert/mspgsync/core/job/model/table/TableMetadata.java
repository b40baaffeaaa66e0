package me.christianrobert.mspgsync.core.job.model.table;

import java.util.ArrayList;
import java.util.List;

/**
 * A source table with its columns, constraints and indexes. Built fresh each run.
 */
public class TableMetadata {
  private final String schema;
  private final String tableName;
  private final List<ColumnMetadata> columns = new ArrayList<>();
  private final List<ConstraintMetadata> constraints = new ArrayList<>();
  private final List<IndexMetadata> indexes = new ArrayList<>();

  public TableMetadata(String schema, String tableName) {
    this.schema = schema;
    this.tableName = tableName;
  }

  public String getSchema() { return schema; }
  public String getTableName() { return tableName; }
  public List<ColumnMetadata> getColumns() { return columns; }
  public List<ConstraintMetadata> getConstraints() { return constraints; }
  public List<IndexMetadata> getIndexes() { return indexes; }

  public void addColumn(ColumnMetadata column) { columns.add(column); }
  public void addConstraint(ConstraintMetadata constraint) { constraints.add(constraint); }
  public void addIndex(IndexMetadata index) { indexes.add(index); }

  /**
   * "schema.table" as named in the source.
   */
  public String getQualifiedName() {
    return schema + "." + tableName;
  }

  public ColumnMetadata findColumn(String columnName) {
    for (ColumnMetadata column : columns) {
      if (column.getColumnName().equalsIgnoreCase(columnName)) {
        return column;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "TableMetadata{" + getQualifiedName() + ", columns=" + columns.size()
        + ", constraints=" + constraints.size() + ", indexes=" + indexes.size() + "}";
  }
}
