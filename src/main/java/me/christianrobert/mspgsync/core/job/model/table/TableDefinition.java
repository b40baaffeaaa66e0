package me.christianrobert.mspgsync.core.job.model.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Generated PostgreSQL table for one source table: target names, mapped columns,
 * the CREATE TABLE statement and warnings raised while generating it.
 */
public class TableDefinition {
  private final TableMetadata sourceTable;
  private final String targetSchema;
  private final String targetTableName;
  private final List<ColumnMapping> columns;
  private final String createTableSql;
  private final List<GenerationWarning> warnings;

  public TableDefinition(TableMetadata sourceTable, String targetSchema, String targetTableName,
                         List<ColumnMapping> columns, String createTableSql, List<GenerationWarning> warnings) {
    this.sourceTable = sourceTable;
    this.targetSchema = targetSchema;
    this.targetTableName = targetTableName;
    this.columns = List.copyOf(columns);
    this.createTableSql = createTableSql;
    this.warnings = new ArrayList<>(warnings);
  }

  public TableMetadata getSourceTable() { return sourceTable; }
  public String getTargetSchema() { return targetSchema; }
  public String getTargetTableName() { return targetTableName; }
  public List<ColumnMapping> getColumns() { return columns; }
  public String getCreateTableSql() { return createTableSql; }
  public List<GenerationWarning> getWarnings() { return warnings; }

  /**
   * "schema.table" in PostgreSQL naming, unquoted.
   */
  public String getTargetQualifiedName() {
    return targetSchema + "." + targetTableName;
  }

  public ColumnMapping findBySourceName(String sourceColumnName) {
    for (ColumnMapping column : columns) {
      if (column.getSourceName().equalsIgnoreCase(sourceColumnName)) {
        return column;
      }
    }
    return null;
  }
}
