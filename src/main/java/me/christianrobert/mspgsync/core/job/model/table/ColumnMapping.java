package me.christianrobert.mspgsync.core.job.model.table;

/**
 * Correspondence between a source column and its generated PostgreSQL column.
 */
public class ColumnMapping {
  private final ColumnMetadata sourceColumn;
  private final String targetName;
  private final String targetType;

  public ColumnMapping(ColumnMetadata sourceColumn, String targetName, String targetType) {
    this.sourceColumn = sourceColumn;
    this.targetName = targetName;
    this.targetType = targetType;
  }

  public ColumnMetadata getSourceColumn() { return sourceColumn; }
  public String getSourceName() { return sourceColumn.getColumnName(); }
  public String getTargetName() { return targetName; }
  public String getTargetType() { return targetType; }

  public boolean isRenamed() {
    return !sourceColumn.getColumnName().equals(targetName);
  }

  @Override
  public String toString() {
    return sourceColumn.getColumnName() + " -> " + targetName + " " + targetType;
  }
}
