package me.christianrobert.mspgsync.core.job.model.table;

/**
 * Non-fatal issue found while generating a table definition, e.g. an unmapped column type.
 * The column name is null for table level warnings.
 */
public class GenerationWarning {
  private final String columnName;
  private final String message;

  public GenerationWarning(String columnName, String message) {
    this.columnName = columnName;
    this.message = message;
  }

  public String getColumnName() { return columnName; }
  public String getMessage() { return message; }

  @Override
  public String toString() {
    return columnName != null ? columnName + ": " + message : message;
  }
}
