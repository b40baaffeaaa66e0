package me.christianrobert.mspgsync.core.job.model.table;

import java.util.ArrayList;
import java.util.List;

/**
 * A primary key, unique, foreign key or check constraint of a source table.
 */
public class ConstraintMetadata {

  public static final String PRIMARY_KEY = "P";
  public static final String FOREIGN_KEY = "R";
  public static final String UNIQUE = "U";
  public static final String CHECK = "C";

  private final String constraintName;
  private final String constraintType;
  private final List<String> columnNames = new ArrayList<>();

  // Foreign key only
  private String referencedSchema;
  private String referencedTable;
  private final List<String> referencedColumns = new ArrayList<>();
  private String deleteRule = "NO ACTION";
  private String updateRule = "NO ACTION";

  // Check only, raw T-SQL predicate
  private String checkCondition;

  public ConstraintMetadata(String constraintName, String constraintType) {
    this.constraintName = constraintName;
    this.constraintType = constraintType;
  }

  public static ConstraintMetadata primaryKey(String name, List<String> columns) {
    ConstraintMetadata constraint = new ConstraintMetadata(name, PRIMARY_KEY);
    constraint.columnNames.addAll(columns);
    return constraint;
  }

  public static ConstraintMetadata unique(String name, List<String> columns) {
    ConstraintMetadata constraint = new ConstraintMetadata(name, UNIQUE);
    constraint.columnNames.addAll(columns);
    return constraint;
  }

  public static ConstraintMetadata foreignKey(String name, List<String> columns, String referencedSchema,
                                              String referencedTable, List<String> referencedColumns) {
    ConstraintMetadata constraint = new ConstraintMetadata(name, FOREIGN_KEY);
    constraint.columnNames.addAll(columns);
    constraint.referencedSchema = referencedSchema;
    constraint.referencedTable = referencedTable;
    constraint.referencedColumns.addAll(referencedColumns);
    return constraint;
  }

  public static ConstraintMetadata check(String name, String checkCondition) {
    ConstraintMetadata constraint = new ConstraintMetadata(name, CHECK);
    constraint.checkCondition = checkCondition;
    return constraint;
  }

  public String getConstraintName() { return constraintName; }
  public String getConstraintType() { return constraintType; }
  public List<String> getColumnNames() { return columnNames; }
  public String getReferencedSchema() { return referencedSchema; }
  public String getReferencedTable() { return referencedTable; }
  public List<String> getReferencedColumns() { return referencedColumns; }
  public String getDeleteRule() { return deleteRule; }
  public String getUpdateRule() { return updateRule; }
  public String getCheckCondition() { return checkCondition; }

  public void setDeleteRule(String deleteRule) { this.deleteRule = deleteRule; }
  public void setUpdateRule(String updateRule) { this.updateRule = updateRule; }

  public boolean isPrimaryKey() { return PRIMARY_KEY.equals(constraintType); }
  public boolean isForeignKey() { return FOREIGN_KEY.equals(constraintType); }
  public boolean isUniqueConstraint() { return UNIQUE.equals(constraintType); }
  public boolean isCheckConstraint() { return CHECK.equals(constraintType); }

  /**
   * "schema.table" of the referenced table for foreign keys.
   */
  public String getReferencedQualifiedName() {
    return referencedSchema + "." + referencedTable;
  }

  public String getConstraintTypeDisplay() {
    return switch (constraintType) {
      case PRIMARY_KEY -> "PRIMARY KEY";
      case FOREIGN_KEY -> "FOREIGN KEY";
      case UNIQUE -> "UNIQUE";
      case CHECK -> "CHECK";
      default -> "UNKNOWN";
    };
  }

  @Override
  public String toString() {
    return "ConstraintMetadata{name='" + constraintName + "', type=" + getConstraintTypeDisplay()
        + ", columns=" + columnNames + (isForeignKey() ? ", references=" + getReferencedQualifiedName() : "") + "}";
  }
}
