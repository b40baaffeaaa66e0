package me.christianrobert.mspgsync.core.job.model.table;

/**
 * A source column as read from the SQL Server catalog.
 * Immutable once introspected for a run.
 */
public class ColumnMetadata {

  /** Character length reported by SQL Server for (max) types. */
  public static final int MAX_LENGTH = -1;

  private final String columnName;
  private final String dataType;
  private final Integer characterLength;
  private final Integer numericPrecision;
  private final Integer numericScale;
  private final boolean nullable;
  private final boolean identity;
  private final long identitySeed;
  private final long identityIncrement;
  private final String defaultValue;
  private final int ordinalPosition;
  private final String collation;

  public ColumnMetadata(String columnName, String dataType, Integer characterLength,
                        Integer numericPrecision, Integer numericScale, boolean nullable,
                        String defaultValue, int ordinalPosition) {
    this(columnName, dataType, characterLength, numericPrecision, numericScale, nullable,
        false, 1, 1, defaultValue, ordinalPosition, null);
  }

  public ColumnMetadata(String columnName, String dataType, Integer characterLength,
                        Integer numericPrecision, Integer numericScale, boolean nullable,
                        boolean identity, long identitySeed, long identityIncrement,
                        String defaultValue, int ordinalPosition, String collation) {
    this.columnName = columnName;
    this.dataType = dataType;
    this.characterLength = characterLength;
    this.numericPrecision = numericPrecision;
    this.numericScale = numericScale;
    this.nullable = nullable;
    this.identity = identity;
    this.identitySeed = identitySeed;
    this.identityIncrement = identityIncrement;
    this.defaultValue = defaultValue;
    this.ordinalPosition = ordinalPosition;
    this.collation = collation;
  }

  public static ColumnMetadata identity(String columnName, String dataType, long seed, long increment,
                                        int ordinalPosition) {
    return new ColumnMetadata(columnName, dataType, null, null, null, false,
        true, seed, increment, null, ordinalPosition, null);
  }

  public String getColumnName() { return columnName; }
  public String getDataType() { return dataType; }
  public Integer getCharacterLength() { return characterLength; }
  public Integer getNumericPrecision() { return numericPrecision; }
  public Integer getNumericScale() { return numericScale; }
  public boolean isNullable() { return nullable; }
  public boolean isIdentity() { return identity; }
  public long getIdentitySeed() { return identitySeed; }
  public long getIdentityIncrement() { return identityIncrement; }
  public String getDefaultValue() { return defaultValue; }
  public int getOrdinalPosition() { return ordinalPosition; }
  public String getCollation() { return collation; }

  public boolean isMaxLength() {
    return characterLength != null && characterLength == MAX_LENGTH;
  }

  /**
   * Type signature as written in T-SQL, e.g. "nvarchar(max)", "decimal(18,2)", "int".
   */
  public String getTypeSignature() {
    String type = dataType.toLowerCase();
    if (characterLength != null && characterLength != 0) {
      return type + "(" + (isMaxLength() ? "max" : characterLength) + ")";
    }
    if (numericPrecision != null && numericScale != null) {
      return type + "(" + numericPrecision + "," + numericScale + ")";
    }
    return type;
  }

  @Override
  public String toString() {
    return "ColumnMetadata{name='" + columnName + "', type='" + getTypeSignature() + "', nullable=" + nullable
        + (identity ? ", identity" : "") + "}";
  }
}
