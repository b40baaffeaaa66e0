package me.christianrobert.mspgsync.schema.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.exception.IntrospectionException;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintMetadata;
import me.christianrobert.mspgsync.core.job.model.table.IndexMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.database.service.SqlServerConnectionService;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads tables, columns, constraints and indexes from the SQL Server catalog.
 *
 * Read-only against the source. Each catalog view is queried once for all tables and the rows
 * are attached to their table; table order follows schema and name but carries no dependency
 * meaning. Any SQL failure (connectivity, missing VIEW DEFINITION permission) surfaces as
 * {@link IntrospectionException}, which is fatal for the run.
 */
@ApplicationScoped
public class SqlServerSchemaIntrospector {

  private static final Logger log = LoggerFactory.getLogger(SqlServerSchemaIntrospector.class);

  private static final Set<String> SYSTEM_SCHEMAS = Set.of("sys", "information_schema", "guest");
  private static final Set<String> SYSTEM_TABLES = Set.of("sysdiagrams");
  private static final Set<String> PRECISION_TYPES = Set.of("decimal", "numeric");

  private static final String TABLES_SQL = """
      SELECT TABLE_SCHEMA, TABLE_NAME
      FROM INFORMATION_SCHEMA.TABLES
      WHERE TABLE_TYPE = 'BASE TABLE'
      ORDER BY TABLE_SCHEMA, TABLE_NAME
      """;

  private static final String COLUMNS_SQL = """
      SELECT
          c.TABLE_SCHEMA,
          c.TABLE_NAME,
          c.COLUMN_NAME,
          c.DATA_TYPE,
          c.CHARACTER_MAXIMUM_LENGTH,
          c.NUMERIC_PRECISION,
          c.NUMERIC_SCALE,
          c.IS_NULLABLE,
          c.COLUMN_DEFAULT,
          c.ORDINAL_POSITION,
          c.COLLATION_NAME,
          COLUMNPROPERTY(OBJECT_ID(QUOTENAME(c.TABLE_SCHEMA) + '.' + QUOTENAME(c.TABLE_NAME)),
                         c.COLUMN_NAME, 'IsIdentity') AS IS_IDENTITY,
          IDENT_SEED(QUOTENAME(c.TABLE_SCHEMA) + '.' + QUOTENAME(c.TABLE_NAME)) AS IDENTITY_SEED,
          IDENT_INCR(QUOTENAME(c.TABLE_SCHEMA) + '.' + QUOTENAME(c.TABLE_NAME)) AS IDENTITY_INCREMENT
      FROM INFORMATION_SCHEMA.COLUMNS c
      JOIN INFORMATION_SCHEMA.TABLES t
        ON t.TABLE_SCHEMA = c.TABLE_SCHEMA AND t.TABLE_NAME = c.TABLE_NAME
      WHERE t.TABLE_TYPE = 'BASE TABLE'
      ORDER BY c.TABLE_SCHEMA, c.TABLE_NAME, c.ORDINAL_POSITION
      """;

  private static final String KEY_CONSTRAINTS_SQL = """
      SELECT
          tc.TABLE_SCHEMA,
          tc.TABLE_NAME,
          tc.CONSTRAINT_NAME,
          tc.CONSTRAINT_TYPE,
          kcu.COLUMN_NAME
      FROM INFORMATION_SCHEMA.TABLE_CONSTRAINTS tc
      JOIN INFORMATION_SCHEMA.KEY_COLUMN_USAGE kcu
        ON tc.CONSTRAINT_SCHEMA = kcu.CONSTRAINT_SCHEMA
       AND tc.CONSTRAINT_NAME = kcu.CONSTRAINT_NAME
       AND tc.TABLE_NAME = kcu.TABLE_NAME
      WHERE tc.CONSTRAINT_TYPE IN ('PRIMARY KEY', 'UNIQUE')
      ORDER BY tc.TABLE_SCHEMA, tc.TABLE_NAME, tc.CONSTRAINT_NAME, kcu.ORDINAL_POSITION
      """;

  private static final String FOREIGN_KEYS_SQL = """
      SELECT
          OBJECT_SCHEMA_NAME(fk.parent_object_id) AS TABLE_SCHEMA,
          OBJECT_NAME(fk.parent_object_id) AS TABLE_NAME,
          fk.name AS CONSTRAINT_NAME,
          COL_NAME(fkc.parent_object_id, fkc.parent_column_id) AS COLUMN_NAME,
          OBJECT_SCHEMA_NAME(fk.referenced_object_id) AS REFERENCED_SCHEMA,
          OBJECT_NAME(fk.referenced_object_id) AS REFERENCED_TABLE,
          COL_NAME(fkc.referenced_object_id, fkc.referenced_column_id) AS REFERENCED_COLUMN,
          fk.delete_referential_action_desc AS DELETE_RULE,
          fk.update_referential_action_desc AS UPDATE_RULE
      FROM sys.foreign_keys fk
      JOIN sys.foreign_key_columns fkc ON fk.object_id = fkc.constraint_object_id
      ORDER BY TABLE_SCHEMA, TABLE_NAME, fk.name, fkc.constraint_column_id
      """;

  private static final String CHECK_CONSTRAINTS_SQL = """
      SELECT
          OBJECT_SCHEMA_NAME(cc.parent_object_id) AS TABLE_SCHEMA,
          OBJECT_NAME(cc.parent_object_id) AS TABLE_NAME,
          cc.name AS CONSTRAINT_NAME,
          cc.definition AS DEFINITION
      FROM sys.check_constraints cc
      WHERE cc.is_disabled = 0
      ORDER BY TABLE_SCHEMA, TABLE_NAME, cc.name
      """;

  private static final String INDEXES_SQL = """
      SELECT
          OBJECT_SCHEMA_NAME(i.object_id) AS TABLE_SCHEMA,
          OBJECT_NAME(i.object_id) AS TABLE_NAME,
          i.name AS INDEX_NAME,
          i.is_unique AS IS_UNIQUE,
          i.filter_definition AS FILTER_DEFINITION,
          c.name AS COLUMN_NAME,
          ic.is_descending_key AS IS_DESCENDING
      FROM sys.indexes i
      JOIN sys.index_columns ic ON i.object_id = ic.object_id AND i.index_id = ic.index_id
      JOIN sys.columns c ON ic.object_id = c.object_id AND ic.column_id = c.column_id
      JOIN sys.tables t ON t.object_id = i.object_id
      WHERE i.is_primary_key = 0
        AND i.is_unique_constraint = 0
        AND i.is_hypothetical = 0
        AND i.is_disabled = 0
        AND i.type IN (1, 2)
        AND ic.is_included_column = 0
        AND t.is_ms_shipped = 0
      ORDER BY TABLE_SCHEMA, TABLE_NAME, i.name, ic.key_ordinal
      """;

  @Inject
  SqlServerConnectionService sqlServerConnectionService;

  @Inject
  ConfigService configService;

  /**
   * Introspects the configured source database, restricted to the configured schemas.
   */
  public List<TableMetadata> introspect() {
    List<String> schemaFilter = configService.getConfigValueAsStringList(ConfigService.SOURCE_SCHEMAS);
    try (Connection connection = sqlServerConnectionService.getConnection()) {
      return listTables(connection, schemaFilter);
    } catch (SQLException e) {
      throw new IntrospectionException("Cannot connect to SQL Server: " + e.getMessage(), e);
    }
  }

  /**
   * Lists all base tables with their columns, constraints and indexes.
   *
   * @param schemaFilter source schemas to include (case-insensitive); empty means all non-system schemas
   */
  public List<TableMetadata> listTables(Connection connection, List<String> schemaFilter) {
    try {
      Map<String, TableMetadata> tables = fetchTables(connection, schemaFilter);
      fetchColumns(connection, tables);
      fetchKeyConstraints(connection, tables);
      fetchForeignKeys(connection, tables);
      fetchCheckConstraints(connection, tables);
      fetchIndexes(connection, tables);

      log.info("Introspected {} tables from SQL Server (schemas: {})", tables.size(),
          schemaFilter == null || schemaFilter.isEmpty() ? "all" : schemaFilter);
      return new ArrayList<>(tables.values());
    } catch (SQLException e) {
      throw new IntrospectionException("Failed to read SQL Server catalog: " + e.getMessage(), e);
    }
  }

  private Map<String, TableMetadata> fetchTables(Connection connection, List<String> schemaFilter) throws SQLException {
    Map<String, TableMetadata> tables = new LinkedHashMap<>();
    try (PreparedStatement ps = connection.prepareStatement(TABLES_SQL);
         ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        String schema = rs.getString("TABLE_SCHEMA");
        String table = rs.getString("TABLE_NAME");
        if (isIncluded(schema, table, schemaFilter)) {
          tables.put(key(schema, table), new TableMetadata(schema, table));
        }
      }
    }
    return tables;
  }

  static boolean isIncluded(String schema, String table, List<String> schemaFilter) {
    String lowerSchema = schema.toLowerCase(Locale.ROOT);
    if (SYSTEM_SCHEMAS.contains(lowerSchema) || SYSTEM_TABLES.contains(table.toLowerCase(Locale.ROOT))) {
      return false;
    }
    if (schemaFilter == null || schemaFilter.isEmpty()) {
      return true;
    }
    return schemaFilter.stream().anyMatch(s -> s.equalsIgnoreCase(schema));
  }

  private void fetchColumns(Connection connection, Map<String, TableMetadata> tables) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(COLUMNS_SQL);
         ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        TableMetadata table = tables.get(key(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME")));
        if (table == null) {
          continue;
        }

        String dataType = rs.getString("DATA_TYPE").toLowerCase(Locale.ROOT);
        Integer length = getInteger(rs, "CHARACTER_MAXIMUM_LENGTH");
        Integer precision = getInteger(rs, "NUMERIC_PRECISION");
        Integer scale = getInteger(rs, "NUMERIC_SCALE");

        // INFORMATION_SCHEMA reports lengths for text/xml and precisions for int types too
        if (!TypeMappingTable.LENGTH_TYPES.contains(dataType)) {
          length = null;
        }
        if (!PRECISION_TYPES.contains(dataType)) {
          precision = null;
          scale = null;
        }

        boolean identity = rs.getInt("IS_IDENTITY") == 1;
        long seed = identity ? getLong(rs, "IDENTITY_SEED", 1) : 1;
        long increment = identity ? getLong(rs, "IDENTITY_INCREMENT", 1) : 1;

        String defaultValue = rs.getString("COLUMN_DEFAULT");
        ColumnMetadata column = new ColumnMetadata(
            rs.getString("COLUMN_NAME"),
            dataType,
            length,
            precision,
            scale,
            "YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")),
            identity,
            seed,
            increment,
            defaultValue != null ? defaultValue.trim() : null,
            rs.getInt("ORDINAL_POSITION"),
            rs.getString("COLLATION_NAME"));
        table.addColumn(column);
      }
    }
  }

  private void fetchKeyConstraints(Connection connection, Map<String, TableMetadata> tables) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(KEY_CONSTRAINTS_SQL);
         ResultSet rs = ps.executeQuery()) {
      ConstraintMetadata current = null;
      String currentKey = null;
      while (rs.next()) {
        TableMetadata table = tables.get(key(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME")));
        if (table == null) {
          continue;
        }
        String name = rs.getString("CONSTRAINT_NAME");
        String constraintKey = table.getQualifiedName() + "." + name;
        if (!constraintKey.equals(currentKey)) {
          current = "PRIMARY KEY".equals(rs.getString("CONSTRAINT_TYPE"))
              ? ConstraintMetadata.primaryKey(name, new ArrayList<>())
              : ConstraintMetadata.unique(name, new ArrayList<>());
          table.addConstraint(current);
          currentKey = constraintKey;
        }
        current.getColumnNames().add(rs.getString("COLUMN_NAME"));
      }
    }
  }

  private void fetchForeignKeys(Connection connection, Map<String, TableMetadata> tables) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(FOREIGN_KEYS_SQL);
         ResultSet rs = ps.executeQuery()) {
      ConstraintMetadata current = null;
      String currentKey = null;
      while (rs.next()) {
        TableMetadata table = tables.get(key(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME")));
        if (table == null) {
          continue;
        }
        String name = rs.getString("CONSTRAINT_NAME");
        String constraintKey = table.getQualifiedName() + "." + name;
        if (!constraintKey.equals(currentKey)) {
          current = ConstraintMetadata.foreignKey(name, new ArrayList<>(),
              rs.getString("REFERENCED_SCHEMA"), rs.getString("REFERENCED_TABLE"), new ArrayList<>());
          current.setDeleteRule(toReferentialAction(rs.getString("DELETE_RULE")));
          current.setUpdateRule(toReferentialAction(rs.getString("UPDATE_RULE")));
          table.addConstraint(current);
          currentKey = constraintKey;
        }
        current.getColumnNames().add(rs.getString("COLUMN_NAME"));
        current.getReferencedColumns().add(rs.getString("REFERENCED_COLUMN"));
      }
    }
  }

  /**
   * "SET_NULL" -> "SET NULL".
   */
  static String toReferentialAction(String actionDesc) {
    if (actionDesc == null || actionDesc.isBlank()) {
      return "NO ACTION";
    }
    return actionDesc.trim().replace('_', ' ').toUpperCase(Locale.ROOT);
  }

  private void fetchCheckConstraints(Connection connection, Map<String, TableMetadata> tables) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(CHECK_CONSTRAINTS_SQL);
         ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        TableMetadata table = tables.get(key(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME")));
        if (table != null) {
          table.addConstraint(ConstraintMetadata.check(rs.getString("CONSTRAINT_NAME"), rs.getString("DEFINITION")));
        }
      }
    }
  }

  private void fetchIndexes(Connection connection, Map<String, TableMetadata> tables) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(INDEXES_SQL);
         ResultSet rs = ps.executeQuery()) {
      IndexMetadata current = null;
      String currentKey = null;
      while (rs.next()) {
        TableMetadata table = tables.get(key(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME")));
        if (table == null) {
          continue;
        }
        String name = rs.getString("INDEX_NAME");
        String indexKey = table.getQualifiedName() + "." + name;
        if (!indexKey.equals(currentKey)) {
          current = new IndexMetadata(name, rs.getBoolean("IS_UNIQUE"), rs.getString("FILTER_DEFINITION"));
          table.addIndex(current);
          currentKey = indexKey;
        }
        current.addColumn(rs.getString("COLUMN_NAME"), rs.getBoolean("IS_DESCENDING"));
      }
    }
  }

  private static String key(String schema, String table) {
    return (schema + "." + table).toLowerCase(Locale.ROOT);
  }

  private static Integer getInteger(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  private static long getLong(ResultSet rs, String column, long defaultValue) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? defaultValue : value;
  }
}
