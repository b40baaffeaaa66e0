package me.christianrobert.mspgsync.constraint.service;

import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintMetadata;
import me.christianrobert.mspgsync.core.job.model.table.IndexMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the PostgreSQL DDL for constraints and indexes of a migrated table.
 *
 * Column names are taken from the table definition of step 1, so renamed or shortened columns
 * are referenced by their target names. Constraint and index names go through the same
 * normalization as tables; names over 63 bytes get a hash suffix computed from the qualified
 * source name.
 */
public class ConstraintSqlBuilder {

    private static final Set<String> REFERENTIAL_ACTIONS = Set.of(
            "NO ACTION", "CASCADE", "SET NULL", "SET DEFAULT", "RESTRICT");

    private final boolean lowercaseNames;

    public ConstraintSqlBuilder(boolean lowercaseNames) {
        this.lowercaseNames = lowercaseNames;
    }

    public String targetConstraintName(TableDefinition table, String sourceName) {
        return PostgresIdentifierNormalizer.normalizeName(sourceName, lowercaseNames,
                table.getSourceTable().getQualifiedName() + "." + sourceName);
    }

    public String primaryKeySql(TableDefinition table, ConstraintMetadata constraint) {
        return String.format("ALTER TABLE %s ADD CONSTRAINT %s PRIMARY KEY (%s)",
                qualifiedTable(table),
                PostgresIdentifierNormalizer.quote(targetConstraintName(table, constraint.getConstraintName())),
                columnList(table, constraint.getColumnNames()));
    }

    public String uniqueSql(TableDefinition table, ConstraintMetadata constraint) {
        return String.format("ALTER TABLE %s ADD CONSTRAINT %s UNIQUE (%s)",
                qualifiedTable(table),
                PostgresIdentifierNormalizer.quote(targetConstraintName(table, constraint.getConstraintName())),
                columnList(table, constraint.getColumnNames()));
    }

    /**
     * @param referenced definition of the referenced table, or null if it was not part of this run;
     *                   then the referenced names are normalized the same way the DDL generator does
     */
    public String foreignKeySql(TableDefinition table, ConstraintMetadata constraint, TableDefinition referenced) {
        String referencedTable;
        String referencedColumns;
        if (referenced != null) {
            referencedTable = qualifiedTable(referenced);
            referencedColumns = columnList(referenced, constraint.getReferencedColumns());
        } else {
            String qualifiedOriginal = constraint.getReferencedQualifiedName();
            referencedTable = PostgresIdentifierNormalizer.quoteQualified(
                    PostgresIdentifierNormalizer.normalizeSchema(constraint.getReferencedSchema(), lowercaseNames),
                    PostgresIdentifierNormalizer.normalizeName(constraint.getReferencedTable(), lowercaseNames,
                            qualifiedOriginal));
            List<String> quoted = new ArrayList<>();
            for (String column : constraint.getReferencedColumns()) {
                quoted.add(PostgresIdentifierNormalizer.quote(PostgresIdentifierNormalizer.normalizeName(
                        column, lowercaseNames, qualifiedOriginal + "." + column)));
            }
            referencedColumns = String.join(", ", quoted);
        }

        return String.format("ALTER TABLE %s ADD CONSTRAINT %s FOREIGN KEY (%s) REFERENCES %s (%s) ON DELETE %s ON UPDATE %s",
                qualifiedTable(table),
                PostgresIdentifierNormalizer.quote(targetConstraintName(table, constraint.getConstraintName())),
                columnList(table, constraint.getColumnNames()),
                referencedTable,
                referencedColumns,
                referentialAction(constraint.getDeleteRule()),
                referentialAction(constraint.getUpdateRule()));
    }

    public String checkSql(TableDefinition table, ConstraintMetadata constraint) {
        String predicate = CheckConstraintTranslator.translate(constraint.getCheckCondition(), table);
        return String.format("ALTER TABLE %s ADD CONSTRAINT %s CHECK (%s)",
                qualifiedTable(table),
                PostgresIdentifierNormalizer.quote(targetConstraintName(table, constraint.getConstraintName())),
                predicate);
    }

    /**
     * CREATE [UNIQUE] INDEX, partial when the source index is filtered.
     */
    public String indexSql(TableDefinition table, IndexMetadata index) {
        List<String> columns = new ArrayList<>();
        for (int i = 0; i < index.getColumnNames().size(); i++) {
            String column = targetColumn(table, index.getColumnNames().get(i));
            columns.add(PostgresIdentifierNormalizer.quote(column) + (index.isDescending(i) ? " DESC" : ""));
        }

        StringBuilder sql = new StringBuilder("CREATE ");
        if (index.isUnique()) {
            sql.append("UNIQUE ");
        }
        sql.append("INDEX ")
                .append(PostgresIdentifierNormalizer.quote(targetConstraintName(table, index.getIndexName())))
                .append(" ON ").append(qualifiedTable(table))
                .append(" (").append(String.join(", ", columns)).append(')');
        if (index.isFiltered()) {
            sql.append(" WHERE ").append(CheckConstraintTranslator.translate(index.getFilterDefinition(), table));
        }
        return sql.toString();
    }

    static String referentialAction(String rule) {
        if (rule == null) {
            return "NO ACTION";
        }
        String normalized = rule.trim().replace('_', ' ').toUpperCase(Locale.ROOT);
        return REFERENTIAL_ACTIONS.contains(normalized) ? normalized : "NO ACTION";
    }

    private String qualifiedTable(TableDefinition table) {
        return PostgresIdentifierNormalizer.quoteQualified(table.getTargetSchema(), table.getTargetTableName());
    }

    private String columnList(TableDefinition table, List<String> sourceColumns) {
        List<String> quoted = new ArrayList<>();
        for (String column : sourceColumns) {
            quoted.add(PostgresIdentifierNormalizer.quote(targetColumn(table, column)));
        }
        return String.join(", ", quoted);
    }

    private String targetColumn(TableDefinition table, String sourceColumn) {
        ColumnMapping mapping = table.findBySourceName(sourceColumn);
        if (mapping == null) {
            throw new IllegalArgumentException(String.format("Column %s is not part of target table %s",
                    sourceColumn, table.getTargetQualifiedName()));
        }
        return mapping.getTargetName();
    }
}
