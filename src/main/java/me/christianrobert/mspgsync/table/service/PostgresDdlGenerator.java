package me.christianrobert.mspgsync.table.service;

import me.christianrobert.mspgsync.core.exception.UnknownTypeMappingException;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.GenerationWarning;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.mspgsync.core.tools.TypeCategory;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns an introspected SQL Server table into a PostgreSQL CREATE TABLE statement.
 *
 * <p>Per column: the type is resolved through the type mapping snapshot, identity columns
 * become {@code GENERATED ALWAYS|BY DEFAULT AS IDENTITY} on an integer type, and the default
 * expression is translated by {@link DefaultValueTransformer}. A column whose type has no
 * mapping is left out with a warning; so is a default that cannot be used. Constraints are
 * not part of the table definition, they are added after the data is loaded.</p>
 */
public class PostgresDdlGenerator {

    private static final Logger log = LoggerFactory.getLogger(PostgresDdlGenerator.class);

    private static final String IDENTITY_FALLBACK_TYPE = "BIGINT";

    private final TypeMappingTable typeMappings;
    private final boolean identityAlways;
    private final boolean lowercaseNames;

    public PostgresDdlGenerator(TypeMappingTable typeMappings, boolean identityAlways, boolean lowercaseNames) {
        this.typeMappings = typeMappings;
        this.identityAlways = identityAlways;
        this.lowercaseNames = lowercaseNames;
    }

    public TableDefinition generateCreateTable(TableMetadata table) {
        String targetSchema = PostgresIdentifierNormalizer.normalizeSchema(table.getSchema(), lowercaseNames);
        String targetTable = PostgresIdentifierNormalizer.normalizeName(table.getTableName(), lowercaseNames,
                table.getQualifiedName());

        List<ColumnMetadata> sourceColumns = new ArrayList<>(table.getColumns());
        sourceColumns.sort(Comparator.comparingInt(ColumnMetadata::getOrdinalPosition));

        List<ColumnMapping> mappings = new ArrayList<>();
        List<String> columnDefinitions = new ArrayList<>();
        List<GenerationWarning> warnings = new ArrayList<>();

        for (ColumnMetadata column : sourceColumns) {
            String targetColumn = PostgresIdentifierNormalizer.normalizeName(column.getColumnName(), lowercaseNames,
                    table.getQualifiedName() + "." + column.getColumnName());

            String targetType;
            try {
                targetType = typeMappings.resolve(column.getDataType(), column.getNumericPrecision(),
                        column.getNumericScale(), column.getCharacterLength());
            } catch (UnknownTypeMappingException e) {
                String warning = String.format("Column skipped: no type mapping for '%s'", e.getSourceType());
                warnings.add(new GenerationWarning(column.getColumnName(), warning));
                log.warn("{}.{}: {}", table.getQualifiedName(), column.getColumnName(), warning);
                continue;
            }

            StringBuilder definition = new StringBuilder();
            definition.append(PostgresIdentifierNormalizer.quote(targetColumn)).append(" ");

            if (column.isIdentity()) {
                if (TypeCategory.classify(targetType) != TypeCategory.INTEGER) {
                    targetType = IDENTITY_FALLBACK_TYPE;
                }
                definition.append(targetType).append(identityClause(column)).append(" NOT NULL");
            } else {
                definition.append(targetType);
                if (!column.isNullable()) {
                    definition.append(" NOT NULL");
                }
                String defaultClause = defaultClause(table, column, targetType, warnings);
                if (defaultClause != null) {
                    definition.append(" DEFAULT ").append(defaultClause);
                }
            }

            if (!targetColumn.equals(column.getColumnName())
                    && !targetColumn.equalsIgnoreCase(column.getColumnName().replace('-', '_'))) {
                warnings.add(new GenerationWarning(column.getColumnName(), "Column renamed to " + targetColumn));
            }

            columnDefinitions.add(definition.toString());
            mappings.add(new ColumnMapping(column, targetColumn, targetType));
        }

        if (mappings.isEmpty() && !sourceColumns.isEmpty()) {
            warnings.add(new GenerationWarning(null, "No column of this table could be mapped"));
        }

        String sql = "CREATE TABLE " + PostgresIdentifierNormalizer.quoteQualified(targetSchema, targetTable)
                + " (\n    " + String.join(",\n    ", columnDefinitions) + "\n)";

        return new TableDefinition(table, targetSchema, targetTable, mappings, sql, warnings);
    }

    private String identityClause(ColumnMetadata column) {
        StringBuilder clause = new StringBuilder(identityAlways
                ? " GENERATED ALWAYS AS IDENTITY"
                : " GENERATED BY DEFAULT AS IDENTITY");
        if (column.getIdentitySeed() != 1 || column.getIdentityIncrement() != 1) {
            clause.append(" (START WITH ").append(column.getIdentitySeed())
                    .append(" INCREMENT BY ").append(column.getIdentityIncrement()).append(")");
        }
        return clause.toString();
    }

    private String defaultClause(TableMetadata table, ColumnMetadata column, String targetType, List<GenerationWarning> warnings) {
        if (column.getDefaultValue() == null) {
            return null;
        }

        DefaultValueTransformer.TransformationResult result = DefaultValueTransformer.transform(
                column.getDefaultValue(), TypeCategory.classify(targetType),
                column.getColumnName(), table.getQualifiedName());

        if (result.isSkipped()) {
            warnings.add(new GenerationWarning(column.getColumnName(),
                    "Default skipped: " + result.getTransformationNote()));
            return null;
        }
        if (result.isPassedThrough()) {
            warnings.add(new GenerationWarning(column.getColumnName(),
                    "Default passed through verbatim: " + result.getTransformedValue()));
        }
        return result.getTransformedValue();
    }
}
