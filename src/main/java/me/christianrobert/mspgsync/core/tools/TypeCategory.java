package me.christianrobert.mspgsync.core.tools;

import java.util.Locale;

/**
 * Coarse type family shared by SQL Server and PostgreSQL types.
 *
 * <p>Used to compare a source column with its target column during verification and to pick
 * the value conversion during data transfer. Classification works on the bare type name of
 * either dialect ("nvarchar(50)", "character varying", "timestamp with time zone").</p>
 */
public enum TypeCategory {
    INTEGER,
    BOOLEAN,
    DECIMAL,
    FLOAT,
    DATETIME,
    DATE,
    TIME,
    TEXT,
    BINARY,
    UUID,
    XML,
    OTHER;

    public static TypeCategory classify(String typeExpression) {
        if (typeExpression == null || typeExpression.isBlank()) {
            return OTHER;
        }

        String type = baseName(typeExpression);
        switch (type) {
            case "bigint":
            case "int":
            case "integer":
            case "int2":
            case "int4":
            case "int8":
            case "smallint":
            case "tinyint":
            case "serial":
            case "bigserial":
                return INTEGER;
            case "bit":
            case "boolean":
            case "bool":
                return BOOLEAN;
            case "decimal":
            case "numeric":
            case "money":
            case "smallmoney":
                return DECIMAL;
            case "float":
            case "real":
            case "float4":
            case "float8":
            case "double precision":
                return FLOAT;
            case "datetime":
            case "datetime2":
            case "smalldatetime":
            case "datetimeoffset":
            case "timestamp":
            case "timestamptz":
            case "timestamp with time zone":
            case "timestamp without time zone":
                return DATETIME;
            case "date":
                return DATE;
            case "time":
            case "timetz":
            case "time with time zone":
            case "time without time zone":
                return TIME;
            case "char":
            case "varchar":
            case "nchar":
            case "nvarchar":
            case "text":
            case "ntext":
            case "character":
            case "character varying":
            case "bpchar":
            case "sysname":
                return TEXT;
            case "binary":
            case "varbinary":
            case "image":
            case "bytea":
                return BINARY;
            case "uniqueidentifier":
            case "uuid":
                return UUID;
            case "xml":
                return XML;
            default:
                return OTHER;
        }
    }

    /**
     * Whether a COLLATE clause can be applied to columns of this category.
     */
    public boolean isCollatable() {
        return this == TEXT;
    }

    /**
     * Lower-case type name without brackets, parameters and surrounding whitespace.
     */
    static String baseName(String typeExpression) {
        String type = typeExpression.trim().toLowerCase(Locale.ROOT).replace("[", "").replace("]", "");
        int paren = type.indexOf('(');
        if (paren >= 0) {
            String afterParams = type.substring(type.indexOf(')', paren) + 1).trim();
            type = type.substring(0, paren).trim();
            // "timestamp(3) with time zone"
            if (!afterParams.isEmpty()) {
                type = type + " " + afterParams;
            }
        }
        return type.replaceAll("\\s+", " ");
    }
}
