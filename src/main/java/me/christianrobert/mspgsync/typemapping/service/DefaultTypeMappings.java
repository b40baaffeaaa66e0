package me.christianrobert.mspgsync.typemapping.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default SQL Server to PostgreSQL catalog, written to disk when no mapping file exists.
 */
public final class DefaultTypeMappings {

    private static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();

        // Integers and boolean
        defaults.put("bigint", "BIGINT");
        defaults.put("int", "INTEGER");
        defaults.put("smallint", "SMALLINT");
        defaults.put("tinyint", "SMALLINT");
        defaults.put("bit", "BOOLEAN");

        // Exact and approximate numerics
        defaults.put("decimal", "DECIMAL");
        defaults.put("numeric", "NUMERIC");
        defaults.put("money", "NUMERIC(19,4)");
        defaults.put("smallmoney", "NUMERIC(10,4)");
        defaults.put("float", "DOUBLE PRECISION");
        defaults.put("real", "REAL");

        // Date and time
        defaults.put("datetime", "TIMESTAMPTZ");
        defaults.put("datetime2", "TIMESTAMPTZ");
        defaults.put("smalldatetime", "TIMESTAMPTZ");
        defaults.put("date", "DATE");
        defaults.put("time", "TIME");
        defaults.put("datetimeoffset", "TIMESTAMP WITH TIME ZONE");

        // Character data
        defaults.put("char", "CHAR");
        defaults.put("varchar", "VARCHAR");
        defaults.put("varchar(max)", "TEXT");
        defaults.put("text", "TEXT");
        defaults.put("nchar", "CHAR");
        defaults.put("nvarchar", "VARCHAR");
        defaults.put("nvarchar(max)", "TEXT");
        defaults.put("ntext", "TEXT");

        // Binary data
        defaults.put("binary", "BYTEA");
        defaults.put("varbinary", "BYTEA");
        defaults.put("varbinary(max)", "BYTEA");
        defaults.put("image", "BYTEA");

        // Special types
        defaults.put("uniqueidentifier", "UUID");
        defaults.put("xml", "XML");

        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private DefaultTypeMappings() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Map<String, String> get() {
        return DEFAULTS;
    }
}
