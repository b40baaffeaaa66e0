package me.christianrobert.mspgsync.core.tools;

import java.util.Locale;
import java.util.Map;

/**
 * PostgreSQL equivalents of T-SQL built-in functions, shared by default value translation
 * and script conversion.
 */
public final class TsqlFunctionMappings {

    /** Functions called without arguments, replaced by a complete expression. */
    private static final Map<String, String> NO_ARGUMENT = Map.of(
            "getdate", "CURRENT_TIMESTAMP",
            "sysdatetime", "CURRENT_TIMESTAMP",
            "sysdatetimeoffset", "CURRENT_TIMESTAMP",
            "getutcdate", "(CURRENT_TIMESTAMP AT TIME ZONE 'UTC')",
            "sysutcdatetime", "(CURRENT_TIMESTAMP AT TIME ZONE 'UTC')",
            "newid", "gen_random_uuid()",
            "newsequentialid", "gen_random_uuid()",
            "suser_sname", "CURRENT_USER",
            "db_name", "current_database()");

    /** Functions with the same arguments under another name. */
    private static final Map<String, String> RENAMED = Map.of(
            "isnull", "COALESCE",
            "len", "LENGTH",
            "datalength", "OCTET_LENGTH");

    private TsqlFunctionMappings() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Replacement for a call of {@code functionName()} without arguments, or null.
     */
    public static String noArgumentCall(String functionName) {
        return NO_ARGUMENT.get(functionName.toLowerCase(Locale.ROOT));
    }

    /**
     * PostgreSQL name of a function taking the same arguments, or null.
     */
    public static String renamedFunction(String functionName) {
        return RENAMED.get(functionName.toLowerCase(Locale.ROOT));
    }
}
