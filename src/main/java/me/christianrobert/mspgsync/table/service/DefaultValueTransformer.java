package me.christianrobert.mspgsync.table.service;

import me.christianrobert.mspgsync.core.tools.TsqlFunctionMappings;
import me.christianrobert.mspgsync.core.tools.TypeCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transforms SQL Server column default values to PostgreSQL equivalents.
 *
 * <p>SQL Server stores defaults wrapped in parentheses, e.g. {@code ((0))}, {@code (getdate())}
 * or {@code (N'abc')}. The wrapping is removed, known functions are mapped and literals are
 * adjusted to the target type. Anything else is passed through verbatim and flagged so the
 * caller can record a warning.</p>
 */
public class DefaultValueTransformer {

    private static final Logger log = LoggerFactory.getLogger(DefaultValueTransformer.class);

    private static final Pattern NUMERIC_LITERAL = Pattern.compile("[-+]?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final Pattern UNICODE_STRING_LITERAL = Pattern.compile("(?s)[nN]('.*')");

    /**
     * Result of a default value transformation.
     */
    public static class TransformationResult {
        private final String transformedValue;
        private final boolean wasTransformed;
        private final boolean passedThrough;
        private final String originalValue;
        private final String transformationNote;

        public TransformationResult(String transformedValue, boolean wasTransformed, boolean passedThrough,
                                    String originalValue, String transformationNote) {
            this.transformedValue = transformedValue;
            this.wasTransformed = wasTransformed;
            this.passedThrough = passedThrough;
            this.originalValue = originalValue;
            this.transformationNote = transformationNote;
        }

        public String getTransformedValue() {
            return transformedValue;
        }

        public boolean wasTransformed() {
            return wasTransformed;
        }

        /**
         * Whether the expression was not recognized and is used verbatim.
         */
        public boolean isPassedThrough() {
            return passedThrough;
        }

        public String getOriginalValue() {
            return originalValue;
        }

        public String getTransformationNote() {
            return transformationNote;
        }

        public boolean isSkipped() {
            return transformedValue == null;
        }
    }

    /**
     * Transforms a SQL Server default expression.
     *
     * @param mssqlDefault   COLUMN_DEFAULT as reported by INFORMATION_SCHEMA
     * @param targetCategory category of the mapped PostgreSQL type
     * @param columnName     for logging
     * @param tableName      for logging
     */
    public static TransformationResult transform(String mssqlDefault, TypeCategory targetCategory,
                                                 String columnName, String tableName) {
        if (mssqlDefault == null || mssqlDefault.trim().isEmpty()) {
            return new TransformationResult(null, false, false, mssqlDefault, "No default value");
        }

        String original = mssqlDefault.trim();
        String value = stripOuterParentheses(original);

        if (value.equalsIgnoreCase("NULL")) {
            return new TransformationResult("NULL", false, false, original, "Explicit NULL");
        }

        if (NUMERIC_LITERAL.matcher(value).matches()) {
            if (targetCategory == TypeCategory.BOOLEAN) {
                String bool = isZero(value) ? "FALSE" : "TRUE";
                log.debug("Transformed bit default {} -> {} for {}.{}", value, bool, tableName, columnName);
                return new TransformationResult(bool, true, false, original, "bit literal -> boolean");
            }
            return new TransformationResult(value, !value.equals(original), false, original, "Numeric literal");
        }

        Matcher unicode = UNICODE_STRING_LITERAL.matcher(value);
        if (unicode.matches() && isSingleStringLiteral(unicode.group(1))) {
            return new TransformationResult(unicode.group(1), true, false, original, "N'...' -> '...'");
        }
        if (isSingleStringLiteral(value)) {
            if (targetCategory == TypeCategory.BOOLEAN) {
                String inner = value.substring(1, value.length() - 1).trim();
                if (inner.equals("0") || inner.equalsIgnoreCase("false")) {
                    return new TransformationResult("FALSE", true, false, original, "bit literal -> boolean");
                }
                if (inner.equals("1") || inner.equalsIgnoreCase("true")) {
                    return new TransformationResult("TRUE", true, false, original, "bit literal -> boolean");
                }
            }
            return new TransformationResult(value, !value.equals(original), false, original, "String literal");
        }

        String function = translateFunction(value);
        if (function != null) {
            log.debug("Transformed {} -> {} for {}.{}", value, function, tableName, columnName);
            return new TransformationResult(function, true, false, original, value + " -> " + function);
        }

        log.warn("Default value of {}.{} passed through verbatim: '{}'", tableName, columnName, value);
        return new TransformationResult(value, !value.equals(original), true, original,
                "Unrecognized expression passed through verbatim");
    }

    /**
     * CURRENT_TIMESTAMP or a known function called without arguments, e.g. "getdate()" or "newid ( )".
     */
    private static String translateFunction(String value) {
        String compact = value.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        if (compact.equals("current_timestamp")) {
            return "CURRENT_TIMESTAMP";
        }
        if (compact.endsWith("()") && compact.length() > 2) {
            return TsqlFunctionMappings.noArgumentCall(compact.substring(0, compact.length() - 2));
        }
        return null;
    }

    /**
     * Removes parentheses that enclose the whole expression: "((0))" -> "0", "(a)+(b)" unchanged.
     */
    static String stripOuterParentheses(String expression) {
        String value = expression.trim();
        while (value.length() >= 2 && value.charAt(0) == '(' && value.charAt(value.length() - 1) == ')'
                && closingParenthesis(value) == value.length() - 1) {
            value = value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    /**
     * Index of the parenthesis closing the one at position 0, ignoring parentheses in literals.
     */
    private static int closingParenthesis(String value) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'') {
                inString = !inString;
            } else if (!inString && c == '(') {
                depth++;
            } else if (!inString && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * 'abc' or 'it''s', but not 'a' + 'b'.
     */
    private static boolean isSingleStringLiteral(String value) {
        if (value.length() < 2 || value.charAt(0) != '\'' || value.charAt(value.length() - 1) != '\'') {
            return false;
        }
        String inner = value.substring(1, value.length() - 1);
        return !inner.replace("''", "").contains("'");
    }

    private static boolean isZero(String numericLiteral) {
        try {
            return Double.parseDouble(numericLiteral) == 0d;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
