package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.core.exception.ScriptConversionException;
import me.christianrobert.mspgsync.core.exception.UnknownTypeMappingException;
import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.model.TokenType;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Replaces SQL Server data types with their PostgreSQL mapping.
 *
 * <p>Only tokens in a type position are considered: after a column name in a column list,
 * after a variable, after {@code AS} in CAST, as the first argument of CONVERT and after
 * {@code RETURNS}. The type's parameters are part of the lookup, so "nvarchar(max)" resolves
 * through its own entry before the bare "nvarchar".</p>
 */
public class DataTypeRule implements ConversionRule {

    public static final String ID = "data-type";

    static final Set<String> SQL_SERVER_TYPES = Set.of(
            "bigint", "int", "smallint", "tinyint", "bit", "decimal", "numeric", "money", "smallmoney",
            "float", "real", "datetime", "datetime2", "smalldatetime", "date", "time", "datetimeoffset",
            "char", "varchar", "text", "nchar", "nvarchar", "ntext", "binary", "varbinary", "image",
            "uniqueidentifier", "xml", "sql_variant", "hierarchyid", "geography", "geometry",
            "rowversion", "timestamp", "sysname");

    private final TypeMappingTable mappingTable;

    public DataTypeRule(TypeMappingTable mappingTable) {
        this.mappingTable = mappingTable;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Map SQL Server data types through the type mapping table";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size()) {
            SqlToken token = group.get(i);
            String name = typeName(token);
            if (name == null || !isTypePosition(group, i) || isQualifier(group, i)) {
                i++;
                continue;
            }
            i = rewriteType(group, i, name);
        }
    }

    private int rewriteType(StatementGroup group, int index, String name) {
        SqlToken token = group.get(index);
        int end = index + 1;
        Integer precision = null;
        Integer scale = null;
        Integer length = null;

        int open = group.nextSignificant(index + 1);
        if (open >= 0 && group.get(open).isSymbol('(')) {
            int close = group.matchingParenthesis(open);
            List<String> params = close < 0 ? null : parameters(group, open, close);
            if (params != null) {
                end = close + 1;
                if (params.size() == 1 && params.get(0).equalsIgnoreCase("max")) {
                    length = -1;
                } else if (params.size() == 1 && TypeMappingTable.LENGTH_TYPES.contains(name)) {
                    length = parameterValue(token, name, params.get(0));
                } else if (params.size() == 1) {
                    precision = parameterValue(token, name, params.get(0));
                } else if (params.size() == 2) {
                    precision = parameterValue(token, name, params.get(0));
                    scale = parameterValue(token, name, params.get(1));
                }
            }
        }

        String target;
        try {
            target = mappingTable.resolve(name, precision, scale, length);
        } catch (UnknownTypeMappingException e) {
            group.warn(ID, token, "No type mapping for " + e.getSourceType() + ", type left unchanged");
            return end;
        }

        String original = group.text(index, end);
        if (TypeMappingTable.normalizeSignature(original).equals(TypeMappingTable.normalizeSignature(target))) {
            return end;
        }
        return group.replace(index, end, target, ID);
    }

    private static int parameterValue(SqlToken token, String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ScriptConversionException("Type parameter out of range for " + name + ": " + value,
                    token.getLine(), token.getColumn());
        }
    }

    /**
     * Numeric or "max" parameters between the parentheses, or null if there is anything else.
     */
    private List<String> parameters(StatementGroup group, int open, int close) {
        List<String> params = new ArrayList<>();
        boolean expectValue = true;
        for (int i = open + 1; i < close; i++) {
            SqlToken token = group.get(i);
            if (token.isTrivia()) {
                continue;
            }
            if (expectValue && (token.getType() == TokenType.NUMBER && token.getText().chars().allMatch(Character::isDigit)
                    || token.isWord("max"))) {
                params.add(token.getText());
                expectValue = false;
            } else if (!expectValue && token.isSymbol(',')) {
                expectValue = true;
            } else {
                return null;
            }
        }
        return params.isEmpty() || expectValue || params.size() > 2 ? null : params;
    }

    /**
     * Lower-case type name if the token could name a type this rule handles.
     */
    private String typeName(SqlToken token) {
        if (token.getType() != TokenType.WORD && token.getType() != TokenType.BRACKET_IDENTIFIER) {
            return null;
        }
        String name = token.identifierName().toLowerCase(Locale.ROOT);
        if (mappingTable.contains(name) || SQL_SERVER_TYPES.contains(name)) {
            return name;
        }
        return null;
    }

    private boolean isQualifier(StatementGroup group, int index) {
        return index + 1 < group.size() && group.get(index + 1).isSymbol('.');
    }

    static boolean isTypePosition(StatementGroup group, int index) {
        int prev = group.previousSignificant(index);
        SqlToken previous = group.significantAt(prev);
        if (previous == null) {
            return false;
        }

        if (previous.getType() == TokenType.VARIABLE || previous.isWord("RETURNS")) {
            return true;
        }
        if (previous.isWord("AS")) {
            SqlToken beforeAs = group.significantAt(group.previousSignificant(prev));
            return (beforeAs != null && beforeAs.getType() == TokenType.VARIABLE)
                    || isEnclosingCall(group, index, "CAST", "TRY_CAST");
        }
        if (previous.isSymbol('(')) {
            return isEnclosingCall(group, index, "CONVERT", "TRY_CONVERT");
        }
        if (previous.isIdentifier() && !isKeyword(previous)) {
            SqlToken beforeName = group.significantAt(group.previousSignificant(prev));
            if (beforeName == null) {
                return false;
            }
            if (beforeName.isWord("ADD") || beforeName.isWord("COLUMN")) {
                return true;
            }
            if (beforeName.isSymbol('(') || beforeName.isSymbol(',')) {
                int open = enclosingParenthesis(group, prev);
                SqlToken owner = group.significantAt(group.previousSignificant(open));
                return owner != null && (owner.isWord("TABLE") || (owner.isIdentifier() && !isKeyword(owner)
                        && isCreateOrDeclareTable(group, open)));
            }
        }
        return false;
    }

    private static boolean isEnclosingCall(StatementGroup group, int index, String... functions) {
        int open = enclosingParenthesis(group, index);
        SqlToken function = group.significantAt(group.previousSignificant(open));
        if (function == null) {
            return false;
        }
        for (String name : functions) {
            if (function.isWord(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the unclosed "(" before {@code index}, or -1.
     */
    private static int enclosingParenthesis(StatementGroup group, int index) {
        int depth = 0;
        for (int i = index - 1; i >= 0; i--) {
            SqlToken token = group.get(i);
            if (token.isSymbol(')')) {
                depth++;
            } else if (token.isSymbol('(')) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    /**
     * Whether the column list opened at {@code open} belongs to CREATE TABLE or a table variable.
     */
    private static boolean isCreateOrDeclareTable(StatementGroup group, int open) {
        for (int i = group.previousSignificant(open); i >= 0; i = group.previousSignificant(i)) {
            SqlToken token = group.get(i);
            if (token.isWord("TABLE")) {
                return true;
            }
            if (!token.isIdentifier() && !token.isSymbol('.')) {
                return false;
            }
        }
        return false;
    }

    private static final Set<String> KEYWORDS = Set.of(
            "select", "from", "where", "and", "or", "not", "null", "primary", "key", "foreign", "references",
            "constraint", "default", "check", "unique", "identity", "on", "set", "values", "table", "as",
            "collate", "is", "in", "exists", "returns", "begin", "end", "declare", "clustered", "nonclustered",
            "if", "else", "with", "insert", "update", "delete", "create", "drop", "alter", "exec", "print");

    static boolean isKeyword(SqlToken token) {
        return token.getType() == TokenType.WORD && KEYWORDS.contains(token.getText().toLowerCase(Locale.ROOT));
    }
}
