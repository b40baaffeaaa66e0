package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.core.tools.TsqlFunctionMappings;
import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.model.TokenType;

import java.util.Locale;
import java.util.Set;

/**
 * Replaces T-SQL built-in function calls with their PostgreSQL equivalents,
 * e.g. GETDATE() with CURRENT_TIMESTAMP and ISNULL(a, b) with COALESCE(a, b).
 *
 * <p>A word followed by "(" is only treated as a call in expression position. After a keyword
 * that introduces an object name, after "." or after another identifier it names a table,
 * routine or alias, as in {@code FROM Len (NOLOCK)}.</p>
 */
public class FunctionRule implements ConversionRule {

    public static final String ID = "function";

    private static final Set<String> OBJECT_NAME_KEYWORDS = Set.of(
            "table", "into", "from", "join", "update", "references", "on", "procedure", "proc", "function",
            "view", "trigger", "index", "type");

    // keywords that may directly precede a function call
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "then", "when", "else", "case", "return", "by", "distinct", "top", "like", "between", "having",
            "while", "all", "any", "some", "escape", "over", "partition", "order", "group", "union", "print",
            "raiserror", "throw");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Replace T-SQL built-in functions";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size()) {
            SqlToken token = group.get(i);
            int open = token.getType() == TokenType.WORD ? group.nextSignificant(i + 1) : -1;
            if (open < 0 || !group.get(open).isSymbol('(') || !isCallPosition(group, i)) {
                i++;
                continue;
            }

            String replacement = TsqlFunctionMappings.noArgumentCall(token.getText());
            int close = group.nextSignificant(open + 1);
            if (replacement != null && close >= 0 && group.get(close).isSymbol(')')) {
                i = group.replace(i, close + 1, replacement, ID);
                continue;
            }

            String renamed = TsqlFunctionMappings.renamedFunction(token.getText());
            if (renamed != null) {
                i = group.replace(i, i + 1, renamed, ID);
                continue;
            }
            i++;
        }
    }

    private boolean isCallPosition(StatementGroup group, int index) {
        SqlToken previous = group.significantAt(group.previousSignificant(index));
        if (previous == null) {
            return true;
        }
        if (previous.isSymbol('.')) {
            return false;
        }
        if (previous.getType() == TokenType.BRACKET_IDENTIFIER || previous.getType() == TokenType.QUOTED_IDENTIFIER) {
            return false;
        }
        if (previous.getType() != TokenType.WORD) {
            return true;
        }
        String word = previous.getText().toLowerCase(Locale.ROOT);
        if (OBJECT_NAME_KEYWORDS.contains(word)) {
            return false;
        }
        return DataTypeRule.isKeyword(previous) || EXPRESSION_KEYWORDS.contains(word);
    }
}
