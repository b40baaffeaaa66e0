package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.model.TokenType;

/**
 * Turns {@code [name]} into {@code "name"}. Runs last so that earlier rules still see the
 * original bracket tokens.
 */
public class BracketIdentifierRule implements ConversionRule {

    public static final String ID = "bracket-identifier";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Replace bracketed identifiers with double-quoted identifiers";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size()) {
            SqlToken token = group.get(i);
            if (token.getType() == TokenType.BRACKET_IDENTIFIER) {
                i = group.replace(i, i + 1, quote(token.identifierName()), ID);
            } else {
                i++;
            }
        }
    }

    static String quote(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
}
