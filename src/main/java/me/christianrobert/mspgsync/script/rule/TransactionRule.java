package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.model.TokenType;

import java.util.Locale;

/**
 * {@code BEGIN TRAN[SACTION]}, {@code COMMIT TRAN[SACTION]} and {@code ROLLBACK TRAN[SACTION]}
 * become {@code BEGIN}, {@code COMMIT} and {@code ROLLBACK}. A transaction name on the same line
 * is dropped as well.
 */
public class TransactionRule implements ConversionRule {

    public static final String ID = "transaction";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Simplify transaction statements";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size()) {
            SqlToken token = group.get(i);
            if (!(token.isWord("BEGIN") || token.isWord("COMMIT") || token.isWord("ROLLBACK"))) {
                i++;
                continue;
            }
            int tran = group.nextSignificant(i + 1);
            if (tran < 0 || !(group.get(tran).isWord("TRAN") || group.get(tran).isWord("TRANSACTION"))) {
                i++;
                continue;
            }

            int end = tran + 1;
            int name = group.nextSignificant(end);
            if (name >= 0 && isTransactionName(group.get(tran), group.get(name))) {
                end = name + 1;
            }
            i = group.replace(i, end, token.getText().toUpperCase(Locale.ROOT), ID);
        }
    }

    private boolean isTransactionName(SqlToken tran, SqlToken candidate) {
        if (candidate.getLine() != tran.getLine()) {
            return false;
        }
        return candidate.getType() == TokenType.VARIABLE
                || candidate.getType() == TokenType.BRACKET_IDENTIFIER
                || (candidate.getType() == TokenType.WORD && !DataTypeRule.isKeyword(candidate));
    }
}
