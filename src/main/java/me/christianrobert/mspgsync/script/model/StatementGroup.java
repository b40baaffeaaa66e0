package me.christianrobert.mspgsync.script.model;

import me.christianrobert.mspgsync.core.job.model.script.AppliedChange;
import me.christianrobert.mspgsync.script.service.SqlTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * The tokens of one batch while the conversion rules rewrite it.
 *
 * <p>Rules edit the group only through {@link #replace}, which records an {@link AppliedChange}
 * for every edit. Replacement text is tokenized again, so later rules see rewritten text as
 * ordinary tokens positioned at the start of the replaced range.</p>
 */
public class StatementGroup {

    private final List<SqlToken> tokens;
    private final List<AppliedChange> changes;
    private final List<String> warnings;

    public StatementGroup(List<SqlToken> tokens, List<AppliedChange> changes, List<String> warnings) {
        this.tokens = new ArrayList<>(tokens);
        this.changes = changes;
        this.warnings = warnings;
    }

    public int size() {
        return tokens.size();
    }

    public SqlToken get(int index) {
        return tokens.get(index);
    }

    public List<SqlToken> getTokens() {
        return List.copyOf(tokens);
    }

    /**
     * Index of the first non-trivia token at or after {@code from}, or -1.
     */
    public int nextSignificant(int from) {
        for (int i = Math.max(0, from); i < tokens.size(); i++) {
            if (!tokens.get(i).isTrivia()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the last non-trivia token before {@code before}, or -1.
     */
    public int previousSignificant(int before) {
        for (int i = Math.min(before, tokens.size()) - 1; i >= 0; i--) {
            if (!tokens.get(i).isTrivia()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Significant token at {@code index}, or null when the index is -1.
     */
    public SqlToken significantAt(int index) {
        return index < 0 ? null : tokens.get(index);
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, or -1 if unbalanced.
     */
    public int matchingParenthesis(int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol('(')) {
                depth++;
            } else if (token.isSymbol(')')) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public String text(int from, int toExclusive) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < toExclusive; i++) {
            sb.append(tokens.get(i).getText());
        }
        return sb.toString();
    }

    public String toText() {
        return text(0, tokens.size());
    }

    /**
     * Replaces tokens {@code [from, toExclusive)} with the tokens of {@code replacement}.
     *
     * @return index of the first token after the inserted ones
     */
    public int replace(int from, int toExclusive, String replacement, String ruleId) {
        SqlToken first = tokens.get(from);
        String before = text(from, toExclusive);

        List<SqlToken> inserted = new ArrayList<>();
        for (SqlToken token : SqlTokenizer.tokenize(replacement)) {
            inserted.add(token.withPosition(first.getLine(), first.getColumn()));
        }

        tokens.subList(from, toExclusive).clear();
        tokens.addAll(from, inserted);
        changes.add(new AppliedChange(ruleId, first.getLine(), first.getColumn(), before, replacement));
        return from + inserted.size();
    }

    public void warn(String ruleId, SqlToken at, String message) {
        warnings.add(String.format("%s at line %d, column %d: %s", ruleId, at.getLine(), at.getColumn(), message));
    }

    /**
     * Whether the group holds nothing but whitespace and comments.
     */
    public boolean isBlank() {
        return nextSignificant(0) < 0;
    }
}
