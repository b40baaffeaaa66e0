package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.core.job.model.script.AppliedChange;
import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script at its {@code GO} lines. Runs before every other rule since the others work
 * on one statement group at a time.
 *
 * <p>A separator is the word GO, optionally followed by a repeat count, alone on its line apart
 * from whitespace and comments. N separators give N+1 groups, except that a separator at the
 * end of the script does not open an empty last group.</p>
 */
public class BatchSeparatorRule {

    public static final String ID = "batch-separator";

    /**
     * Token ranges of the groups and whether each was closed by a separator.
     */
    public static class Batch {
        private final List<SqlToken> tokens;
        private final boolean terminated;

        Batch(List<SqlToken> tokens, boolean terminated) {
            this.tokens = tokens;
            this.terminated = terminated;
        }

        public List<SqlToken> getTokens() {
            return tokens;
        }

        public boolean isTerminated() {
            return terminated;
        }
    }

    public List<Batch> split(List<SqlToken> tokens, List<AppliedChange> changes) {
        List<Batch> batches = new ArrayList<>();
        int groupStart = 0;
        int i = 0;
        while (i < tokens.size()) {
            int separatorEnd = separatorEndAt(tokens, i);
            if (separatorEnd < 0) {
                i++;
                continue;
            }
            SqlToken go = tokens.get(i);
            changes.add(new AppliedChange(ID, go.getLine(), go.getColumn(),
                    joinText(tokens, i, separatorEnd).trim(), ";"));
            batches.add(new Batch(new ArrayList<>(tokens.subList(groupStart, i)), true));
            groupStart = separatorEnd;
            i = separatorEnd;
        }

        List<SqlToken> rest = new ArrayList<>(tokens.subList(groupStart, tokens.size()));
        boolean restIsBlank = rest.stream().allMatch(SqlToken::isTrivia);
        if (batches.isEmpty() || !restIsBlank) {
            batches.add(new Batch(rest, false));
        }
        return batches;
    }

    /**
     * End index (exclusive, up to and excluding the line break) of a separator starting at
     * {@code index}, or -1 if the token there does not start one.
     */
    private int separatorEndAt(List<SqlToken> tokens, int index) {
        if (!tokens.get(index).isWord("GO") || !startsLine(tokens, index)) {
            return -1;
        }
        int i = index + 1;
        i = skipInlineTrivia(tokens, i);
        if (i < tokens.size() && tokens.get(i).getType() == TokenType.NUMBER) {
            i = skipInlineTrivia(tokens, i + 1);
        }
        if (i < tokens.size() && !containsLineBreak(tokens.get(i))) {
            return -1;
        }
        return i;
    }

    private boolean startsLine(List<SqlToken> tokens, int index) {
        for (int i = index - 1; i >= 0; i--) {
            SqlToken token = tokens.get(i);
            if (containsLineBreak(token)) {
                return true;
            }
            if (token.getType() != TokenType.WHITESPACE && token.getType() != TokenType.BLOCK_COMMENT) {
                return false;
            }
        }
        return true;
    }

    /**
     * Skips whitespace without line breaks and comments on the same line.
     */
    private int skipInlineTrivia(List<SqlToken> tokens, int from) {
        int i = from;
        while (i < tokens.size()) {
            SqlToken token = tokens.get(i);
            if (token.getType() == TokenType.LINE_COMMENT
                    || (token.isTrivia() && !containsLineBreak(token))) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static boolean containsLineBreak(SqlToken token) {
        return token.getType() == TokenType.WHITESPACE
                && (token.getText().indexOf('\n') >= 0 || token.getText().indexOf('\r') >= 0);
    }

    private static String joinText(List<SqlToken> tokens, int from, int toExclusive) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < toExclusive; i++) {
            sb.append(tokens.get(i).getText());
        }
        return sb.toString();
    }
}
