package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.model.TokenType;

import java.util.Locale;
import java.util.Set;

/**
 * Rewrites T-SQL existence guards in front of DROP and CREATE statements.
 *
 * <p>Recognized guards are {@code IF [NOT] EXISTS (subquery)} and
 * {@code IF OBJECT_ID(name[, type]) IS [NOT] NULL}, guarding either a single statement or a
 * {@code BEGIN ... END} block. The rewrite depends on what the guard protects:</p>
 * <ul>
 *   <li>presence check before {@code DROP <kind>}: {@code DROP <kind> IF EXISTS}</li>
 *   <li>absence check before {@code CREATE TABLE|INDEX|SCHEMA|SEQUENCE}: {@code CREATE <kind> IF NOT EXISTS}</li>
 *   <li>absence check before {@code CREATE VIEW|FUNCTION|PROCEDURE|TRIGGER}: {@code CREATE OR REPLACE}</li>
 *   <li>anything else: an anonymous {@code DO $$ ... $$} block, flagged with a warning</li>
 * </ul>
 */
public class ExistenceGuardRule implements ConversionRule {

    public static final String ID = "existence-guard";

    private static final Set<String> DROP_KINDS = Set.of(
            "TABLE", "VIEW", "PROCEDURE", "PROC", "FUNCTION", "INDEX", "TRIGGER", "SCHEMA", "SEQUENCE", "TYPE");

    private static final Set<String> CREATE_IF_NOT_EXISTS_KINDS = Set.of("TABLE", "INDEX", "SCHEMA", "SEQUENCE");

    private static final Set<String> CREATE_OR_REPLACE_KINDS = Set.of("VIEW", "FUNCTION", "PROCEDURE", "PROC", "TRIGGER");

    // Words after which IF belongs to the statement itself, as in DROP TABLE IF EXISTS
    private static final Set<String> INLINE_IF_PREDECESSORS = Set.of(
            "TABLE", "VIEW", "PROCEDURE", "PROC", "FUNCTION", "INDEX", "TRIGGER", "SCHEMA", "SEQUENCE", "TYPE",
            "CONSTRAINT", "COLUMN", "DATABASE");

    private static final Set<String> STATEMENT_STARTERS = Set.of(
            "CREATE", "DROP", "ALTER", "INSERT", "UPDATE", "DELETE", "IF", "PRINT", "EXEC", "EXECUTE",
            "GRANT", "DECLARE", "TRUNCATE", "RAISERROR", "RETURN");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Rewrite IF EXISTS / OBJECT_ID guards";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = group.nextSignificant(0);
        while (i >= 0 && i < group.size()) {
            int next = group.get(i).isWord("IF") && !isInlineIf(group, i) ? rewriteGuard(group, i) : i + 1;
            i = group.nextSignificant(next);
        }
    }

    /**
     * Rewrites the guard starting at {@code ifIndex}.
     *
     * @return index to continue scanning from
     */
    private int rewriteGuard(StatementGroup group, int ifIndex) {
        Guard guard = parseGuard(group, ifIndex);
        if (guard == null) {
            return ifIndex + 1;
        }

        int bodyStart = group.nextSignificant(guard.conditionEnd);
        if (bodyStart < 0) {
            return ifIndex + 1;
        }

        int innerStart;
        int innerEnd;
        int blockEnd;
        if (isBlockBegin(group, bodyStart)) {
            int end = matchingEnd(group, bodyStart);
            if (end < 0) {
                group.warn(ID, group.get(bodyStart), "BEGIN without matching END, guard left unchanged");
                return ifIndex + 1;
            }
            innerStart = group.nextSignificant(bodyStart + 1);
            innerEnd = end;
            blockEnd = end + 1;
        } else {
            innerStart = bodyStart;
            innerEnd = statementEnd(group, bodyStart, group.size());
            blockEnd = innerEnd;
        }
        if (innerStart < 0 || innerStart >= innerEnd) {
            return blockEnd;
        }

        SqlToken afterBlock = group.significantAt(group.nextSignificant(blockEnd));
        if (afterBlock != null && afterBlock.isWord("ELSE")) {
            group.warn(ID, group.get(ifIndex), "IF ... ELSE guard left unchanged, convert manually");
            return blockEnd;
        }

        boolean singleStatement = statementEnd(group, innerStart, innerEnd) > lastSignificantBefore(group, innerEnd, innerStart);
        if (singleStatement && tryDirectRewrite(group, guard, ifIndex, bodyStart, innerStart, innerEnd, blockEnd)) {
            return ifIndex + 1;
        }
        return wrapInDoBlock(group, guard, ifIndex, innerStart, innerEnd, blockEnd);
    }

    private boolean tryDirectRewrite(StatementGroup group, Guard guard, int ifIndex, int bodyStart,
                                     int innerStart, int innerEnd, int blockEnd) {
        SqlToken verb = group.get(innerStart);
        int kindIndex = group.nextSignificant(innerStart + 1);
        if (!guard.absenceCheck && verb.isWord("DROP")) {
            return rewriteDrop(group, ifIndex, bodyStart, innerStart, kindIndex, innerEnd, blockEnd);
        }
        if (guard.absenceCheck && verb.isWord("CREATE")) {
            int uniqueAware = kindIndex >= 0 && group.get(kindIndex).isWord("UNIQUE")
                    ? group.nextSignificant(kindIndex + 1) : kindIndex;
            return rewriteCreate(group, ifIndex, bodyStart, innerStart, kindIndex, uniqueAware, innerEnd, blockEnd);
        }
        return false;
    }

    private boolean rewriteDrop(StatementGroup group, int ifIndex, int bodyStart, int dropIndex, int kindIndex,
                                int innerEnd, int blockEnd) {
        String kind = wordAt(group, kindIndex);
        if (kind == null || !DROP_KINDS.contains(kind)) {
            return false;
        }

        // Edits run back to front so earlier indexes stay valid
        removeBlockEnd(group, bodyStart, innerEnd, blockEnd);
        SqlToken afterKind = group.significantAt(group.nextSignificant(kindIndex + 1));
        boolean alreadyGuarded = afterKind != null && afterKind.isWord("IF");
        if ("PROC".equals(kind)) {
            group.replace(kindIndex, kindIndex + 1, alreadyGuarded ? "PROCEDURE" : "PROCEDURE IF EXISTS", ID);
        } else if (!alreadyGuarded) {
            group.replace(kindIndex, kindIndex + 1, group.get(kindIndex).getText() + " IF EXISTS", ID);
        }
        group.replace(ifIndex, dropIndex, "", ID);
        return true;
    }

    private boolean rewriteCreate(StatementGroup group, int ifIndex, int bodyStart, int createIndex, int kindIndex,
                                  int objectKindIndex, int innerEnd, int blockEnd) {
        String kind = wordAt(group, objectKindIndex);
        if (kind == null) {
            return false;
        }
        boolean unique = objectKindIndex != kindIndex;
        if (CREATE_IF_NOT_EXISTS_KINDS.contains(kind) && (!unique || "INDEX".equals(kind))) {
            removeBlockEnd(group, bodyStart, innerEnd, blockEnd);
            SqlToken afterKind = group.significantAt(group.nextSignificant(objectKindIndex + 1));
            if (afterKind == null || !afterKind.isWord("IF")) {
                group.replace(objectKindIndex, objectKindIndex + 1,
                        group.get(objectKindIndex).getText() + " IF NOT EXISTS", ID);
            }
            group.replace(ifIndex, createIndex, "", ID);
            return true;
        }
        if (CREATE_OR_REPLACE_KINDS.contains(kind) && !unique) {
            removeBlockEnd(group, bodyStart, innerEnd, blockEnd);
            String replacement = "PROC".equals(kind) ? "OR REPLACE PROCEDURE" : "OR REPLACE " + group.get(kindIndex).getText();
            group.replace(kindIndex, kindIndex + 1, replacement, ID);
            group.replace(ifIndex, createIndex, "", ID);
            return true;
        }
        return false;
    }

    /**
     * Removes the END of a BEGIN ... END body; the BEGIN goes with the guard prefix.
     */
    private void removeBlockEnd(StatementGroup group, int bodyStart, int innerEnd, int blockEnd) {
        if (blockEnd == innerEnd + 1 && group.get(innerEnd).isWord("END") && isBlockBegin(group, bodyStart)) {
            int from = lastSignificantBefore(group, innerEnd, bodyStart) + 1;
            group.replace(from, blockEnd, "", ID);
        }
    }

    private int wrapInDoBlock(StatementGroup group, Guard guard, int ifIndex, int innerStart, int innerEnd,
                              int blockEnd) {
        String condition = guard.objectIdArgument != null
                ? "to_regclass(" + guard.objectIdArgument + ") IS " + (guard.absenceCheck ? "NULL" : "NOT NULL")
                : group.text(group.nextSignificant(ifIndex + 1), guard.conditionEnd);

        int lastInner = lastSignificantBefore(group, innerEnd, innerStart);
        String body = group.text(innerStart, lastInner + 1);
        if (!group.get(lastInner).isSymbol(';')) {
            body = body + ";";
        }

        SqlToken at = group.get(ifIndex);
        String replacement = "DO $$\nBEGIN\n  IF " + condition + " THEN\n    " + body + "\n  END IF;\nEND $$";
        int next = group.replace(ifIndex, blockEnd, replacement, ID);
        group.warn(ID, at, "Guard converted to a DO block, review the PL/pgSQL body");
        return next;
    }

    private Guard parseGuard(StatementGroup group, int ifIndex) {
        int first = group.nextSignificant(ifIndex + 1);
        SqlToken firstToken = group.significantAt(first);
        if (firstToken == null) {
            return null;
        }

        boolean negated = false;
        int existsIndex = first;
        if (firstToken.isWord("NOT")) {
            negated = true;
            existsIndex = group.nextSignificant(first + 1);
        }
        SqlToken existsToken = group.significantAt(existsIndex);
        if (existsToken != null && existsToken.isWord("EXISTS")) {
            int open = group.nextSignificant(existsIndex + 1);
            if (open < 0 || !group.get(open).isSymbol('(')) {
                return null;
            }
            int close = group.matchingParenthesis(open);
            return close < 0 ? null : new Guard(close + 1, negated, null);
        }

        if (negated || !firstToken.isWord("OBJECT_ID")) {
            return null;
        }
        int open = group.nextSignificant(first + 1);
        if (open < 0 || !group.get(open).isSymbol('(')) {
            return null;
        }
        int close = group.matchingParenthesis(open);
        if (close < 0) {
            return null;
        }
        int argStart = group.nextSignificant(open + 1);
        int argEnd = argStart;
        while (argEnd >= 0 && argEnd < close && !group.get(argEnd).isSymbol(',')) {
            argEnd++;
        }
        if (argStart < 0 || argStart >= close) {
            return null;
        }
        String argument = group.text(argStart, lastSignificantBefore(group, argEnd, argStart) + 1);

        int is = group.nextSignificant(close + 1);
        if (is < 0 || !group.get(is).isWord("IS")) {
            return null;
        }
        int afterIs = group.nextSignificant(is + 1);
        boolean notNull = afterIs >= 0 && group.get(afterIs).isWord("NOT");
        int nullIndex = notNull ? group.nextSignificant(afterIs + 1) : afterIs;
        if (nullIndex < 0 || !group.get(nullIndex).isWord("NULL")) {
            return null;
        }
        return new Guard(nullIndex + 1, !notNull, argument);
    }

    private boolean isInlineIf(StatementGroup group, int ifIndex) {
        SqlToken previous = group.significantAt(group.previousSignificant(ifIndex));
        return previous != null && previous.getType() == TokenType.WORD
                && INLINE_IF_PREDECESSORS.contains(previous.getText().toUpperCase(Locale.ROOT));
    }

    private boolean isBlockBegin(StatementGroup group, int index) {
        if (!group.get(index).isWord("BEGIN")) {
            return false;
        }
        SqlToken next = group.significantAt(group.nextSignificant(index + 1));
        return next == null || !(next.isWord("TRAN") || next.isWord("TRANSACTION") || next.isWord("DISTRIBUTED"));
    }

    /**
     * Index of the END closing the BEGIN at {@code beginIndex}, counting CASE ... END pairs, or -1.
     */
    private int matchingEnd(StatementGroup group, int beginIndex) {
        int depth = 0;
        for (int i = beginIndex; i < group.size(); i++) {
            SqlToken token = group.get(i);
            if (token.isWord("CASE") || (token.isWord("BEGIN") && isBlockBegin(group, i))) {
                depth++;
            } else if (token.isWord("END")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Exclusive end of the statement starting at {@code start}, bounded by {@code limit}: a
     * semicolon, ELSE, or the next statement keyword at parenthesis depth zero. Routine definitions
     * run to the limit.
     */
    private int statementEnd(StatementGroup group, int start, int limit) {
        if (group.get(start).isWord("CREATE")) {
            int kind = group.nextSignificant(start + 1);
            if (kind >= 0 && group.get(kind).isWord("OR")) {
                return limit;
            }
            String kindWord = wordAt(group, kind);
            if (kindWord != null && CREATE_OR_REPLACE_KINDS.contains(kindWord)) {
                return limit;
            }
        }

        int depth = 0;
        for (int i = start + 1; i < limit; i++) {
            SqlToken token = group.get(i);
            if (token.isSymbol('(')) {
                depth++;
            } else if (token.isSymbol(')')) {
                depth--;
            } else if (depth == 0 && token.isSymbol(';')) {
                return i + 1;
            } else if (depth == 0 && token.getType() == TokenType.WORD
                    && (token.isWord("ELSE") || STATEMENT_STARTERS.contains(token.getText().toUpperCase(Locale.ROOT)))
                    && !isReferentialAction(group, i)) {
                return lastSignificantBefore(group, i, start) + 1;
            }
        }
        return limit;
    }

    // ON DELETE / ON UPDATE
    private boolean isReferentialAction(StatementGroup group, int index) {
        SqlToken previous = group.significantAt(group.previousSignificant(index));
        return previous != null && previous.isWord("ON");
    }

    private int lastSignificantBefore(StatementGroup group, int before, int floor) {
        int index = group.previousSignificant(before);
        return index < floor ? floor : index;
    }

    private String wordAt(StatementGroup group, int index) {
        SqlToken token = group.significantAt(index);
        return token != null && token.getType() == TokenType.WORD ? token.getText().toUpperCase(Locale.ROOT) : null;
    }

    private static final class Guard {
        final int conditionEnd;
        final boolean absenceCheck;
        final String objectIdArgument;

        Guard(int conditionEnd, boolean absenceCheck, String objectIdArgument) {
            this.conditionEnd = conditionEnd;
            this.absenceCheck = absenceCheck;
            this.objectIdArgument = objectIdArgument;
        }
    }
}
