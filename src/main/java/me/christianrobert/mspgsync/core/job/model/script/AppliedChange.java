package me.christianrobert.mspgsync.core.job.model.script;

/**
 * One rewrite performed by a conversion rule, located in the original script.
 */
public class AppliedChange {
    private final String ruleId;
    private final int line;
    private final int column;
    private final String before;
    private final String after;

    public AppliedChange(String ruleId, int line, int column, String before, String after) {
        this.ruleId = ruleId;
        this.line = line;
        this.column = column;
        this.before = before;
        this.after = after;
    }

    public String getRuleId() {
        return ruleId;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getBefore() {
        return before;
    }

    public String getAfter() {
        return after;
    }

    @Override
    public String toString() {
        return String.format("%s@%d:%d '%s' -> '%s'", ruleId, line, column, before, after);
    }
}
