package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;

/**
 * {@code ALTER TABLE t DROP CONSTRAINT x} becomes {@code ALTER TABLE t DROP CONSTRAINT IF EXISTS x},
 * so migration scripts can be run against a database where the constraint is already gone.
 */
public class DropConstraintRule implements ConversionRule {

    public static final String ID = "drop-constraint";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Make ALTER TABLE ... DROP CONSTRAINT tolerate missing constraints";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size()) {
            SqlToken token = group.get(i);
            int constraint = token.isWord("DROP") ? group.nextSignificant(i + 1) : -1;
            if (constraint < 0 || !group.get(constraint).isWord("CONSTRAINT") || !followsAlterTable(group, i)) {
                i++;
                continue;
            }

            SqlToken next = group.significantAt(group.nextSignificant(constraint + 1));
            if (next == null || next.isWord("IF")) {
                i = constraint + 1;
                continue;
            }
            i = group.replace(i, constraint + 1, "DROP CONSTRAINT IF EXISTS", ID);
        }
    }

    /**
     * Whether the tokens before {@code drop} read {@code ALTER TABLE name}, with a qualified name allowed.
     */
    private boolean followsAlterTable(StatementGroup group, int drop) {
        int index = group.previousSignificant(drop);
        boolean sawName = false;
        while (index >= 0 && (group.get(index).isSymbol('.') || isName(group.get(index)))) {
            sawName = true;
            index = group.previousSignificant(index);
        }
        SqlToken table = group.significantAt(index);
        if (!sawName || table == null || !table.isWord("TABLE")) {
            return false;
        }
        SqlToken alter = group.significantAt(group.previousSignificant(index));
        return alter != null && alter.isWord("ALTER");
    }

    private boolean isName(SqlToken token) {
        return token.isIdentifier() && !token.isWord("TABLE");
    }
}
