package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;

/**
 * PostgreSQL index names are schema-wide, so {@code DROP INDEX [IF EXISTS] ix ON table} and the
 * older {@code DROP INDEX table.ix} both become {@code DROP INDEX [IF EXISTS] ix}.
 */
public class DropIndexRule implements ConversionRule {

    public static final String ID = "drop-index";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Drop indexes by name only";
    }

    @Override
    public void apply(StatementGroup group) {
        for (int i = 0; i < group.size(); i++) {
            if (!group.get(i).isWord("DROP")) {
                continue;
            }
            int index = group.nextSignificant(i + 1);
            if (index < 0 || !group.get(index).isWord("INDEX")) {
                continue;
            }

            int name = group.nextSignificant(index + 1);
            if (name >= 0 && group.get(name).isWord("IF")) {
                int exists = group.nextSignificant(name + 1);
                if (exists < 0 || !group.get(exists).isWord("EXISTS")) {
                    continue;
                }
                name = group.nextSignificant(exists + 1);
            }
            if (name < 0 || !group.get(name).isIdentifier()) {
                continue;
            }

            int after = group.nextSignificant(name + 1);
            SqlToken next = group.significantAt(after);
            if (next != null && next.isSymbol('.')) {
                // table.index
                int indexName = group.nextSignificant(after + 1);
                if (indexName >= 0 && group.get(indexName).isIdentifier()) {
                    group.replace(name, indexName + 1, group.get(indexName).getText(), ID);
                }
            } else if (next != null && next.isWord("ON")) {
                int table = group.nextSignificant(after + 1);
                int tableEnd = qualifiedNameEnd(group, table);
                if (tableEnd > 0) {
                    group.replace(name + 1, tableEnd, "", ID);
                }
            }
        }
    }

    /**
     * Index after a possibly qualified name starting at {@code start}, or -1.
     */
    private int qualifiedNameEnd(StatementGroup group, int start) {
        if (start < 0 || !group.get(start).isIdentifier()) {
            return -1;
        }
        int end = start + 1;
        while (end + 1 < group.size() && group.get(end).isSymbol('.') && group.get(end + 1).isIdentifier()) {
            end += 2;
        }
        return end;
    }
}
