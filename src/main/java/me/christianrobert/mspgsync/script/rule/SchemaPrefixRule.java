package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.model.TokenType;

import java.util.Locale;
import java.util.Set;

/**
 * Removes the {@code dbo.} prefix from object names; its objects live in {@code public},
 * the PostgreSQL default search path. Three-part names (db.dbo.x) are left alone.
 */
public class SchemaPrefixRule implements ConversionRule {

    public static final String ID = "schema-prefix";

    private static final Set<String> STRIPPED_SCHEMAS = Set.of("dbo");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Remove dbo. schema prefixes";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size() - 1) {
            SqlToken token = group.get(i);
            if (isStrippedSchema(token) && group.get(i + 1).isSymbol('.') && !followsDot(group, i)) {
                i = group.replace(i, i + 2, "", ID);
            } else {
                i++;
            }
        }
    }

    private boolean isStrippedSchema(SqlToken token) {
        String name = token.identifierName();
        return name != null && token.getType() != TokenType.QUOTED_IDENTIFIER
                && STRIPPED_SCHEMAS.contains(name.toLowerCase(Locale.ROOT));
    }

    private boolean followsDot(StatementGroup group, int index) {
        return index > 0 && group.get(index - 1).isSymbol('.');
    }
}
