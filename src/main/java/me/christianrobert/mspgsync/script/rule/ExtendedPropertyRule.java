package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;

import java.util.Locale;
import java.util.Set;

/**
 * Removes batches that maintain SQL Server extended properties, which have no PostgreSQL
 * counterpart. Covers {@code EXEC sys.sp_addextendedproperty ...} and the generated
 * {@code IF EXISTS (SELECT ... FROM sys.extended_properties ...)} blocks around it.
 *
 * <p>Each removal leaves a warning so descriptions can be carried over as COMMENT ON by hand.
 * A batch that mixes property calls with other statements is kept and only warned about.</p>
 */
public class ExtendedPropertyRule implements ConversionRule {

    public static final String ID = "extended-property";

    private static final Set<String> PROPERTY_PROCEDURES = Set.of(
            "sp_addextendedproperty", "sp_updateextendedproperty", "sp_dropextendedproperty");

    // IF guards and the DO blocks made of them by the existence guard rule
    private static final Set<String> BATCH_STARTS = Set.of("EXEC", "EXECUTE", "IF", "DO");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Remove extended property batches";
    }

    @Override
    public void apply(StatementGroup group) {
        int call = findPropertyCall(group);
        if (call < 0) {
            return;
        }

        int first = group.nextSignificant(0);
        SqlToken start = group.get(first);
        if (!(first == call || start.hasIdentifierName("sys") || BATCH_STARTS.contains(start.getText().toUpperCase(Locale.ROOT)))) {
            group.warn(ID, group.get(call), "Extended property call left in a mixed batch");
            return;
        }

        int last = group.previousSignificant(group.size());
        group.warn(ID, start, "Removed " + group.get(call).identifierName() + " batch, review the object comments");
        group.replace(first, last + 1, "", ID);
    }

    private int findPropertyCall(StatementGroup group) {
        for (int i = 0; i < group.size(); i++) {
            SqlToken token = group.get(i);
            if (token.isIdentifier() && PROPERTY_PROCEDURES.contains(token.identifierName().toLowerCase(Locale.ROOT))) {
                return i;
            }
        }
        return -1;
    }
}
