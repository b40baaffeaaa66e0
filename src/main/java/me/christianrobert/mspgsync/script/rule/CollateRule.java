package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;

import java.util.List;

/**
 * Maps {@code COLLATE <sql server collation>} clauses to the first PostgreSQL candidate of the
 * collation table. When the only candidate is the fallback marker, the clause is removed and
 * the column gets the database default collation.
 */
public class CollateRule implements ConversionRule {

    public static final String ID = "collate";

    private final CollationMappingTable collations;
    private final boolean skipCollations;

    public CollateRule(CollationMappingTable collations, boolean skipCollations) {
        this.collations = collations;
        this.skipCollations = skipCollations;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Map COLLATE clauses to PostgreSQL collations";
    }

    @Override
    public boolean isApplicable(StatementGroup group) {
        return !skipCollations && !group.isBlank();
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size()) {
            if (!group.get(i).isWord("COLLATE")) {
                i++;
                continue;
            }
            int nameIndex = group.nextSignificant(i + 1);
            SqlToken name = group.significantAt(nameIndex);
            if (name == null || !name.isIdentifier()) {
                i++;
                continue;
            }

            String target = firstRealCandidate(collations.candidatesFor(name.identifierName()));
            if (target == null) {
                int from = group.previousSignificant(i) + 1;
                i = group.replace(from, nameIndex + 1, "", ID);
            } else {
                i = group.replace(i, nameIndex + 1, "COLLATE \"" + target.replace("\"", "\"\"") + "\"", ID);
            }
        }
    }

    private String firstRealCandidate(List<String> candidates) {
        for (String candidate : candidates) {
            if (!CollationMappingTable.isFallbackMarker(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
