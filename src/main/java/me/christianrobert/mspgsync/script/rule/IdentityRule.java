package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code IDENTITY[(seed, increment)] [NOT FOR REPLICATION]} column properties into
 * PostgreSQL identity columns. The three-argument {@code IDENTITY(type, seed, increment)} function
 * of {@code SELECT ... INTO} is left alone.
 */
public class IdentityRule implements ConversionRule {

    public static final String ID = "identity";

    private final boolean identityAlways;

    public IdentityRule(boolean identityAlways) {
        this.identityAlways = identityAlways;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Rewrite IDENTITY columns as identity clauses";
    }

    @Override
    public void apply(StatementGroup group) {
        int i = 0;
        while (i < group.size()) {
            if (!group.get(i).isWord("IDENTITY") || (i > 0 && group.get(i - 1).isSymbol('.'))) {
                i++;
                continue;
            }

            String seed = "1";
            String increment = "1";
            int end = i + 1;
            int open = group.nextSignificant(i + 1);
            if (open >= 0 && group.get(open).isSymbol('(')) {
                int close = group.matchingParenthesis(open);
                List<String> arguments = close < 0 ? List.of() : splitArguments(group, open + 1, close);
                if (arguments.size() != 2) {
                    i++;
                    continue;
                }
                seed = arguments.get(0);
                increment = arguments.get(1);
                end = close + 1;
            }
            end = skipNotForReplication(group, end);

            i = group.replace(i, end, identityClause(seed, increment), ID);
        }
    }

    String identityClause(String seed, String increment) {
        StringBuilder clause = new StringBuilder("GENERATED ")
                .append(identityAlways ? "ALWAYS" : "BY DEFAULT")
                .append(" AS IDENTITY");
        if (!"1".equals(seed) || !"1".equals(increment)) {
            clause.append(" (START WITH ").append(seed).append(" INCREMENT BY ").append(increment).append(')');
        }
        return clause.toString();
    }

    private List<String> splitArguments(StatementGroup group, int from, int toExclusive) {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = from; i < toExclusive; i++) {
            SqlToken token = group.get(i);
            if (token.isSymbol(',')) {
                arguments.add(current.toString());
                current.setLength(0);
            } else if (!token.isTrivia()) {
                current.append(token.getText());
            }
        }
        arguments.add(current.toString());
        return arguments;
    }

    private int skipNotForReplication(StatementGroup group, int end) {
        int not = group.nextSignificant(end);
        int forIndex = not < 0 ? -1 : group.nextSignificant(not + 1);
        int replication = forIndex < 0 ? -1 : group.nextSignificant(forIndex + 1);
        if (replication >= 0 && group.get(not).isWord("NOT") && group.get(forIndex).isWord("FOR")
                && group.get(replication).isWord("REPLICATION")) {
            return replication + 1;
        }
        return end;
    }
}
