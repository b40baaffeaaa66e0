package me.christianrobert.mspgsync.core.exception;

import java.util.List;

/**
 * The foreign key graph contains at least one cycle, so no emission order exists.
 * Fatal for the constraint step only.
 */
public class CyclicConstraintException extends MigrationException {

    private final List<List<String>> cycles;

    public CyclicConstraintException(List<List<String>> cycles) {
        super("Cyclic foreign key dependencies between tables: " + describe(cycles));
        this.cycles = List.copyOf(cycles);
    }

    /**
     * Each entry lists the tables of one strongly connected component, sorted by name.
     */
    public List<List<String>> getCycles() {
        return cycles;
    }

    public List<String> getTablesInCycles() {
        return cycles.stream().flatMap(List::stream).toList();
    }

    private static String describe(List<List<String>> cycles) {
        StringBuilder sb = new StringBuilder();
        for (List<String> cycle : cycles) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(String.join(" <-> ", cycle));
        }
        return sb.toString();
    }
}
