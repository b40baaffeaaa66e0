package me.christianrobert.mspgsync.core.exception;

import java.util.List;

/**
 * None of the candidate collations is installed on the target and the candidate list has
 * no fallback marker. The caller skips the affected column with a warning.
 */
public class CollationUnresolvedException extends MigrationException {

    private final String sourceCollation;
    private final List<String> candidates;

    public CollationUnresolvedException(String sourceCollation, List<String> candidates) {
        super(String.format("No installed collation for '%s' (candidates: %s)", sourceCollation, candidates));
        this.sourceCollation = sourceCollation;
        this.candidates = List.copyOf(candidates);
    }

    public String getSourceCollation() {
        return sourceCollation;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
