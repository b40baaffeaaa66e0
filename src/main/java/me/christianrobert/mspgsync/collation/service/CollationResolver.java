package me.christianrobert.mspgsync.collation.service;

import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.core.exception.CollationUnresolvedException;

import java.util.List;
import java.util.Set;

/**
 * Resolves SQL Server collations against the collations installed on one PostgreSQL database.
 * One instance per run: the table snapshot and the installed set are fixed at construction.
 */
public class CollationResolver {

    private final CollationMappingTable table;
    private final Set<String> installedCollations;

    public CollationResolver(CollationMappingTable table, Set<String> installedCollations) {
        this.table = table;
        this.installedCollations = Set.copyOf(installedCollations);
    }

    /**
     * Returns the first installed candidate in list order. When none is installed, returns
     * {@link CollationMappingTable#FALLBACK_MARKER} if the list contains it.
     *
     * @throws CollationUnresolvedException if nothing is installed and the list has no marker
     */
    public String resolve(String sourceCollation) {
        List<String> candidates = table.candidatesFor(sourceCollation);

        boolean hasMarker = false;
        for (String candidate : candidates) {
            if (CollationMappingTable.isFallbackMarker(candidate)) {
                hasMarker = true;
            } else if (installedCollations.contains(candidate)) {
                return candidate;
            }
        }

        if (hasMarker) {
            return CollationMappingTable.FALLBACK_MARKER;
        }
        throw new CollationUnresolvedException(sourceCollation, candidates);
    }

    public Set<String> getInstalledCollations() {
        return installedCollations;
    }
}
