package me.christianrobert.mspgsync.collation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the collation candidate lists.
 *
 * <p>Keys are SQL Server collation names, matched case-insensitively. The entry named
 * {@value #DEFAULT_KEY} holds the candidates for collations without an own entry.
 * Within a list, {@value #FALLBACK_MARKER} means "keep the PostgreSQL database default".</p>
 */
public final class CollationMappingTable {

    public static final String DEFAULT_KEY = "default";
    public static final String FALLBACK_MARKER = "default";

    private final long version;
    private final Map<String, List<String>> entries;

    public CollationMappingTable(long version, Map<String, List<String>> entries) {
        this.version = version;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        entries.forEach((key, candidates) -> copy.put(key.trim(), List.copyOf(candidates)));
        this.entries = Collections.unmodifiableMap(copy);
    }

    public long getVersion() {
        return version;
    }

    public Map<String, List<String>> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Candidate list for a source collation: its own entry, else the {@value #DEFAULT_KEY} entry,
     * else an empty list.
     */
    public List<String> candidatesFor(String sourceCollation) {
        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(sourceCollation)) {
                return entry.getValue();
            }
        }
        List<String> defaults = entries.get(DEFAULT_KEY);
        return defaults != null ? defaults : new ArrayList<>();
    }

    public static boolean isFallbackMarker(String candidate) {
        return FALLBACK_MARKER.equalsIgnoreCase(candidate);
    }

    @Override
    public String toString() {
        return "CollationMappingTable{version=" + version + ", entries=" + entries.size() + "}";
    }
}
