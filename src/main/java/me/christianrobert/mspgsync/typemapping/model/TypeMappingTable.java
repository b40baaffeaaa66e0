package me.christianrobert.mspgsync.typemapping.model;

import me.christianrobert.mspgsync.core.exception.UnknownTypeMappingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the SQL Server to PostgreSQL type mapping.
 *
 * <p>Keys are source type signatures in lower case, either a bare type name ("nvarchar")
 * or a parameterized variant ("nvarchar(max)", "decimal(19,4)"). Lookup tries the
 * most specific signature first and the bare name last. The key {@value #GENERIC_FALLBACK}
 * is an optional catch-all for unknown types.</p>
 *
 * <p>When the bare name matches and the target expression carries no parameters of its own,
 * source length or precision/scale is carried over for target types that accept them
 * (CHAR/VARCHAR and DECIMAL/NUMERIC). A (max) length on a VARCHAR target without a dedicated
 * "(max)" entry becomes TEXT.</p>
 */
public final class TypeMappingTable {

    public static final String GENERIC_FALLBACK = "*";

    /** Source types whose single parameter is a length rather than a precision. */
    public static final Set<String> LENGTH_TYPES = Set.of("char", "varchar", "nchar", "nvarchar", "binary", "varbinary");

    private static final Set<String> LENGTH_TARGETS = Set.of("CHAR", "VARCHAR", "CHARACTER", "CHARACTER VARYING");
    private static final Set<String> PRECISION_TARGETS = Set.of("DECIMAL", "NUMERIC");

    private final long version;
    private final Map<String, String> entries;

    public TypeMappingTable(long version, Map<String, String> entries) {
        this.version = version;
        Map<String, String> normalized = new LinkedHashMap<>();
        entries.forEach((key, value) -> normalized.put(normalizeSignature(key), value.trim()));
        this.entries = Collections.unmodifiableMap(normalized);
    }

    public long getVersion() {
        return version;
    }

    public Map<String, String> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String signature) {
        return entries.containsKey(normalizeSignature(signature));
    }

    /**
     * Resolves a source type to a PostgreSQL type expression.
     *
     * @param sourceType bare SQL Server type name, case insensitive, brackets allowed
     * @param precision numeric precision or null
     * @param scale numeric scale or null
     * @param length character/binary length, -1 for (max), or null
     * @throws UnknownTypeMappingException if neither a signature nor the generic fallback matches
     */
    public String resolve(String sourceType, Integer precision, Integer scale, Integer length) {
        String name = normalizeSignature(sourceType);

        for (String signature : candidateSignatures(name, precision, scale, length)) {
            String target = entries.get(signature);
            if (target != null) {
                return signature.equals(name) ? applyParameters(target, precision, scale, length) : target;
            }
        }

        String fallback = entries.get(GENERIC_FALLBACK);
        if (fallback != null) {
            return fallback;
        }
        throw new UnknownTypeMappingException(describe(name, precision, scale, length));
    }

    /**
     * Signatures to try, most specific first.
     */
    static List<String> candidateSignatures(String name, Integer precision, Integer scale, Integer length) {
        List<String> signatures = new ArrayList<>(4);
        if (length != null && length != 0) {
            signatures.add(name + "(" + (length < 0 ? "max" : length.toString()) + ")");
        }
        if (precision != null && scale != null) {
            signatures.add(name + "(" + precision + "," + scale + ")");
        }
        if (precision != null) {
            signatures.add(name + "(" + precision + ")");
        }
        signatures.add(name);
        return signatures;
    }

    private static String applyParameters(String target, Integer precision, Integer scale, Integer length) {
        if (target.contains("(")) {
            return target;
        }

        String base = target.toUpperCase(Locale.ROOT);
        if (LENGTH_TARGETS.contains(base) && length != null && length != 0) {
            return length < 0 ? "TEXT" : target + "(" + length + ")";
        }
        if (PRECISION_TARGETS.contains(base) && precision != null) {
            return scale != null ? target + "(" + precision + "," + scale + ")" : target + "(" + precision + ")";
        }
        return target;
    }

    private static String describe(String name, Integer precision, Integer scale, Integer length) {
        return candidateSignatures(name, precision, scale, length).get(0);
    }

    /**
     * Lower case, brackets and whitespace removed: "[NVarChar] ( MAX )" -> "nvarchar(max)".
     */
    public static String normalizeSignature(String signature) {
        if (signature == null) {
            throw new IllegalArgumentException("Type signature must not be null");
        }
        StringBuilder sb = new StringBuilder(signature.length());
        for (char c : signature.toCharArray()) {
            if (c != '[' && c != ']' && !Character.isWhitespace(c)) {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TypeMappingTable{version=" + version + ", entries=" + entries.size() + "}";
    }
}
