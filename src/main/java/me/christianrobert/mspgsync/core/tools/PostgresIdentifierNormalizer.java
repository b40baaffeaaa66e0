package me.christianrobert.mspgsync.core.tools;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Utility class for turning SQL Server identifiers into PostgreSQL identifiers.
 *
 * <h2>Normalization Strategy</h2>
 * <ul>
 *   <li>The SQL Server default schema {@code dbo} becomes {@code public}</li>
 *   <li>Hyphens become underscores</li>
 *   <li>Names are lower-cased only when normalization is enabled; otherwise the original case
 *       is preserved and every identifier is emitted quoted</li>
 *   <li>Names longer than {@value #MAX_IDENTIFIER_BYTES} UTF-8 bytes are shortened (see
 *       {@link #shorten(String, String)})</li>
 * </ul>
 *
 * <h2>Examples</h2>
 * <pre>
 * SQL Server                 PostgreSQL
 * ----------                 ----------
 * dbo.Orders             →   "public"."Orders"
 * sales.[Order-Lines]    →   "sales"."Order_Lines"
 * FK_..._70 bytes        →   "FK_..._(prefix)_1a2b3c4d"
 * </pre>
 */
public final class PostgresIdentifierNormalizer {

    /** PostgreSQL NAMEDATALEN - 1. */
    public static final int MAX_IDENTIFIER_BYTES = 63;

    static final int HASH_LENGTH = 8;

    private static final String SOURCE_DEFAULT_SCHEMA = "dbo";
    private static final String TARGET_DEFAULT_SCHEMA = "public";

    private PostgresIdentifierNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Maps a source schema to its target name.
     */
    public static String normalizeSchema(String schema, boolean lowercase) {
        if (schema == null || schema.isEmpty() || SOURCE_DEFAULT_SCHEMA.equalsIgnoreCase(schema)) {
            return TARGET_DEFAULT_SCHEMA;
        }
        return normalizeName(schema, lowercase, schema);
    }

    /**
     * Normalizes a table or column name. The qualified original name is the hash input when the
     * name must be shortened, so equal short prefixes in different tables never collide.
     */
    public static String normalizeName(String name, boolean lowercase, String qualifiedOriginal) {
        String normalized = name.replace('-', '_');
        if (lowercase) {
            normalized = normalized.toLowerCase(Locale.ROOT);
        }
        return shorten(normalized, qualifiedOriginal);
    }

    /**
     * Shortens an identifier that exceeds {@value #MAX_IDENTIFIER_BYTES} UTF-8 bytes.
     *
     * <p>The result is the longest prefix (on a character boundary) that fits, followed by
     * {@code _} and the first {@value #HASH_LENGTH} hex digits of the SHA-256 of
     * {@code hashInput}. The mapping is deterministic: the same input always yields the same
     * name across runs.</p>
     *
     * @param identifier the candidate identifier
     * @param hashInput  the fully qualified original name, e.g. {@code sales.Orders.FK_Orders_Customers}
     */
    public static String shorten(String identifier, String hashInput) {
        if (utf8Length(identifier) <= MAX_IDENTIFIER_BYTES) {
            return identifier;
        }

        String suffix = "_" + hash(hashInput == null ? identifier : hashInput);
        int budget = MAX_IDENTIFIER_BYTES - suffix.length();

        StringBuilder prefix = new StringBuilder();
        int used = 0;
        for (int i = 0; i < identifier.length(); ) {
            int codePoint = identifier.codePointAt(i);
            int bytes = utf8Length(new String(Character.toChars(codePoint)));
            if (used + bytes > budget) {
                break;
            }
            prefix.appendCodePoint(codePoint);
            used += bytes;
            i += Character.charCount(codePoint);
        }
        return prefix + suffix;
    }

    /**
     * Double-quotes an identifier, escaping embedded quotes.
     */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String quoteQualified(String schema, String name) {
        return quote(schema) + "." + quote(name);
    }

    static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    static String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
