package me.christianrobert.mspgsync.collation.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default candidate lists, written to disk when no collation file exists.
 * Case-insensitive SQL Server collations prefer a German, then an English ICU or libc locale.
 */
public final class DefaultCollationMappings {

    private static final List<String> CASE_INSENSITIVE_GERMAN_FIRST = List.of(
            "de-DE-x-icu", "de_DE.utf8", "de_DE", "en-US-x-icu", "en_US.utf8", "C.UTF-8", "default");

    private static final Map<String, List<String>> DEFAULTS;

    static {
        Map<String, List<String>> defaults = new LinkedHashMap<>();
        defaults.put("SQL_Latin1_General_CP1_CI_AS", CASE_INSENSITIVE_GERMAN_FIRST);
        defaults.put("Latin1_General_CI_AS", CASE_INSENSITIVE_GERMAN_FIRST);
        defaults.put("SQL_Latin1_General_CP1_CS_AS", List.of("C"));
        defaults.put("Latin1_General_CS_AS", List.of("C"));
        defaults.put("German_PhoneBook_CI_AS", List.of("de-DE-x-icu", "de_DE.utf8", "de_DE", "default"));
        defaults.put("SQL_Latin1_General_CP850_CI_AS",
                List.of("de-DE-x-icu", "de_DE.utf8", "de_DE", "en-US-x-icu", "en_US.utf8", "default"));
        defaults.put("default", List.of("en-US-x-icu", "en_US.utf8", "C.UTF-8", "default"));
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private DefaultCollationMappings() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Map<String, List<String>> get() {
        return DEFAULTS;
    }
}
