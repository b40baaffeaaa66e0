package me.christianrobert.mspgsync.typemapping.model;

import me.christianrobert.mspgsync.core.exception.UnknownTypeMappingException;
import me.christianrobert.mspgsync.typemapping.service.DefaultTypeMappings;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TypeMappingTable.resolve().
 *
 * Purpose: Verify the default SQL Server catalog and the most-specific-signature-first lookup.
 */
class TypeMappingTableTest {

    private final TypeMappingTable defaults = new TypeMappingTable(1, DefaultTypeMappings.get());

    // ========== Default catalog ==========

    @Test
    void resolve_uniqueidentifierMapsToUuid() {
        assertEquals("UUID", defaults.resolve("uniqueidentifier", null, null, null));
    }

    @Test
    void resolve_datetime2MapsToTimestampWithTimeZone() {
        assertEquals("TIMESTAMPTZ", defaults.resolve("datetime2", 27, 7, null));
    }

    @Test
    void resolve_bitMapsToBoolean() {
        assertEquals("BOOLEAN", defaults.resolve("bit", null, null, null));
    }

    @Test
    void resolve_everyDefaultSignatureResolvesToItsEntry() {
        for (Map.Entry<String, String> entry : DefaultTypeMappings.get().entrySet()) {
            String signature = entry.getKey();
            if (signature.endsWith("(max)")) {
                String name = signature.substring(0, signature.indexOf('('));
                assertEquals(entry.getValue(), defaults.resolve(name, null, null, -1), signature);
            } else {
                assertEquals(entry.getValue(), defaults.resolve(signature, null, null, null), signature);
            }
        }
    }

    // ========== Longest match precedence ==========

    @Test
    void resolve_maxVariantWinsOverBareName() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("nvarchar", "VARCHAR");
        entries.put("nvarchar(max)", "CITEXT");
        TypeMappingTable table = new TypeMappingTable(1, entries);

        assertEquals("CITEXT", table.resolve("nvarchar", null, null, -1),
                "nvarchar(max) must use its own entry, not the bare nvarchar mapping");
        assertEquals("VARCHAR(40)", table.resolve("nvarchar", null, null, 40));
    }

    @Test
    void resolve_maxWithoutDedicatedEntryFallsBackToText() {
        TypeMappingTable table = new TypeMappingTable(1, Map.of("varchar", "VARCHAR"));
        assertEquals("TEXT", table.resolve("varchar", null, null, -1));
    }

    @Test
    void resolve_decimalKeepsPrecisionAndScale() {
        assertEquals("DECIMAL(19,4)", defaults.resolve("decimal", 19, 4, null));
    }

    @Test
    void resolve_parameterizedEntryWinsOverCarriedParameters() {
        Map<String, String> entries = new LinkedHashMap<>(DefaultTypeMappings.get());
        entries.put("decimal(19,4)", "MONEY");
        TypeMappingTable table = new TypeMappingTable(2, entries);

        assertEquals("MONEY", table.resolve("decimal", 19, 4, null));
        assertEquals("DECIMAL(10,2)", table.resolve("decimal", 10, 2, null));
    }

    // ========== Signatures ==========

    @Test
    void resolve_isCaseInsensitiveAndAcceptsBrackets() {
        assertEquals("UUID", defaults.resolve("[UniqueIdentifier]", null, null, null));
    }

    @Test
    void normalizeSignature_stripsBracketsAndWhitespace() {
        assertEquals("nvarchar(max)", TypeMappingTable.normalizeSignature("[NVarChar] ( MAX )"));
    }

    @Test
    void resolve_unknownTypeFails() {
        UnknownTypeMappingException e = assertThrows(UnknownTypeMappingException.class,
                () -> defaults.resolve("geography", null, null, null));
        assertTrue(e.getMessage().contains("geography"));
    }

    @Test
    void resolve_unknownTypeUsesGenericFallbackWhenPresent() {
        Map<String, String> entries = new LinkedHashMap<>(DefaultTypeMappings.get());
        entries.put(TypeMappingTable.GENERIC_FALLBACK, "TEXT");
        TypeMappingTable table = new TypeMappingTable(1, entries);

        assertEquals("TEXT", table.resolve("sql_variant", null, null, null));
    }
}
