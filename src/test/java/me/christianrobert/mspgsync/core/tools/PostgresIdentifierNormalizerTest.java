package me.christianrobert.mspgsync.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostgresIdentifierNormalizerTest {

    @Test
    void normalizeSchema_dboBecomesPublic() {
        assertEquals("public", PostgresIdentifierNormalizer.normalizeSchema("dbo", false));
        assertEquals("public", PostgresIdentifierNormalizer.normalizeSchema("DBO", true));
        assertEquals("Sales", PostgresIdentifierNormalizer.normalizeSchema("Sales", false));
        assertEquals("sales", PostgresIdentifierNormalizer.normalizeSchema("Sales", true));
    }

    @Test
    void normalizeName_replacesHyphensAndKeepsCaseUnlessLowercasing() {
        assertEquals("Order_Lines", PostgresIdentifierNormalizer.normalizeName("Order-Lines", false, "dbo.Order-Lines"));
        assertEquals("order_lines", PostgresIdentifierNormalizer.normalizeName("Order-Lines", true, "dbo.Order-Lines"));
    }

    @Test
    void shorten_keepsNamesWithinLimit() {
        String name = "a".repeat(PostgresIdentifierNormalizer.MAX_IDENTIFIER_BYTES);
        assertEquals(name, PostgresIdentifierNormalizer.shorten(name, "dbo.T." + name));
    }

    @Test
    void shorten_longNameGetsDeterministicHashSuffix() {
        String name = "FK_" + "VeryLongReferencingTableName_".repeat(3) + "Customers";
        String first = PostgresIdentifierNormalizer.shorten(name, "dbo.Orders." + name);
        String second = PostgresIdentifierNormalizer.shorten(name, "dbo.Orders." + name);

        assertEquals(first, second);
        assertEquals(PostgresIdentifierNormalizer.MAX_IDENTIFIER_BYTES, first.length());
        assertTrue(first.matches(".*_[0-9a-f]{8}"), first);
        assertTrue(name.startsWith(first.substring(0, first.length() - 9)));
    }

    @Test
    void shorten_samePrefixInDifferentTablesDoesNotCollide() {
        String name = "IX_" + "x".repeat(80);
        String a = PostgresIdentifierNormalizer.shorten(name, "dbo.Orders." + name);
        String b = PostgresIdentifierNormalizer.shorten(name, "dbo.Invoices." + name);

        assertNotEquals(a, b);
    }

    @Test
    void shorten_neverSplitsMultiByteCharacters() {
        String name = "ä".repeat(40);
        String shortened = PostgresIdentifierNormalizer.shorten(name, "dbo.T." + name);

        assertTrue(PostgresIdentifierNormalizer.utf8Length(shortened) <= PostgresIdentifierNormalizer.MAX_IDENTIFIER_BYTES);
        assertTrue(shortened.startsWith("ää"));
        assertTrue(shortened.substring(0, shortened.lastIndexOf('_')).chars().allMatch(c -> c == 'ä'));
    }

    @Test
    void quote_escapesEmbeddedQuotes() {
        assertEquals("\"a\"\"b\"", PostgresIdentifierNormalizer.quote("a\"b"));
        assertEquals("\"public\".\"Orders\"", PostgresIdentifierNormalizer.quoteQualified("public", "Orders"));
    }
}
