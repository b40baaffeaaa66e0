package me.christianrobert.mspgsync.table.service;

import me.christianrobert.mspgsync.core.tools.TypeCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DefaultValueTransformer.transform().
 *
 * Purpose: Verify that SQL Server column defaults (stored with wrapping parentheses) become
 * valid PostgreSQL DEFAULT expressions.
 */
class DefaultValueTransformerTest {

    private static DefaultValueTransformer.TransformationResult transform(String value, TypeCategory category) {
        return DefaultValueTransformer.transform(value, category, "col", "dbo.T");
    }

    // ========== Parentheses ==========

    @Test
    void stripOuterParentheses_removesOnlyEnclosingPairs() {
        assertEquals("0", DefaultValueTransformer.stripOuterParentheses("((0))"));
        assertEquals("(a)+(b)", DefaultValueTransformer.stripOuterParentheses("(a)+(b)"));
        assertEquals("'(x'", DefaultValueTransformer.stripOuterParentheses("('(x')"));
    }

    // ========== Literals ==========

    @Test
    void numericLiteral() {
        assertEquals("42", transform("((42))", TypeCategory.INTEGER).getTransformedValue());
        assertEquals("-1.5", transform("((-1.5))", TypeCategory.DECIMAL).getTransformedValue());
    }

    @Test
    void bitLiteralBecomesBoolean() {
        assertEquals("FALSE", transform("((0))", TypeCategory.BOOLEAN).getTransformedValue());
        assertEquals("TRUE", transform("((1))", TypeCategory.BOOLEAN).getTransformedValue());
        assertEquals("TRUE", transform("('1')", TypeCategory.BOOLEAN).getTransformedValue());
    }

    @Test
    void unicodeStringLiteralLosesPrefix() {
        DefaultValueTransformer.TransformationResult result = transform("(N'it''s')", TypeCategory.TEXT);

        assertEquals("'it''s'", result.getTransformedValue());
        assertTrue(result.wasTransformed());
        assertFalse(result.isPassedThrough());
    }

    @Test
    void explicitNull() {
        assertEquals("NULL", transform("(NULL)", TypeCategory.TEXT).getTransformedValue());
    }

    // ========== Functions ==========

    @Test
    void getdateBecomesCurrentTimestamp() {
        assertEquals("CURRENT_TIMESTAMP", transform("(getdate())", TypeCategory.DATETIME).getTransformedValue());
        assertEquals("CURRENT_TIMESTAMP", transform("(SYSDATETIME())", TypeCategory.DATETIME).getTransformedValue());
    }

    @Test
    void getutcdateBecomesUtcTimestamp() {
        assertEquals("(CURRENT_TIMESTAMP AT TIME ZONE 'UTC')",
                transform("(getutcdate())", TypeCategory.DATETIME).getTransformedValue());
    }

    @Test
    void newidBecomesGenRandomUuid() {
        assertEquals("gen_random_uuid()", transform("(newid())", TypeCategory.UUID).getTransformedValue());
        assertEquals("gen_random_uuid()", transform("(newsequentialid ( ))", TypeCategory.UUID).getTransformedValue());
    }

    @Test
    void suserSnameBecomesCurrentUser() {
        assertEquals("CURRENT_USER", transform("(suser_sname())", TypeCategory.TEXT).getTransformedValue());
    }

    // ========== Unknown ==========

    @Test
    void unknownExpressionIsPassedThroughAndFlagged() {
        DefaultValueTransformer.TransformationResult result = transform("(dateadd(day,(1),getdate()))", TypeCategory.DATETIME);

        assertTrue(result.isPassedThrough());
        assertEquals("dateadd(day,(1),getdate())", result.getTransformedValue());
    }

    @Test
    void missingDefaultIsSkipped() {
        assertTrue(transform(null, TypeCategory.TEXT).isSkipped());
        assertTrue(transform("  ", TypeCategory.TEXT).isSkipped());
    }
}
