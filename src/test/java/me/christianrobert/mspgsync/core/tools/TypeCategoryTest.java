package me.christianrobert.mspgsync.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeCategoryTest {

    @Test
    void classifiesBothDialects() {
        assertEquals(TypeCategory.TEXT, TypeCategory.classify("nvarchar(max)"));
        assertEquals(TypeCategory.TEXT, TypeCategory.classify("character varying"));
        assertEquals(TypeCategory.BOOLEAN, TypeCategory.classify("bit"));
        assertEquals(TypeCategory.UUID, TypeCategory.classify("uniqueidentifier"));
        assertEquals(TypeCategory.BINARY, TypeCategory.classify("bytea"));
        assertEquals(TypeCategory.DECIMAL, TypeCategory.classify("money"));
    }

    @Test
    void keepsSuffixAfterParameters() {
        assertEquals("timestamp with time zone", TypeCategory.baseName("TIMESTAMP(3)  WITH TIME ZONE"));
        assertEquals(TypeCategory.DATETIME, TypeCategory.classify("timestamp(3) with time zone"));
    }

    @Test
    void stripsBrackets() {
        assertEquals(TypeCategory.INTEGER, TypeCategory.classify("[int]"));
    }

    @Test
    void unknownOrBlankIsOther() {
        assertEquals(TypeCategory.OTHER, TypeCategory.classify("geography"));
        assertEquals(TypeCategory.OTHER, TypeCategory.classify(null));
        assertEquals(TypeCategory.OTHER, TypeCategory.classify(" "));
    }

    @Test
    void onlyTextIsCollatable() {
        assertTrue(TypeCategory.TEXT.isCollatable());
        assertFalse(TypeCategory.XML.isCollatable());
    }
}
