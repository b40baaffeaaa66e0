package me.christianrobert.mspgsync.verification.job;

import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport.ColumnStatus;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport.ColumnVerification;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport.TableVerification;
import me.christianrobert.mspgsync.core.tools.TypeCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the column comparison of ColumnVerificationJob.
 *
 * Purpose: columns match by type family rather than exact type, and a table only counts as
 * matched when every column, the column count and the row counts agree.
 */
class ColumnVerificationJobTest {

    private static ColumnMetadata column(String name, String type) {
        return new ColumnMetadata(name, type, null, null, null, true, null, 1);
    }

    // ========== Column comparison ==========

    @Test
    void compareColumn_sameFamilyMatches() {
        ColumnMetadata source = column("CreatedAt", "datetime2");
        ColumnMapping mapping = new ColumnMapping(source, "createdat", "TIMESTAMP");

        ColumnVerification result = ColumnVerificationJob.compareColumn(source, mapping,
                Map.of("createdat", "timestamp without time zone"));

        assertEquals(ColumnStatus.MATCHED, result.getStatus());
        assertEquals("DATETIME", result.getExpectedCategory());
        assertEquals("DATETIME", result.getActualCategory());
    }

    @Test
    void compareColumn_differentFamilyIsMismatch() {
        ColumnMetadata source = column("Flag", "bit");
        ColumnMapping mapping = new ColumnMapping(source, "flag", "BOOLEAN");

        ColumnVerification result = ColumnVerificationJob.compareColumn(source, mapping,
                Map.of("flag", "smallint"));

        assertEquals(ColumnStatus.TYPE_MISMATCH, result.getStatus());
        assertEquals("BOOLEAN", result.getExpectedCategory());
        assertEquals("INTEGER", result.getActualCategory());
    }

    @Test
    void compareColumn_absentTargetColumnIsMissing() {
        ColumnMetadata source = column("Notes", "nvarchar");
        ColumnMapping mapping = new ColumnMapping(source, "notes", "TEXT");

        ColumnVerification result = ColumnVerificationJob.compareColumn(source, mapping, Map.of("id", "integer"));

        assertEquals(ColumnStatus.MISSING, result.getStatus());
        assertNull(result.getTargetType());
    }

    @Test
    void compareColumn_withoutMappingIsMissing() {
        ColumnVerification result = ColumnVerificationJob.compareColumn(column("Id", "int"), null,
                Map.of("id", "integer"));

        assertEquals(ColumnStatus.MISSING, result.getStatus());
        assertNull(result.getTargetColumn());
    }

    @Test
    void expectedCategory_usesMappedTypeForSourceTypesWithoutFamily() {
        ColumnMetadata source = column("Shape", "geography");

        assertEquals(TypeCategory.OTHER, ColumnVerificationJob.expectedCategory(source, null));
        assertEquals(TypeCategory.TEXT,
                ColumnVerificationJob.expectedCategory(source, new ColumnMapping(source, "shape", "TEXT")));
    }

    @Test
    void compareColumn_decimalIdentityOnBigintMatches() {
        ColumnMetadata source = new ColumnMetadata("Id", "decimal", null, 18, 0, false,
                true, 1, 1, null, 1, null);
        ColumnMapping mapping = new ColumnMapping(source, "id", "BIGINT");

        ColumnVerification result = ColumnVerificationJob.compareColumn(source, mapping, Map.of("id", "bigint"));

        assertEquals(ColumnStatus.MATCHED, result.getStatus());
        assertEquals("INTEGER", result.getExpectedCategory());
    }

    @Test
    void expectedCategory_plainDecimalStaysNumeric() {
        ColumnMetadata source = column("Amount", "decimal");

        assertNotEquals(TypeCategory.INTEGER,
                ColumnVerificationJob.expectedCategory(source, new ColumnMapping(source, "amount", "NUMERIC(18,2)")));
    }

    // ========== Table verdict ==========

    @Test
    void tableWithRowCountDifferenceIsNotMatched() {
        ColumnVerification id = new ColumnVerification("Id", "int", "id", "integer", "INTEGER", "INTEGER",
                ColumnStatus.MATCHED);
        TableVerification table = new TableVerification("dbo.Orders", "dbo.orders", true, 1, 1,
                List.of(id), 10L, 9L, null);

        VerificationReport report = new VerificationReport();
        report.addTable(table);

        assertFalse(table.isMatched());
        assertEquals(1, report.getFailureCount());
        assertEquals(List.of("dbo.orders: row count 10 vs 9"), report.getFailureMessages());
    }

    @Test
    void rowCountsAreIgnoredWhenNotCompared() {
        ColumnVerification id = new ColumnVerification("Id", "int", "id", "integer", "INTEGER", "INTEGER",
                ColumnStatus.MATCHED);
        TableVerification table = new TableVerification("dbo.Orders", "dbo.orders", true, 1, 1,
                List.of(id), null, null, null);

        assertTrue(table.isMatched());
    }

    @Test
    void missingTableIsReported() {
        VerificationReport report = new VerificationReport();
        report.addTable(new TableVerification("dbo.Gone", "dbo.gone", false, 3, 0, List.of(), null, null,
                "Table missing in PostgreSQL"));

        assertEquals(0, report.getMatchedTableCount());
        assertEquals(List.of("dbo.gone: table missing in PostgreSQL"), report.getFailureMessages());
    }
}
