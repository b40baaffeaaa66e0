package me.christianrobert.mspgsync.script.service;

import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.collation.service.DefaultCollationMappings;
import me.christianrobert.mspgsync.core.job.model.script.AppliedChange;
import me.christianrobert.mspgsync.core.job.model.script.FileConversionResult;
import me.christianrobert.mspgsync.script.rule.DataTypeRule;
import me.christianrobert.mspgsync.script.rule.DropConstraintRule;
import me.christianrobert.mspgsync.script.rule.ExtendedPropertyRule;
import me.christianrobert.mspgsync.script.rule.FunctionRule;
import me.christianrobert.mspgsync.script.rule.SchemaPrefixRule;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import me.christianrobert.mspgsync.typemapping.service.DefaultTypeMappings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScriptRewriter.
 *
 * Purpose: every rule of the T-SQL to PostgreSQL rewrite on small scripts, and that nothing
 * inside string literals or comments is ever touched.
 */
class ScriptRewriterTest {

    private static final TypeMappingTable TYPES = new TypeMappingTable(1, DefaultTypeMappings.get());
    private static final CollationMappingTable COLLATIONS = new CollationMappingTable(1, DefaultCollationMappings.get());

    private final ScriptRewriter rewriter = new ScriptRewriter(TYPES, COLLATIONS, false, false);

    private static String convert(ScriptRewriter rewriter, String sql) {
        FileConversionResult result = rewriter.convert("test.sql", sql);
        assertTrue(result.isSuccess(), result.getError());
        return result.getConvertedText();
    }

    private String convert(String sql) {
        return convert(rewriter, sql);
    }

    private static List<String> ruleIds(FileConversionResult result) {
        return result.getChanges().stream().map(AppliedChange::getRuleId).collect(Collectors.toList());
    }

    // ========== Literal safety ==========

    @Test
    void literalsAndCommentsStayUntouched() {
        String sql = "SELECT 'GETDATE() GO [x] dbo.y' AS label /* GETDATE() [y] */ FROM dbo.Orders\n";

        FileConversionResult result = rewriter.convert("literal.sql", sql);

        assertEquals("SELECT 'GETDATE() GO [x] dbo.y' AS label /* GETDATE() [y] */ FROM Orders\n",
                result.getConvertedText());
        assertEquals(List.of(SchemaPrefixRule.ID), ruleIds(result));
    }

    @Test
    void functionCallRecordsOneChangePerRewrite() {
        FileConversionResult result = rewriter.convert("fn.sql", "SELECT dbo.Fn(GETDATE())");

        assertEquals("SELECT Fn(CURRENT_TIMESTAMP)", result.getConvertedText());
        assertEquals(2, result.getChangeCount());
        assertEquals(List.of(SchemaPrefixRule.ID, FunctionRule.ID), ruleIds(result));
    }

    @Test
    void renamedFunctionsKeepTheirArguments() {
        assertEquals("SELECT COALESCE(Name, 'n/a'), LENGTH(Name) FROM Customers",
                convert("SELECT ISNULL(Name, 'n/a'), LEN(Name) FROM Customers"));
        assertEquals("SELECT gen_random_uuid()", convert("SELECT NEWID()"));
    }

    @Test
    void functionNamesUsedAsObjectNamesStayUntouched() {
        FileConversionResult result = rewriter.convert("len.sql", "CREATE TABLE Len (Id int)\nSELECT * FROM Len (NOLOCK)");

        assertEquals("CREATE TABLE Len (Id INTEGER)\nSELECT * FROM Len (NOLOCK)", result.getConvertedText());
        assertFalse(ruleIds(result).contains(FunctionRule.ID));
        assertEquals("INSERT INTO Len (Id) VALUES (LENGTH('abc'))",
                convert("INSERT INTO Len (Id) VALUES (LEN('abc'))"));
    }

    @Test
    void functionCallsAfterKeywordsAreStillRenamed() {
        assertEquals("SELECT LENGTH(x)", convert("SELECT LEN(x)"));
        assertEquals("SELECT CASE WHEN a = 1 THEN LENGTH(b) ELSE 0 END FROM t",
                convert("SELECT CASE WHEN a = 1 THEN LEN(b) ELSE 0 END FROM t"));
    }

    // ========== Batches ==========

    @Test
    void batchesAreTerminatedWithSemicolons() {
        FileConversionResult result = rewriter.convert("batches.sql", "SELECT 1\nGO\nSELECT 2;\nGO\nSELECT 3");

        assertEquals("SELECT 1;\n\nSELECT 2;\n\nSELECT 3", result.getConvertedText());
        assertEquals(List.of("SELECT 1", "SELECT 2;", "SELECT 3"), result.getStatementGroups());
        assertEquals(3, result.getStatementGroupCount());
    }

    @Test
    void emptyBatchBetweenSeparatorsIsCounted() {
        FileConversionResult result = rewriter.convert("empty.sql", "SELECT 1\nGO\nGO\nSELECT 2");

        assertEquals(List.of("SELECT 1", "", "SELECT 2"), result.getStatementGroups());
        assertEquals(3, result.getStatementGroupCount());
    }

    @Test
    void unterminatedLiteralFailsTheFile() {
        FileConversionResult result = rewriter.convert("broken.sql", "SELECT 1\nGO\nSELECT 'abc");

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("Unterminated string literal"));
        assertEquals("broken.sql", result.getFileName());
    }

    // ========== Data types and identity ==========

    @Test
    void createTableTypesAndIdentity() {
        String converted = convert(
                "CREATE TABLE [dbo].[Orders] (\n"
                        + "  [Id] int IDENTITY(100, 5) NOT NULL,\n"
                        + "  [Ref] uniqueidentifier NOT NULL,\n"
                        + "  [Created] datetime2(7) NULL,\n"
                        + "  [Note] nvarchar(max) NULL,\n"
                        + "  [Code] varchar(20) NULL\n"
                        + ")");

        assertEquals("CREATE TABLE \"Orders\" (\n"
                + "  \"Id\" INTEGER GENERATED BY DEFAULT AS IDENTITY (START WITH 100 INCREMENT BY 5) NOT NULL,\n"
                + "  \"Ref\" UUID NOT NULL,\n"
                + "  \"Created\" TIMESTAMPTZ NULL,\n"
                + "  \"Note\" TEXT NULL,\n"
                + "  \"Code\" varchar(20) NULL\n"
                + ")", converted);
    }

    @Test
    void identityAlwaysWithoutArguments() {
        ScriptRewriter always = new ScriptRewriter(TYPES, COLLATIONS, true, false);

        assertEquals("CREATE TABLE t (id bigint GENERATED ALWAYS AS IDENTITY)",
                convert(always, "CREATE TABLE t (id bigint IDENTITY NOT FOR REPLICATION)"));
    }

    @Test
    void variablesAndCastsGetMappedTypes() {
        assertEquals("DECLARE @s TEXT; SELECT CAST(@s AS VARCHAR(10))",
                convert("DECLARE @s nvarchar(max); SELECT CAST(@s AS nvarchar(10))"));
    }

    @Test
    void oversizedTypeLengthFailsTheFileWithPosition() {
        FileConversionResult result = rewriter.convert("huge.sql", "SELECT 1\nGO\nDECLARE @v varchar(99999999999)");

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("99999999999"), result.getError());
        assertTrue(result.getError().contains("line 3, column 12"), result.getError());
    }

    @Test
    void unknownTypeIsLeftWithWarning() {
        TypeMappingTable narrow = new TypeMappingTable(1, Map.of("int", "INTEGER"));
        ScriptRewriter rewriter = new ScriptRewriter(narrow, COLLATIONS, false, false);

        FileConversionResult result = rewriter.convert("geo.sql", "DECLARE @g geography");

        assertEquals("DECLARE @g geography", result.getConvertedText());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith(DataTypeRule.ID));
    }

    // ========== Existence guards ==========

    @Test
    void objectIdGuardBeforeDropBecomesDropIfExists() {
        assertEquals("DROP TABLE IF EXISTS Orders;\n",
                convert("IF OBJECT_ID('dbo.Orders', 'U') IS NOT NULL\n    DROP TABLE dbo.Orders;\n"));
    }

    @Test
    void existsGuardBeforeDropProcedure() {
        assertEquals("DROP PROCEDURE IF EXISTS GetOrders",
                convert("IF EXISTS (SELECT 1 FROM sys.procedures WHERE name = 'GetOrders') DROP PROC GetOrders"));
    }

    @Test
    void notExistsGuardBeforeCreateIndex() {
        assertEquals("CREATE INDEX IF NOT EXISTS IX_A ON Orders (CustomerId);",
                convert("IF NOT EXISTS (SELECT 1 FROM sys.indexes WHERE name = 'IX_A')\n"
                        + "CREATE INDEX IX_A ON Orders (CustomerId);"));
    }

    @Test
    void guardWithElseIsLeftUnchanged() {
        String sql = "IF OBJECT_ID('Audit') IS NULL\n  PRINT 'missing'\nELSE\n  PRINT 'exists'";

        FileConversionResult result = rewriter.convert("else.sql", sql);

        assertEquals(sql, result.getConvertedText());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("ELSE"));
    }

    @Test
    void otherGuardedStatementsBecomeDoBlock() {
        FileConversionResult result = rewriter.convert("do.sql",
                "IF OBJECT_ID('Audit') IS NOT NULL\nBEGIN\n  DELETE FROM Audit;\n  PRINT 'done';\nEND");

        assertTrue(result.getConvertedText().startsWith("DO $$\nBEGIN\n  IF to_regclass('Audit') IS NOT NULL THEN"),
                result.getConvertedText());
        assertTrue(result.getConvertedText().endsWith("END IF;\nEND $$"));
        assertEquals(1, result.getWarnings().size());
    }

    // ========== Other statements ==========

    @Test
    void dropIndexOnTableDropsByName() {
        assertEquals("DROP INDEX IF EXISTS IX_Orders_Date", convert("DROP INDEX IF EXISTS IX_Orders_Date ON dbo.Orders"));
        assertEquals("DROP INDEX IX_Orders_Date", convert("DROP INDEX Orders.IX_Orders_Date"));
    }

    @Test
    void transactionStatementsAreSimplified() {
        assertEquals("BEGIN\nUPDATE Orders SET Qty = 1\nCOMMIT",
                convert("BEGIN TRANSACTION\nUPDATE Orders SET Qty = 1\nCOMMIT TRAN"));
        assertEquals("ROLLBACK", convert("ROLLBACK TRANSACTION @tx"));
    }

    @Test
    void dropConstraintToleratesMissingConstraint() {
        FileConversionResult result = rewriter.convert("fk.sql", "ALTER TABLE [dbo].[Orders] DROP CONSTRAINT [FK_Orders_Customers]");

        assertEquals("ALTER TABLE \"Orders\" DROP CONSTRAINT IF EXISTS \"FK_Orders_Customers\"", result.getConvertedText());
        assertTrue(ruleIds(result).contains(DropConstraintRule.ID));
        assertEquals("ALTER TABLE sales.Orders DROP CONSTRAINT IF EXISTS CK_Qty",
                convert("ALTER TABLE sales.Orders DROP CONSTRAINT IF EXISTS CK_Qty"));
        assertEquals("ALTER TABLE Orders DROP COLUMN Qty", convert("ALTER TABLE Orders DROP COLUMN Qty"));
    }

    @Test
    void extendedPropertyBatchesAreRemovedWithWarning() {
        FileConversionResult result = rewriter.convert("props.sql",
                "CREATE TABLE T (Id int)\nGO\n"
                        + "EXEC sys.sp_addextendedproperty @name = N'MS_Description', @value = N'Orders table',\n"
                        + "  @level0type = N'SCHEMA', @level0name = N'dbo', @level1type = N'TABLE', @level1name = N'T'\n"
                        + "GO\nSELECT 1");

        assertEquals(List.of("CREATE TABLE T (Id INTEGER)", "", "SELECT 1"), result.getStatementGroups());
        assertTrue(ruleIds(result).contains(ExtendedPropertyRule.ID));
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith(ExtendedPropertyRule.ID), result.getWarnings().get(0));
        assertFalse(result.getConvertedText().contains("sp_addextendedproperty"));
    }

    @Test
    void extendedPropertyCallInsideMixedBatchIsOnlyWarned() {
        String sql = "PRINT 'adding'; EXEC sp_addextendedproperty N'MS_Description', N'x'";

        FileConversionResult result = rewriter.convert("mixed.sql", sql);

        assertEquals(sql, result.getConvertedText());
        assertEquals(1, result.getWarnings().size());
    }

    @Test
    void bracketIdentifiersBecomeQuoted() {
        assertEquals("SELECT \"Order Id\", \"Na\"\"me\" FROM \"Orders\"",
                convert("SELECT [Order Id], [Na\"me] FROM [dbo].[Orders]"));
    }

    @Test
    void collateClausesAreMappedOrRemoved() {
        assertEquals("CREATE TABLE T (Name VARCHAR(50) COLLATE \"C\")",
                convert("CREATE TABLE T (Name nvarchar(50) COLLATE Latin1_General_CS_AS)"));

        CollationMappingTable fallbackOnly = new CollationMappingTable(1, Map.of("default", List.of("default")));
        ScriptRewriter defaults = new ScriptRewriter(TYPES, fallbackOnly, false, false);
        assertEquals("CREATE TABLE T (Name VARCHAR(50))",
                convert(defaults, "CREATE TABLE T (Name nvarchar(50) COLLATE Latin1_General_CS_AS)"));
    }

    @Test
    void skippedCollationsLeaveCollateUntouched() {
        ScriptRewriter skipping = new ScriptRewriter(TYPES, COLLATIONS, false, true);

        assertEquals("CREATE TABLE T (Name VARCHAR(50) COLLATE Latin1_General_CS_AS)",
                convert(skipping, "CREATE TABLE T (Name nvarchar(50) COLLATE Latin1_General_CS_AS)"));
    }

    @Test
    void ruleIdsInApplicationOrder() {
        assertEquals("batch-separator", rewriter.getRuleIds().get(0));
        assertEquals("bracket-identifier", rewriter.getRuleIds().get(rewriter.getRuleIds().size() - 1));
        List<String> ids = rewriter.getRuleIds();
        assertEquals(ids.indexOf("transaction") + 1, ids.indexOf(DropConstraintRule.ID));
        assertEquals(ids.indexOf(DropConstraintRule.ID) + 1, ids.indexOf(ExtendedPropertyRule.ID));
    }
}
