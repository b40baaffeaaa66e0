package me.christianrobert.mspgsync.integration;

import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.collation.service.DefaultCollationMappings;
import me.christianrobert.mspgsync.constraint.service.ConstraintSqlBuilder;
import me.christianrobert.mspgsync.core.job.model.script.FileConversionResult;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.script.service.ScriptRewriter;
import me.christianrobert.mspgsync.transfer.service.PostgresCopyWriter;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import me.christianrobert.mspgsync.typemapping.service.DefaultTypeMappings;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Executes rewritten scripts and generated constraint statements on PostgreSQL 16.
 *
 * Purpose: the text produced by the rewriter and the constraint builder is not only the expected
 * string but also SQL that PostgreSQL accepts and runs with the intended effect.
 */
class MigrationSqlValidationTest extends PostgresValidationTestBase {

    private static final String ORDERS_SCRIPT = """
            IF OBJECT_ID('dbo.Orders', 'U') IS NOT NULL
                DROP TABLE dbo.Orders;
            GO
            CREATE TABLE dbo.Orders (
                Id int IDENTITY(1,1) NOT NULL,
                Ref uniqueidentifier NOT NULL,
                Note nvarchar(max) NULL,
                Placed datetime2 NOT NULL,
                Paid bit NOT NULL
            )
            GO
            BEGIN TRANSACTION;
            INSERT INTO dbo.Orders (Ref, Note, Placed, Paid) VALUES (NEWID(), 'first', GETDATE(), 'true');
            INSERT INTO dbo.Orders (Ref, Note, Placed, Paid) VALUES (NEWID(), NULL, GETDATE(), 'false');
            COMMIT TRANSACTION;
            GO
            """;

    private final ScriptRewriter rewriter = new ScriptRewriter(
            new TypeMappingTable(1, DefaultTypeMappings.get()),
            new CollationMappingTable(1, DefaultCollationMappings.get()),
            false, false);

    private String convert(String sql) {
        FileConversionResult result = rewriter.convert("orders.sql", sql);
        assertTrue(result.isSuccess(), result.getError());
        return result.getConvertedText();
    }

    private static TableDefinition ordersDefinition() {
        TableMetadata source = new TableMetadata("dbo", "Orders");
        ColumnMetadata id = new ColumnMetadata("Id", "int", null, 10, 0, false, null, 1);
        ColumnMetadata ref = new ColumnMetadata("Ref", "uniqueidentifier", null, null, null, false, null, 2);
        source.addColumn(id);
        source.addColumn(ref);
        return new TableDefinition(source, "public", "orders",
                List.of(new ColumnMapping(id, "id", "INTEGER"), new ColumnMapping(ref, "ref", "UUID")),
                "", List.of());
    }

    @Test
    void rewrittenScriptRunsOnPostgres() throws SQLException {
        executeUpdate(convert(ORDERS_SCRIPT));

        List<Map<String, Object>> rows = executeQuery(
                "SELECT id, note, paid FROM orders ORDER BY id");
        assertEquals(2, rows.size());
        assertEquals(1, rows.get(0).get("id"));
        assertEquals("first", rows.get(0).get("note"));
        assertEquals(Boolean.TRUE, rows.get(0).get("paid"));
        assertNull(rows.get(1).get("note"));

        List<Map<String, Object>> types = executeQuery("""
                SELECT column_name, data_type FROM information_schema.columns
                WHERE table_name = 'orders' AND column_name IN ('ref', 'placed')
                ORDER BY column_name
                """);
        assertEquals("timestamp with time zone", types.get(0).get("data_type"));
        assertEquals("uuid", types.get(1).get("data_type"));
    }

    @Test
    void rewrittenScriptCanRunTwice() throws SQLException {
        executeUpdate(convert(ORDERS_SCRIPT));
        executeUpdate(convert(ORDERS_SCRIPT));

        assertEquals(2, executeQuery("SELECT id FROM orders").size());
    }

    @Test
    void rewrittenFunctionsEvaluate() throws SQLException {
        List<Map<String, Object>> rows = executeQuery(
                convert("SELECT ISNULL(NULL, 'n/a') AS fallback, LEN('abcd') AS size"));

        assertEquals("n/a", rows.get(0).get("fallback"));
        assertEquals(4, rows.get(0).get("size"));
    }

    @Test
    void generatedConstraintsAreAccepted() throws SQLException {
        executeUpdate(convert(ORDERS_SCRIPT));
        ConstraintSqlBuilder builder = new ConstraintSqlBuilder(true);
        TableDefinition orders = ordersDefinition();

        executeUpdate(builder.primaryKeySql(orders, ConstraintMetadata.primaryKey("PK_Orders", List.of("Id"))));
        executeUpdate(builder.uniqueSql(orders, ConstraintMetadata.unique("UQ_Orders_Ref", List.of("Ref"))));

        List<Map<String, Object>> constraints = executeQuery("""
                SELECT conname, contype FROM pg_constraint
                WHERE conrelid = 'public.orders'::regclass AND contype IN ('p', 'u')
                ORDER BY conname
                """);
        assertEquals(2, constraints.size());
        assertEquals("pk_orders", constraints.get(0).get("conname"));
        assertEquals("uq_orders_ref", constraints.get(1).get("conname"));
        assertThrows(SQLException.class, () -> executeUpdate(
                "INSERT INTO orders (id, ref, placed, paid) SELECT id, ref, placed, paid FROM orders LIMIT 1"));
    }

    @Test
    void copyWriterLoadsCsvBatch() throws Exception {
        executeUpdate(convert(ORDERS_SCRIPT));
        executeUpdate("TRUNCATE orders");

        String csv = "\"0f8fad5b-d9cb-469f-a165-70867728950e\",\"with, comma\",\"2024-01-02T03:04:05Z\",\"true\"\n"
                + "\"7c9e6679-7425-40de-944b-e07fc1f90ae7\",\\N,\"2024-01-03T00:00:00Z\",\"false\"\n";
        long copied = new PostgresCopyWriter().copyIn(connection,
                "COPY orders (ref, note, placed, paid) FROM STDIN (FORMAT csv, NULL '\\N')", csv);

        assertEquals(2, copied);
        List<Map<String, Object>> rows = executeQuery("SELECT note FROM orders ORDER BY placed");
        assertEquals("with, comma", rows.get(0).get("note"));
        assertNull(rows.get(1).get("note"));
    }
}
