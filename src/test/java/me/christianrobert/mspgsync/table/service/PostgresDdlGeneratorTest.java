package me.christianrobert.mspgsync.table.service;

import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import me.christianrobert.mspgsync.typemapping.service.DefaultTypeMappings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostgresDdlGeneratorTest {

    private final TypeMappingTable typeMappings = new TypeMappingTable(1, DefaultTypeMappings.get());

    private static TableMetadata orders() {
        TableMetadata table = new TableMetadata("dbo", "Orders");
        table.addColumn(new ColumnMetadata("Id", "uniqueidentifier", null, null, null, false, "(newid())", 1));
        table.addColumn(new ColumnMetadata("CreatedAt", "datetime2", null, 27, 7, false, "(sysdatetime())", 2));
        table.addColumn(new ColumnMetadata("Note", "nvarchar", ColumnMetadata.MAX_LENGTH, null, null, true, null, 3));
        return table;
    }

    @Test
    void generateCreateTable_ordersMapsUuidTimestampAndText() {
        TableDefinition definition = new PostgresDdlGenerator(typeMappings, false, false).generateCreateTable(orders());

        assertEquals("public", definition.getTargetSchema());
        assertEquals("Orders", definition.getTargetTableName());
        assertEquals("UUID", definition.findBySourceName("Id").getTargetType());
        assertEquals("TIMESTAMPTZ", definition.findBySourceName("CreatedAt").getTargetType());
        assertEquals("TEXT", definition.findBySourceName("Note").getTargetType());

        String sql = definition.getCreateTableSql();
        assertTrue(sql.startsWith("CREATE TABLE \"public\".\"Orders\" ("), sql);
        assertTrue(sql.contains("\"Id\" UUID NOT NULL DEFAULT gen_random_uuid()"), sql);
        assertTrue(sql.contains("\"CreatedAt\" TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP"), sql);
        assertTrue(sql.contains("\"Note\" TEXT"), sql);
        assertTrue(definition.getWarnings().isEmpty());
    }

    @Test
    void generateCreateTable_identityColumns() {
        TableMetadata table = new TableMetadata("sales", "Invoice");
        table.addColumn(ColumnMetadata.identity("InvoiceId", "int", 1, 1, 1));
        table.addColumn(ColumnMetadata.identity("Number", "bigint", 1000, 10, 2));

        String byDefault = new PostgresDdlGenerator(typeMappings, false, false).generateCreateTable(table).getCreateTableSql();
        String always = new PostgresDdlGenerator(typeMappings, true, false).generateCreateTable(table).getCreateTableSql();

        assertTrue(byDefault.contains("\"InvoiceId\" INTEGER GENERATED BY DEFAULT AS IDENTITY NOT NULL"), byDefault);
        assertTrue(byDefault.contains("\"Number\" BIGINT GENERATED BY DEFAULT AS IDENTITY (START WITH 1000 INCREMENT BY 10) NOT NULL"), byDefault);
        assertTrue(always.contains("\"InvoiceId\" INTEGER GENERATED ALWAYS AS IDENTITY NOT NULL"), always);
    }

    @Test
    void generateCreateTable_unknownTypeSkipsColumnWithWarning() {
        TableMetadata table = new TableMetadata("dbo", "Places");
        table.addColumn(new ColumnMetadata("Id", "int", null, 10, 0, false, null, 1));
        table.addColumn(new ColumnMetadata("Location", "geography", null, null, null, true, null, 2));

        TableDefinition definition = new PostgresDdlGenerator(typeMappings, false, false).generateCreateTable(table);

        assertEquals(1, definition.getColumns().size());
        assertNull(definition.findBySourceName("Location"));
        assertEquals(1, definition.getWarnings().size());
        assertEquals("Location", definition.getWarnings().get(0).getColumnName());
        assertTrue(definition.getWarnings().get(0).getMessage().contains("geography"));
    }

    @Test
    void generateCreateTable_lowercasesAndReplacesHyphens() {
        TableMetadata table = new TableMetadata("Sales", "Order-Lines");
        table.addColumn(new ColumnMetadata("Line-No", "int", null, 10, 0, false, null, 1));

        TableDefinition definition = new PostgresDdlGenerator(typeMappings, false, true).generateCreateTable(table);

        assertEquals("sales.order_lines", definition.getTargetQualifiedName());
        assertEquals("line_no", definition.findBySourceName("line-no").getTargetName());
    }

    @Test
    void generateCreateTable_longColumnNameIsShortened() {
        String longName = "C".repeat(70);
        TableMetadata table = new TableMetadata("dbo", "Wide");
        table.addColumn(new ColumnMetadata(longName, "int", null, 10, 0, true, null, 1));

        TableDefinition definition = new PostgresDdlGenerator(typeMappings, false, false).generateCreateTable(table);

        String target = definition.findBySourceName(longName).getTargetName();
        assertEquals(63, target.length());
        assertTrue(definition.findBySourceName(longName).isRenamed());
    }
}
