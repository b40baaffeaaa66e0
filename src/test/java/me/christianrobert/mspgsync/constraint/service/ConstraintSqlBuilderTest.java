package me.christianrobert.mspgsync.constraint.service;

import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintMetadata;
import me.christianrobert.mspgsync.core.job.model.table.IndexMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintSqlBuilderTest {

    private final ConstraintSqlBuilder builder = new ConstraintSqlBuilder(false);

    private static TableDefinition definition(String schema, String table, String... columns) {
        TableMetadata source = new TableMetadata("dbo", table);
        List<ColumnMapping> mappings = new ArrayList<>();
        int ordinal = 1;
        for (String column : columns) {
            ColumnMetadata metadata = new ColumnMetadata(column, "int", null, 10, 0, false, null, ordinal++);
            source.addColumn(metadata);
            mappings.add(new ColumnMapping(metadata, column, "INTEGER"));
        }
        return new TableDefinition(source, schema, table, mappings, "", List.of());
    }

    @Test
    void primaryKey() {
        TableDefinition orders = definition("public", "Orders", "Id");

        assertEquals("ALTER TABLE \"public\".\"Orders\" ADD CONSTRAINT \"PK_Orders\" PRIMARY KEY (\"Id\")",
                builder.primaryKeySql(orders, ConstraintMetadata.primaryKey("PK_Orders", List.of("Id"))));
    }

    @Test
    void unique_multiColumn() {
        TableDefinition lines = definition("public", "OrderLines", "OrderId", "LineNo");

        assertEquals("ALTER TABLE \"public\".\"OrderLines\" ADD CONSTRAINT \"UQ_Lines\" UNIQUE (\"OrderId\", \"LineNo\")",
                builder.uniqueSql(lines, ConstraintMetadata.unique("UQ_Lines", List.of("OrderId", "LineNo"))));
    }

    @Test
    void foreignKey_usesReferencedDefinitionAndActions() {
        TableDefinition orders = definition("public", "Orders", "Id", "CustomerId");
        TableDefinition customers = definition("public", "Customers", "Id");
        ConstraintMetadata fk = ConstraintMetadata.foreignKey("FK_Orders_Customers", List.of("CustomerId"),
                "dbo", "Customers", List.of("Id"));
        fk.setDeleteRule("CASCADE");
        fk.setUpdateRule("SET_NULL");

        assertEquals("ALTER TABLE \"public\".\"Orders\" ADD CONSTRAINT \"FK_Orders_Customers\" FOREIGN KEY (\"CustomerId\")"
                        + " REFERENCES \"public\".\"Customers\" (\"Id\") ON DELETE CASCADE ON UPDATE SET NULL",
                builder.foreignKeySql(orders, fk, customers));
    }

    @Test
    void foreignKey_withoutReferencedDefinitionNormalizesNames() {
        TableDefinition orders = definition("public", "Orders", "Id", "RegionId");
        ConstraintMetadata fk = ConstraintMetadata.foreignKey("FK_Orders_Regions", List.of("RegionId"),
                "geo", "Sales-Regions", List.of("Region-Id"));

        String sql = builder.foreignKeySql(orders, fk, null);

        assertTrue(sql.contains("REFERENCES \"geo\".\"Sales_Regions\" (\"Region_Id\")"), sql);
        assertTrue(sql.endsWith("ON DELETE NO ACTION ON UPDATE NO ACTION"), sql);
    }

    @Test
    void referentialAction_unknownOrMissingRuleIsNoAction() {
        assertEquals("NO ACTION", ConstraintSqlBuilder.referentialAction(null));
        assertEquals("NO ACTION", ConstraintSqlBuilder.referentialAction("whatever"));
        assertEquals("SET DEFAULT", ConstraintSqlBuilder.referentialAction("set_default"));
    }

    @Test
    void check_translatesPredicate() {
        TableDefinition lines = definition("public", "OrderLines", "Qty");

        assertEquals("ALTER TABLE \"public\".\"OrderLines\" ADD CONSTRAINT \"CK_Qty\" CHECK ((\"Qty\">(0)))",
                builder.checkSql(lines, ConstraintMetadata.check("CK_Qty", "([Qty]>(0))")));
    }

    @Test
    void index_descendingAndFiltered() {
        TableDefinition orders = definition("public", "Orders", "CustomerId", "CreatedAt", "Deleted");
        IndexMetadata index = new IndexMetadata("IX_Orders_Customer", false, "([Deleted]=(0))");
        index.addColumn("CustomerId", false);
        index.addColumn("CreatedAt", true);

        assertEquals("CREATE INDEX \"IX_Orders_Customer\" ON \"public\".\"Orders\" (\"CustomerId\", \"CreatedAt\" DESC)"
                        + " WHERE (\"Deleted\"=(0))",
                builder.indexSql(orders, index));
    }

    @Test
    void index_unique() {
        TableDefinition orders = definition("public", "Orders", "Number");
        IndexMetadata index = new IndexMetadata("UX_Orders_Number", true, null);
        index.addColumn("Number", false);

        assertEquals("CREATE UNIQUE INDEX \"UX_Orders_Number\" ON \"public\".\"Orders\" (\"Number\")",
                builder.indexSql(orders, index));
    }

    @Test
    void unknownColumnIsRejected() {
        TableDefinition orders = definition("public", "Orders", "Id");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builder.primaryKeySql(orders, ConstraintMetadata.primaryKey("PK_Orders", List.of("Missing"))));
        assertTrue(e.getMessage().contains("Missing"));
    }

    @Test
    void constraintName_normalizedAndShortened() {
        TableDefinition orders = definition("public", "Orders", "Id");
        ConstraintSqlBuilder lowercasing = new ConstraintSqlBuilder(true);
        String longName = "FK_" + "Very_Long_Constraint_Name_".repeat(4);

        assertEquals("pk_orders_x", lowercasing.targetConstraintName(orders, "PK_Orders-X"));

        String shortened = builder.targetConstraintName(orders, longName);
        assertTrue(shortened.getBytes(StandardCharsets.UTF_8).length <= 63);
        assertEquals(shortened, builder.targetConstraintName(orders, longName));
        assertTrue(shortened.matches(".*_[0-9a-f]{8}"), shortened);
    }
}
