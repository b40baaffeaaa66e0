package me.christianrobert.mspgsync.constraint.job;

import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.constraint.service.ConstraintSqlBuilder;
import me.christianrobert.mspgsync.core.exception.ConnectivityException;
import me.christianrobert.mspgsync.core.exception.CyclicConstraintException;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintCreationResult;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintMetadata;
import me.christianrobert.mspgsync.core.job.model.table.IndexMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.service.StateService;
import me.christianrobert.mspgsync.core.tools.DdlLockRegistry;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for PostgresConstraintCreationJob.
 *
 * Purpose: constraints are issued in dependency order against a mocked PostgreSQL connection;
 * existing objects and foreign keys to missing tables are skipped, failing statements are
 * recorded without stopping the job.
 */
class PostgresConstraintCreationJobTest {

    private PostgresConnectionService postgresConnectionService;
    private StateService stateService;
    private Connection mockConnection;
    private PostgresConstraintCreationJob constraintCreationJob;

    private List<String> executedSql;
    private List<String[]> existingConstraints;
    private List<String[]> existingTables;
    private SQLException failure;
    private String failingFragment;

    private Consumer<JobProgress> progressCallback;
    private List<JobProgress> progressUpdates;

    @BeforeEach
    void setUp() throws Exception {
        postgresConnectionService = mock(PostgresConnectionService.class);
        stateService = mock(StateService.class);
        mockConnection = mock(Connection.class);
        when(postgresConnectionService.getConnection()).thenReturn(mockConnection);

        executedSql = new ArrayList<>();
        existingConstraints = new ArrayList<>();
        existingTables = new ArrayList<>();
        when(mockConnection.prepareStatement(anyString())).thenAnswer(inv -> statementFor(inv.getArgument(0)));

        constraintCreationJob = new PostgresConstraintCreationJob();
        injectDependency(constraintCreationJob, "postgresConnectionService", postgresConnectionService);
        injectDependency(constraintCreationJob, "stateService", stateService);
        injectDependency(constraintCreationJob, "configService", new ConfigService(Map.of()));
        injectDependency(constraintCreationJob, "ddlLockRegistry", new DdlLockRegistry());

        progressUpdates = new ArrayList<>();
        progressCallback = progress -> progressUpdates.add(progress);
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = null;
        Class<?> clazz = target.getClass();

        while (clazz != null && field == null) {
            try {
                field = clazz.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                clazz = clazz.getSuperclass();
            }
        }

        if (field != null) {
            field.setAccessible(true);
            field.set(target, dependency);
        } else {
            throw new NoSuchFieldException("Field " + fieldName + " not found in class hierarchy");
        }
    }

    private PreparedStatement statementFor(String sql) throws SQLException {
        PreparedStatement stmt = mock(PreparedStatement.class);
        if (sql.contains("pg_constraint")) {
            ResultSet rs = rows(existingConstraints);
            when(stmt.executeQuery()).thenReturn(rs);
        } else if (sql.contains("information_schema.tables")) {
            ResultSet rs = rows(existingTables);
            when(stmt.executeQuery()).thenReturn(rs);
        } else {
            when(stmt.executeUpdate()).thenAnswer(inv -> {
                if (failingFragment != null && sql.contains(failingFragment)) {
                    throw failure;
                }
                executedSql.add(sql);
                return 0;
            });
        }
        return stmt;
    }

    private static ResultSet rows(List<String[]> data) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        int[] cursor = {-1};
        when(rs.next()).thenAnswer(inv -> ++cursor[0] < data.size());
        when(rs.getString(anyInt())).thenAnswer(inv -> data.get(cursor[0])[inv.<Integer>getArgument(0) - 1]);
        return rs;
    }

    private static TableDefinition definition(TableMetadata source) {
        List<ColumnMapping> mappings = new ArrayList<>();
        for (ColumnMetadata column : source.getColumns()) {
            mappings.add(new ColumnMapping(column, column.getColumnName(), "INTEGER"));
        }
        return new TableDefinition(source, "public", source.getTableName(), mappings, "", List.of());
    }

    private static TableMetadata table(String name, String... columns) {
        TableMetadata table = new TableMetadata("dbo", name);
        int ordinal = 1;
        for (String column : columns) {
            table.addColumn(new ColumnMetadata(column, "int", null, 10, 0, false, null, ordinal++));
        }
        return table;
    }

    private void givenShop() {
        TableMetadata customers = table("Customers", "Id");
        customers.addConstraint(ConstraintMetadata.primaryKey("PK_Customers", List.of("Id")));

        TableMetadata orders = table("Orders", "Id", "CustomerId", "RegionId", "Qty");
        orders.addConstraint(ConstraintMetadata.check("CK_Orders_Qty", "([Qty]>(0))"));
        orders.addConstraint(ConstraintMetadata.foreignKey("FK_Orders_Customers", List.of("CustomerId"),
                "dbo", "Customers", List.of("Id")));
        orders.addConstraint(ConstraintMetadata.foreignKey("FK_Orders_Regions", List.of("RegionId"),
                "dbo", "Regions", List.of("Id")));
        orders.addConstraint(ConstraintMetadata.primaryKey("PK_Orders", List.of("Id")));
        IndexMetadata index = new IndexMetadata("IX_Orders_Customer", false, null);
        index.addColumn("CustomerId", false);
        orders.addIndex(index);

        when(stateService.getTableDefinitions()).thenReturn(List.of(definition(orders), definition(customers)));
        existingTables.add(new String[]{"public", "Customers"});
        existingTables.add(new String[]{"public", "Orders"});
        existingConstraints.add(new String[]{"public", "Orders", "PK_Orders"});
    }

    // ========== Job identity ==========

    @Test
    void testGetTargetDatabase() {
        assertEquals("POSTGRES", constraintCreationJob.getTargetDatabase());
    }

    @Test
    void testGetWriteOperationType() {
        assertEquals("CONSTRAINT_CREATION", constraintCreationJob.getWriteOperationType());
    }

    @Test
    void testGetResultType() {
        assertEquals(ConstraintCreationResult.class, constraintCreationJob.getResultType());
    }

    // ========== Execution ==========

    @Test
    void execute_noTableDefinitions() throws Exception {
        when(stateService.getTableDefinitions()).thenReturn(List.of());

        ConstraintCreationResult result = constraintCreationJob.execute(progressCallback).get();

        assertEquals(0, result.getCreatedCount());
        assertTrue(result.isSuccessful());
        verify(postgresConnectionService, never()).getConnection();
        verify(stateService).setConstraintCreationResult(result);
        assertEquals(100, progressUpdates.get(progressUpdates.size() - 1).getPercentage());
    }

    @Test
    void execute_createsInDependencyOrderAndSkipsExisting() throws Exception {
        givenShop();

        ConstraintCreationResult result = constraintCreationJob.execute(progressCallback).get();

        assertEquals(4, result.getCreatedCount());
        assertEquals(2, result.getSkippedCount());
        assertEquals(0, result.getErrorCount());

        assertEquals(4, executedSql.size());
        assertTrue(executedSql.get(0).contains("\"PK_Customers\" PRIMARY KEY"));
        assertTrue(executedSql.get(1).contains("\"FK_Orders_Customers\" FOREIGN KEY"));
        assertTrue(executedSql.get(2).contains("\"CK_Orders_Qty\" CHECK ((\"Qty\">(0)))"));
        assertEquals("CREATE INDEX \"IX_Orders_Customer\" ON \"public\".\"Orders\" (\"CustomerId\")", executedSql.get(3));
        assertEquals(executedSql, result.getEmittedStatements());

        List<String> skipped = result.getSkippedConstraints().stream()
                .map(ConstraintCreationResult.ConstraintInfo::getConstraintName).toList();
        assertEquals(List.of("PK_Orders", "FK_Orders_Regions"), skipped);
        assertTrue(result.getSkippedConstraints().get(1).getReason().contains("public.regions"));
    }

    @Test
    void execute_failedStatementIsRecordedAndJobContinues() throws Exception {
        givenShop();
        failingFragment = "CK_Orders_Qty";
        failure = new SQLException("check constraint is violated by some row", "23514");

        ConstraintCreationResult result = constraintCreationJob.execute(progressCallback).get();

        assertEquals(3, result.getCreatedCount());
        assertEquals(1, result.getErrorCount());
        ConstraintCreationResult.ConstraintCreationError error = result.getErrors().get(0);
        assertEquals("CK_Orders_Qty", error.getConstraintName());
        assertTrue(error.getSqlStatement().contains("CHECK"));
        assertTrue(executedSql.get(executedSql.size() - 1).startsWith("CREATE INDEX"));
    }

    @Test
    void execute_connectionLossFailsTheStep() {
        givenShop();
        failingFragment = "FK_Orders_Customers";
        failure = new SQLException("An I/O error occurred while sending to the backend", "08006");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> constraintCreationJob.execute(progressCallback).get());

        assertInstanceOf(ConnectivityException.class, e.getCause());
        assertEquals(1, executedSql.size());
    }

    @Test
    void execute_foreignKeyCycleFailsBeforeAnyStatement() throws Exception {
        TableMetadata a = table("A", "Id", "BId");
        a.addConstraint(ConstraintMetadata.foreignKey("FK_A_B", List.of("BId"), "dbo", "B", List.of("Id")));
        TableMetadata b = table("B", "Id", "AId");
        b.addConstraint(ConstraintMetadata.foreignKey("FK_B_A", List.of("AId"), "dbo", "A", List.of("Id")));
        when(stateService.getTableDefinitions()).thenReturn(List.of(definition(a), definition(b)));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> constraintCreationJob.execute(progressCallback).get());

        CyclicConstraintException cycle = assertInstanceOf(CyclicConstraintException.class, e.getCause());
        assertEquals(List.of("dbo.a", "dbo.b"), cycle.getTablesInCycles());
        verify(postgresConnectionService, never()).getConnection();
    }

    @Test
    void generateConstraintSql_checkWithoutConditionIsRejected() {
        TableDefinition orders = definition(table("Orders", "Id"));

        assertThrows(IllegalArgumentException.class, () -> PostgresConstraintCreationJob.generateConstraintSql(
                new ConstraintSqlBuilder(false), orders,
                ConstraintMetadata.check("CK_Empty", " "), null));
    }
}
