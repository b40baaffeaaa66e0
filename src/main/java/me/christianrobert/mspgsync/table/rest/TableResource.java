package me.christianrobert.mspgsync.table.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.TableCreationResult;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.service.JobRegistry;
import me.christianrobert.mspgsync.core.job.service.JobService;
import me.christianrobert.mspgsync.core.service.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST resource for introspection and table creation (first half of step 1).
 */
@ApplicationScoped
@Path("/api/tables")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TableResource {

    private static final Logger log = LoggerFactory.getLogger(TableResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @POST
    @Path("/postgres/create")
    public Response createTables() {
        String friendlyName = "PostgreSQL table creation";
        log.info("Starting {} job via REST API", friendlyName);

        try {
            Job<?> job = jobRegistry.createJob("POSTGRES", "TABLE_CREATION")
                    .orElseThrow(() -> new IllegalArgumentException("No job available for POSTGRES TABLE_CREATION operation"));

            String jobId = jobService.submitJob(job);

            log.info("{} job started with ID: {}", friendlyName, jobId);
            return Response.ok(Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", friendlyName + " job started successfully"
            )).build();

        } catch (Exception e) {
            log.error("Failed to start {} job", friendlyName, e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "Failed to start " + friendlyName + ": " + e.getMessage()))
                    .build();
        }
    }

    @GET
    @Path("/result")
    public Response getLastResult() {
        TableCreationResult result = stateService.getTableCreationResult();
        if (result == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", "No table creation has run yet"))
                    .build();
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("createdCount", result.getCreatedCount());
        summary.put("skippedCount", result.getSkippedCount());
        summary.put("errorCount", result.getErrorCount());
        summary.put("columnWarningCount", result.getColumnWarningCount());
        summary.put("outcome", result.getOutcome().name());
        summary.put("createdTables", result.getCreatedTables());
        summary.put("skippedTables", result.getSkippedTables());
        summary.put("errors", result.getErrors());
        summary.put("columnWarnings", result.getColumnWarnings());
        return Response.ok(summary).build();
    }

    /**
     * Source-to-target column map of every table defined in step 1.
     */
    @GET
    @Path("/column-map")
    public Response getColumnMap() {
        List<Map<String, Object>> tables = new ArrayList<>();
        for (TableDefinition definition : stateService.getTableDefinitions()) {
            Map<String, String> columns = new LinkedHashMap<>();
            for (ColumnMapping column : definition.getColumns()) {
                columns.put(column.getSourceColumn().getColumnName(), column.getTargetName());
            }
            Map<String, Object> table = new LinkedHashMap<>();
            table.put("sourceTable", definition.getSourceTable().getQualifiedName());
            table.put("targetTable", definition.getTargetQualifiedName());
            table.put("columns", columns);
            tables.add(table);
        }
        return Response.ok(Map.of("tables", tables)).build();
    }
}
