package me.christianrobert.mspgsync.constraint.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintCreationResult;
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
 * REST resource for step 3, constraint and index creation.
 */
@ApplicationScoped
@Path("/api/constraints")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConstraintResource {

    private static final Logger log = LoggerFactory.getLogger(ConstraintResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @POST
    @Path("/postgres/create")
    public Response createConstraints() {
        String friendlyName = "PostgreSQL constraint creation";
        log.info("Starting {} job via REST API", friendlyName);

        try {
            Job<?> job = jobRegistry.createJob("POSTGRES", "CONSTRAINT_CREATION")
                    .orElseThrow(() -> new IllegalArgumentException("No job available for POSTGRES CONSTRAINT_CREATION operation"));

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
        ConstraintCreationResult result = stateService.getConstraintCreationResult();
        if (result == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", "No constraint creation has run yet"))
                    .build();
        }
        return Response.ok(generateConstraintCreationSummary(result)).build();
    }

    public static Map<String, Object> generateConstraintCreationSummary(ConstraintCreationResult result) {
        List<Map<String, Object>> errors = new ArrayList<>();
        for (ConstraintCreationResult.ConstraintCreationError error : result.getErrors()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("table", error.getTableName());
            details.put("constraint", error.getConstraintName());
            details.put("type", error.getConstraintType());
            details.put("error", error.getErrorMessage());
            details.put("sql", error.getSqlStatement());
            errors.add(details);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("createdCount", result.getCreatedCount());
        summary.put("skippedCount", result.getSkippedCount());
        summary.put("errorCount", result.getErrorCount());
        summary.put("outcome", result.getOutcome().name());
        summary.put("executionTimestamp", result.getExecutionDateTime().toString());
        summary.put("statements", result.getEmittedStatements());
        summary.put("errors", errors);
        return summary;
    }
}
