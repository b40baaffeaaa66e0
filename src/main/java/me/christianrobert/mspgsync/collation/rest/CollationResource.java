package me.christianrobert.mspgsync.collation.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.collation.service.CollationMappingService;
import me.christianrobert.mspgsync.core.exception.MigrationException;
import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.model.collation.CollationMigrationResult;
import me.christianrobert.mspgsync.core.job.service.JobRegistry;
import me.christianrobert.mspgsync.core.job.service.JobService;
import me.christianrobert.mspgsync.core.service.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Path("/api/collations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CollationResource {

    private static final Logger log = LoggerFactory.getLogger(CollationResource.class);

    @Inject
    CollationMappingService collationMappingService;

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @GET
    public Response getMappings() {
        try {
            return Response.ok(toResponse(collationMappingService.snapshot())).build();
        } catch (MigrationException e) {
            return errorResponse("Failed to load collation mappings", e);
        }
    }

    @PUT
    public Response replaceMappings(Map<String, List<String>> mappings) {
        if (mappings == null || mappings.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Collation table must not be empty"))
                    .build();
        }
        try {
            return Response.ok(toResponse(collationMappingService.save(mappings))).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to save collation mappings", e);
        }
    }

    @POST
    @Path("/reload")
    public Response reload() {
        try {
            return Response.ok(toResponse(collationMappingService.reload())).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to reload collation mappings", e);
        }
    }

    @POST
    @Path("/reset")
    public Response reset() {
        try {
            return Response.ok(toResponse(collationMappingService.resetToDefaults())).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to reset collation mappings", e);
        }
    }

    @POST
    @Path("/postgres/apply")
    public Response applyCollations() {
        try {
            Job<?> job = jobRegistry.createJob("POSTGRES", "COLLATION_MIGRATION")
                    .orElseThrow(() -> new IllegalArgumentException("No job available for POSTGRES COLLATION_MIGRATION operation"));
            String jobId = jobService.submitJob(job);
            log.info("Collation migration job started with ID: {}", jobId);
            return Response.ok(Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", "Collation migration job started successfully"
            )).build();
        } catch (Exception e) {
            return errorResponse("Failed to start collation migration", e);
        }
    }

    @GET
    @Path("/result")
    public Response getLastResult() {
        CollationMigrationResult result = stateService.getCollationMigrationResult();
        if (result == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", "No collation migration has run yet"))
                    .build();
        }
        Map<String, Object> summary = new HashMap<>();
        summary.put("skipped", result.isSkipped());
        summary.put("outcome", result.getOutcome().name());
        summary.put("applied", result.getApplied());
        summary.put("keptDefault", result.getKeptDefault());
        summary.put("unresolved", result.getUnresolved());
        summary.put("errors", result.getErrors());
        return Response.ok(summary).build();
    }

    private Map<String, Object> toResponse(CollationMappingTable table) {
        Map<String, Object> result = new HashMap<>();
        result.put("version", table.getVersion());
        result.put("count", table.size());
        result.put("collations", table.getEntries());
        return result;
    }

    private Response errorResponse(String message, Exception e) {
        log.error(message, e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(Map.of("status", "error", "message", message + ": " + e.getMessage()))
                .build();
    }
}
