package me.christianrobert.mspgsync.script.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.job.DatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.script.ScriptConversionResult;
import me.christianrobert.mspgsync.core.job.service.JobRegistry;
import me.christianrobert.mspgsync.core.job.service.JobService;
import me.christianrobert.mspgsync.core.service.StateService;
import me.christianrobert.mspgsync.script.job.ScriptConversionJob;
import me.christianrobert.mspgsync.script.service.ScriptConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Map;

/**
 * REST resource for converting T-SQL script directories.
 */
@ApplicationScoped
@Path("/api/scripts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ScriptResource {

    private static final Logger log = LoggerFactory.getLogger(ScriptResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @Inject
    ScriptConversionService scriptConversionService;

    /**
     * Body: {@code {"sourceDirectory": "...", "targetDirectory": "..."}}.
     */
    @POST
    @Path("/convert")
    public Response convertScripts(Map<String, String> request) {
        String source = request != null ? request.get("sourceDirectory") : null;
        String target = request != null ? request.get("targetDirectory") : null;
        if (source == null || source.isBlank() || target == null || target.isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "sourceDirectory and targetDirectory are required"))
                    .build();
        }

        try {
            DatabaseWriteJob<?> job = jobRegistry.createJob("FILESYSTEM", "SCRIPT_CONVERSION")
                    .orElseThrow(() -> new IllegalArgumentException("No job available for SCRIPT_CONVERSION operation"));
            ((ScriptConversionJob) job).setDirectories(Paths.get(source), Paths.get(target));

            String jobId = jobService.submitJob(job);
            log.info("Script conversion job started with ID: {}", jobId);
            return Response.ok(Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", "Script conversion job started successfully"
            )).build();
        } catch (Exception e) {
            log.error("Failed to start script conversion job", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "Failed to start script conversion: " + e.getMessage()))
                    .build();
        }
    }

    @GET
    @Path("/result")
    public Response getLastResult() {
        ScriptConversionResult result = stateService.getScriptConversionResult();
        if (result == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", "No script conversion has run yet"))
                    .build();
        }
        return Response.ok(result).build();
    }

    @GET
    @Path("/rules")
    public Response getRules() {
        return Response.ok(Map.of("rules", scriptConversionService.createRewriter().getRuleIds())).build();
    }
}
