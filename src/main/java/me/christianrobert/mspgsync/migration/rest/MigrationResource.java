package me.christianrobert.mspgsync.migration.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.job.service.JobService;
import me.christianrobert.mspgsync.migration.job.MigrationRunJob;
import me.christianrobert.mspgsync.migration.model.MigrationRunResult;
import me.christianrobert.mspgsync.migration.model.StepResult;
import me.christianrobert.mspgsync.migration.service.MigrationRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST entry points for run-all and single steps. Both start a background job whose
 * progress and {@link MigrationRunResult} are available under /api/jobs.
 */
@ApplicationScoped
@Path("/api/migration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class MigrationResource {

    private static final Logger log = LoggerFactory.getLogger(MigrationResource.class);

    @Inject
    JobService jobService;

    @Inject
    MigrationRunService migrationRunService;

    @POST
    @Path("/run-all")
    public Response runAll() {
        return submit(new MigrationRunJob(migrationRunService, null));
    }

    @POST
    @Path("/steps/{step}")
    public Response runStep(@PathParam("step") int step) {
        if (step < MigrationRunService.FIRST_STEP || step > MigrationRunService.LAST_STEP) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message",
                            String.format("Step must be between %d and %d", MigrationRunService.FIRST_STEP,
                                    MigrationRunService.LAST_STEP)))
                    .build();
        }
        return submit(new MigrationRunJob(migrationRunService, step));
    }

    private Response submit(MigrationRunJob job) {
        try {
            String jobId = jobService.submitJob(job);
            log.info("{} job started with ID: {}", job.getDescription(), jobId);
            return Response.ok(Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", job.getDescription() + " started successfully"
            )).build();
        } catch (Exception e) {
            log.error("Failed to start {}", job.getDescription(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "Failed to start migration: " + e.getMessage()))
                    .build();
        }
    }

    public static Map<String, Object> generateRunSummary(MigrationRunResult run) {
        List<Map<String, Object>> steps = new ArrayList<>();
        for (StepResult step : run.getSteps()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step", step.getStepNumber());
            details.put("name", step.getStepName());
            details.put("outcome", step.getOutcome().name());
            details.put("skipped", step.isSkipped());
            details.put("successCount", step.getSuccessCount());
            details.put("failureCount", step.getFailureCount());
            details.put("failures", step.getFailures());
            details.put("elapsedMillis", step.getElapsedMillis());
            steps.add(details);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("outcome", run.getOutcome().name());
        summary.put("exitCode", run.getExitCode());
        summary.put("aborted", run.isAborted());
        summary.put("elapsedMillis", run.getElapsedMillis());
        summary.put("steps", steps);
        return summary;
    }
}
