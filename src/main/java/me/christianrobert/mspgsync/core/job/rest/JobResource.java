package me.christianrobert.mspgsync.core.job.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.JobStatus;
import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;
import me.christianrobert.mspgsync.core.job.service.JobService;
import me.christianrobert.mspgsync.migration.model.MigrationRunResult;
import me.christianrobert.mspgsync.migration.rest.MigrationResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Generic REST resource for job status, results and cancellation.
 * Step-specific start endpoints live in their feature resources.
 */
@ApplicationScoped
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger log = LoggerFactory.getLogger(JobResource.class);

    @Inject
    JobService jobService;

    @GET
    @Path("/{jobId}/status")
    public Response getJobStatus(@PathParam("jobId") String jobId) {
        log.debug("Getting job status for: {}", jobId);

        JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);
        if (execution == null) {
            return notFound(jobId);
        }

        JobStatus status = execution.getStatus();
        JobProgress progress = execution.getProgress();

        Map<String, Object> result = new HashMap<>();
        result.put("jobId", jobId);
        result.put("jobType", execution.getJob().getJobType());
        result.put("status", status.name());
        result.put("isComplete", jobService.isJobComplete(jobId));

        if (progress != null) {
            result.put("progress", Map.of(
                    "percentage", progress.getPercentage(),
                    "currentTask", progress.getCurrentTask(),
                    "details", progress.getDetails(),
                    "counters", progress.getCounters(),
                    "lastUpdated", progress.getLastUpdated().toString()
            ));
        }

        if (status == JobStatus.FAILED || status == JobStatus.CANCELLED) {
            Throwable error = jobService.getJobError(jobId);
            if (error != null) {
                result.put("error", String.valueOf(error.getMessage()));
            }
        }

        return Response.ok(result).build();
    }

    @GET
    @Path("/{jobId}/result")
    public Response getJobResult(@PathParam("jobId") String jobId) {
        log.debug("Getting job result for: {}", jobId);

        JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);
        if (execution == null) {
            return notFound(jobId);
        }

        if (!jobService.isJobComplete(jobId)) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Job is not yet complete: " + jobId))
                    .build();
        }

        if (execution.getStatus() != JobStatus.COMPLETED) {
            Throwable error = jobService.getJobError(jobId);
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of(
                            "status", execution.getStatus().name().toLowerCase(),
                            "jobId", jobId,
                            "message", error != null ? String.valueOf(error.getMessage()) : "Job did not complete"))
                    .build();
        }

        Object result = jobService.getJobResult(jobId);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("jobId", jobId);
        response.put("jobType", execution.getJob().getJobType());
        if (result instanceof MigrationStepResult stepResult) {
            response.put("outcome", stepResult.getOutcome().name());
            response.put("successCount", stepResult.getSuccessCount());
            response.put("failureCount", stepResult.getFailureCount());
            response.put("failures", stepResult.getFailureMessages());
        } else if (result instanceof MigrationRunResult run) {
            response.put("outcome", run.getOutcome().name());
            response.put("exitCode", run.getExitCode());
            response.put("result", MigrationResource.generateRunSummary(run));
            return Response.ok(response).build();
        }
        response.put("result", result);

        return Response.ok(response).build();
    }

    @POST
    @Path("/{jobId}/cancel")
    public Response cancelJob(@PathParam("jobId") String jobId) {
        log.info("Cancel requested for job: {}", jobId);

        if (jobService.getJobExecution(jobId) == null) {
            return notFound(jobId);
        }

        boolean requested = jobService.cancelJob(jobId);
        return Response.ok(Map.of(
                "status", requested ? "success" : "ignored",
                "jobId", jobId,
                "message", requested ? "Cancellation requested" : "Job already finished"
        )).build();
    }

    private Response notFound(String jobId) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("status", "error", "message", "Job not found: " + jobId))
                .build();
    }
}
