package me.christianrobert.mspgsync.verification.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport;
import me.christianrobert.mspgsync.core.job.service.JobRegistry;
import me.christianrobert.mspgsync.core.job.service.JobService;
import me.christianrobert.mspgsync.core.service.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * REST resource for the column verification report.
 */
@ApplicationScoped
@Path("/api/verification")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class VerificationResource {

    private static final Logger log = LoggerFactory.getLogger(VerificationResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @POST
    @Path("/postgres/columns")
    public Response verifyColumns() {
        log.info("Starting column verification job via REST API");
        try {
            Job<?> job = jobRegistry.createJob("POSTGRES", "COLUMN_VERIFICATION")
                    .orElseThrow(() -> new IllegalArgumentException("No job available for POSTGRES COLUMN_VERIFICATION operation"));
            String jobId = jobService.submitJob(job);
            return Response.ok(Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", "Column verification job started successfully"
            )).build();
        } catch (Exception e) {
            log.error("Failed to start column verification job", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "Failed to start column verification: " + e.getMessage()))
                    .build();
        }
    }

    @GET
    @Path("/report")
    public Response getReport() {
        VerificationReport report = stateService.getVerificationReport();
        if (report == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", "No verification has run yet"))
                    .build();
        }
        return Response.ok(report).build();
    }
}
