package me.christianrobert.mspgsync.transfer.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import me.christianrobert.mspgsync.core.job.service.JobRegistry;
import me.christianrobert.mspgsync.core.job.service.JobService;
import me.christianrobert.mspgsync.core.service.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST resource for the bulk data transfer.
 */
@ApplicationScoped
@Path("/api/transfer")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DataTransferResource {

    private static final Logger log = LoggerFactory.getLogger(DataTransferResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    @POST
    @Path("/postgres/execute")
    public Response executeDataTransfer() {
        String friendlyName = "Data transfer from SQL Server to PostgreSQL";
        log.info("Starting {} job via REST API", friendlyName);

        try {
            Job<?> job = jobRegistry.createJob("POSTGRES", "DATA_TRANSFER")
                    .orElseThrow(() -> new IllegalArgumentException("No job available for POSTGRES DATA_TRANSFER operation"));

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
        DataTransferResult result = stateService.getDataTransferResult();
        if (result == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", "No data transfer has run yet"))
                    .build();
        }
        return Response.ok(generateDataTransferSummary(result)).build();
    }

    public static Map<String, Object> generateDataTransferSummary(DataTransferResult transferResult) {
        Map<String, Object> tables = new LinkedHashMap<>();
        for (DataTransferResult.TableTransfer table : transferResult.getTables()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("status", table.getStatus().name());
            details.put("rows", table.getRows());
            if (table.getMessage() != null) {
                details.put("message", table.getMessage());
            }
            tables.put(table.getTableName(), details);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalProcessed", transferResult.getTotalProcessed());
        summary.put("transferredCount", transferResult.getTransferredCount());
        summary.put("skippedCount", transferResult.getSkippedCount());
        summary.put("errorCount", transferResult.getErrorCount());
        summary.put("cancelledCount", transferResult.getCancelledCount());
        summary.put("totalRowsTransferred", transferResult.getTotalRowsTransferred());
        summary.put("outcome", transferResult.getOutcome().name());
        summary.put("executionTimestamp", transferResult.getExecutionDateTime().toString());
        summary.put("tables", tables);
        return summary;
    }
}
