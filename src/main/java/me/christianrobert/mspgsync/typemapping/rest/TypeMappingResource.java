package me.christianrobert.mspgsync.typemapping.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.core.exception.MigrationException;
import me.christianrobert.mspgsync.core.exception.UnknownTypeMappingException;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import me.christianrobert.mspgsync.typemapping.service.TypeMappingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Editor path for the type mapping table. Changes are persisted immediately and apply to the
 * next migration step.
 */
@Path("/api/type-mappings")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TypeMappingResource {

    private static final Logger log = LoggerFactory.getLogger(TypeMappingResource.class);

    @Inject
    TypeMappingService typeMappingService;

    @GET
    public Response getMappings() {
        try {
            return Response.ok(toResponse(typeMappingService.snapshot())).build();
        } catch (MigrationException e) {
            return errorResponse("Failed to load type mappings", e);
        }
    }

    @PUT
    public Response replaceMappings(Map<String, String> mappings) {
        if (mappings == null || mappings.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Mapping table must not be empty"))
                    .build();
        }
        try {
            return Response.ok(toResponse(typeMappingService.save(mappings))).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to save type mappings", e);
        }
    }

    @PUT
    @Path("/{signature}")
    public Response putMapping(@PathParam("signature") String signature, Map<String, String> body) {
        if (body == null || body.get("target") == null || body.get("target").isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Request body must contain 'target' field"))
                    .build();
        }
        try {
            return Response.ok(toResponse(typeMappingService.putMapping(signature, body.get("target")))).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to update mapping for " + signature, e);
        }
    }

    @DELETE
    @Path("/{signature}")
    public Response removeMapping(@PathParam("signature") String signature) {
        try {
            return Response.ok(toResponse(typeMappingService.removeMapping(signature))).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to remove mapping for " + signature, e);
        }
    }

    @POST
    @Path("/reload")
    public Response reload() {
        try {
            return Response.ok(toResponse(typeMappingService.reload())).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to reload type mappings", e);
        }
    }

    @POST
    @Path("/reset")
    public Response reset() {
        try {
            return Response.ok(toResponse(typeMappingService.resetToDefaults())).build();
        } catch (IOException | MigrationException e) {
            return errorResponse("Failed to reset type mappings", e);
        }
    }

    @GET
    @Path("/resolve")
    public Response resolve(@QueryParam("type") String type,
                            @QueryParam("precision") Integer precision,
                            @QueryParam("scale") Integer scale,
                            @QueryParam("length") Integer length) {
        if (type == null || type.isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Query parameter 'type' is required"))
                    .build();
        }
        try {
            String target = typeMappingService.resolve(type, precision, scale, length);
            return Response.ok(Map.of("sourceType", type, "targetType", target)).build();
        } catch (UnknownTypeMappingException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", e.getMessage(), "sourceType", e.getSourceType()))
                    .build();
        }
    }

    private Map<String, Object> toResponse(TypeMappingTable table) {
        Map<String, Object> result = new HashMap<>();
        result.put("version", table.getVersion());
        result.put("count", table.size());
        result.put("type_mappings", table.getEntries());
        return result;
    }

    private Response errorResponse(String message, Exception e) {
        log.error(message, e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(Map.of("status", "error", "message", message + ": " + e.getMessage()))
                .build();
    }
}
