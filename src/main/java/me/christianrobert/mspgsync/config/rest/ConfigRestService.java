package me.christianrobert.mspgsync.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        Map<String, Object> config = configService.getAllConfiguration();
        config.computeIfPresent(ConfigService.MSSQL_PASSWORD, (k, v) -> "***");
        config.computeIfPresent(ConfigService.POSTGRE_PASSWORD, (k, v) -> "***");
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);
            return Response.ok(Map.of("status", "success", "message", "Configuration saved successfully")).build();
        } catch (RuntimeException e) {
            log.error("Error saving configuration", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "Failed to save configuration: " + e.getMessage()))
                    .build();
        }
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        if (body == null || !body.containsKey("value")) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain 'value' field"))
                    .build();
        }

        configService.setConfigValue(key, body.get("value"));
        return Response.ok(Map.of("status", "success", "key", key)).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        configService.resetToDefaults();
        return Response.ok(Map.of("status", "success", "message", "Configuration reset to defaults")).build();
    }
}
