package me.christianrobert.mspgsync.database.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.mspgsync.database.service.AbstractPooledConnectionService;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import me.christianrobert.mspgsync.database.service.SqlServerConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

@Path("/api/database/test")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConnectionTestResource {

    private static final Logger log = LoggerFactory.getLogger(ConnectionTestResource.class);

    @Inject
    SqlServerConnectionService sqlServerConnectionService;

    @Inject
    PostgresConnectionService postgresConnectionService;

    @GET
    @Path("/mssql")
    public Response testSqlServerConnection() {
        log.info("Testing SQL Server database connection via REST API");
        return toResponse(sqlServerConnectionService);
    }

    @GET
    @Path("/postgres")
    public Response testPostgresConnection() {
        log.info("Testing PostgreSQL database connection via REST API");
        return toResponse(postgresConnectionService);
    }

    private Response toResponse(AbstractPooledConnectionService connectionService) {
        Map<String, Object> result = connectionService.testConnection();
        if ("success".equals(result.get("status"))) {
            return Response.ok(result).build();
        }
        return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(result).build();
    }
}
