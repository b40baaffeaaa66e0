package me.christianrobert.mspgsync.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.mspgsync.config.service.ConfigService;

/**
 * Pooled connections to the SQL Server source database.
 */
@ApplicationScoped
public class SqlServerConnectionService extends AbstractPooledConnectionService {

    @Override
    protected String getDatabaseName() {
        return "SQL Server";
    }

    @Override
    protected String buildJdbcUrl() {
        String server = configService.getConfigValueAsString(ConfigService.MSSQL_SERVER);
        String database = configService.getConfigValueAsString(ConfigService.MSSQL_DATABASE);
        if (server == null || database == null) {
            return null;
        }
        int port = configService.getConfigValueAsInt(ConfigService.MSSQL_PORT, 1433);
        boolean encrypt = configService.isEnabled(ConfigService.MSSQL_ENCRYPT);
        return String.format("jdbc:sqlserver://%s:%d;databaseName=%s;encrypt=%s;trustServerCertificate=true",
                server, port, database, encrypt);
    }

    @Override
    protected String getUser() {
        return configService.getConfigValueAsString(ConfigService.MSSQL_USER);
    }

    @Override
    protected String getPassword() {
        return configService.getConfigValueAsString(ConfigService.MSSQL_PASSWORD);
    }
}
