package me.christianrobert.mspgsync.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.mspgsync.config.service.ConfigService;

/**
 * Pooled connections to the PostgreSQL target database.
 */
@ApplicationScoped
public class PostgresConnectionService extends AbstractPooledConnectionService {

    @Override
    protected String getDatabaseName() {
        return "PostgreSQL";
    }

    @Override
    protected String buildJdbcUrl() {
        String host = configService.getConfigValueAsString(ConfigService.POSTGRE_HOST);
        String database = configService.getConfigValueAsString(ConfigService.POSTGRE_DATABASE);
        if (host == null || database == null) {
            return null;
        }
        int port = configService.getConfigValueAsInt(ConfigService.POSTGRE_PORT, 5432);
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    @Override
    protected String getUser() {
        return configService.getConfigValueAsString(ConfigService.POSTGRE_USERNAME);
    }

    @Override
    protected String getPassword() {
        return configService.getConfigValueAsString(ConfigService.POSTGRE_PASSWORD);
    }
}
