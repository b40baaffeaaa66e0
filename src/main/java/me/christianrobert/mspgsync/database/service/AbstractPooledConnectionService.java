package me.christianrobert.mspgsync.database.service;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Connection access backed by a bounded HikariCP pool. The pool is (re)built lazily
 * whenever the configured URL, user or pool size changed.
 */
public abstract class AbstractPooledConnectionService {

    private static final Logger log = LoggerFactory.getLogger(AbstractPooledConnectionService.class);

    @Inject
    ConfigService configService;

    private HikariDataSource dataSource;
    private String poolKey;

    /**
     * Display name used in log and error messages, e.g. "SQL Server".
     */
    protected abstract String getDatabaseName();

    protected abstract String buildJdbcUrl();

    protected abstract String getUser();

    protected abstract String getPassword();

    public Connection getConnection() throws SQLException {
        return getDataSource().getConnection();
    }

    /**
     * Maximum number of connections the pool hands out; the worker pools are bounded by it.
     */
    public int getMaximumPoolSize() {
        return configService.getConfigValueAsInt(ConfigService.WORKER_THREADS, 4) + 1;
    }

    protected synchronized HikariDataSource getDataSource() {
        String url = buildJdbcUrl();
        String user = getUser();
        if (url == null || user == null) {
            throw new IllegalStateException(getDatabaseName() + " connection parameters not configured");
        }

        String key = url + "|" + user + "|" + getMaximumPoolSize();
        if (dataSource == null || dataSource.isClosed() || !key.equals(poolKey)) {
            closePool();

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(user);
            config.setPassword(getPassword());
            config.setMaximumPoolSize(getMaximumPoolSize());
            config.setMinimumIdle(1);
            config.setConnectionTimeout(30_000);
            config.setPoolName("mspgsync-" + getDatabaseName().replace(' ', '-').toLowerCase());

            log.info("Creating {} connection pool for {} (max {} connections)",
                    getDatabaseName(), url, getMaximumPoolSize());
            dataSource = new HikariDataSource(config);
            poolKey = key;
        }
        return dataSource;
    }

    public Map<String, Object> testConnection() {
        Map<String, Object> result = new HashMap<>();

        try {
            log.info("Testing {} database connection...", getDatabaseName());
            long startTime = System.currentTimeMillis();

            try (Connection connection = getConnection()) {
                DatabaseMetaData metaData = connection.getMetaData();
                long connectionTime = System.currentTimeMillis() - startTime;

                result.put("status", "success");
                result.put("connected", true);
                result.put("message", "Successfully connected to " + getDatabaseName() + " database");
                result.put("connectionTimeMs", connectionTime);
                result.put("databaseProductName", metaData.getDatabaseProductName());
                result.put("databaseProductVersion", metaData.getDatabaseProductVersion());
                result.put("driverVersion", metaData.getDriverVersion());
                result.put("url", metaData.getURL());

                log.info("{} connection test successful - Connected in {}ms", getDatabaseName(), connectionTime);
            }
        } catch (SQLException e) {
            log.error("{} connection test failed with SQL error", getDatabaseName(), e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Database connection failed: " + e.getMessage());
            result.put("sqlState", e.getSQLState());
        } catch (RuntimeException e) {
            log.error("{} connection test failed", getDatabaseName(), e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Connection test failed: " + e.getMessage());
        }

        return result;
    }

    public boolean isConfigured() {
        String url = buildJdbcUrl();
        String user = getUser();
        return url != null && !url.isBlank() && user != null && !user.isBlank();
    }

    @PreDestroy
    synchronized void closePool() {
        if (dataSource != null && !dataSource.isClosed()) {
            log.info("Closing {} connection pool", getDatabaseName());
            dataSource.close();
        }
        dataSource = null;
    }
}
