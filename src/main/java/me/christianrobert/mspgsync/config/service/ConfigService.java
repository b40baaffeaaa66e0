package me.christianrobert.mspgsync.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runtime settings of the migration. Starts from defaults, overridden by the
 * environment-style variables (MSSQL_SERVER, PG_HOST, MIGRATE_DATA, ...) and
 * later by the REST configuration endpoint.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String MSSQL_SERVER = "mssql.server";
    public static final String MSSQL_PORT = "mssql.port";
    public static final String MSSQL_DATABASE = "mssql.database";
    public static final String MSSQL_USER = "mssql.user";
    public static final String MSSQL_PASSWORD = "mssql.password";
    public static final String MSSQL_ENCRYPT = "mssql.encrypt";

    public static final String POSTGRE_HOST = "postgre.host";
    public static final String POSTGRE_PORT = "postgre.port";
    public static final String POSTGRE_DATABASE = "postgre.database";
    public static final String POSTGRE_USERNAME = "postgre.username";
    public static final String POSTGRE_PASSWORD = "postgre.password";

    public static final String LOG_LEVEL = "migration.log-level";
    public static final String MIGRATE_DATA = "migration.migrate-data";
    public static final String IDENTITY_ALWAYS = "migration.identity-always";
    public static final String SKIP_COLLATIONS = "migration.skip-collations";
    public static final String NORMALIZE_NAMES = "migration.normalize-names";
    public static final String SOURCE_SCHEMAS = "migration.source-schemas";
    public static final String EXISTING_TABLE_MODE = "migration.existing-table-mode";
    public static final String BATCH_SIZE = "migration.batch-size";
    public static final String MAX_RETRIES = "migration.max-retries";
    public static final String RETRY_BACKOFF_MS = "migration.retry-backoff-ms";
    public static final String WORKER_THREADS = "migration.worker-threads";

    public static final String PATH_TYPE_MAPPINGS = "path.type-mappings";
    public static final String PATH_COLLATIONS = "path.collations";
    public static final String PATH_REPORTS = "path.reports";

    /**
     * Environment variable name -> configuration key.
     */
    static final Map<String, String> ENVIRONMENT_KEYS = Map.ofEntries(
            Map.entry("MSSQL_SERVER", MSSQL_SERVER),
            Map.entry("MSSQL_PORT", MSSQL_PORT),
            Map.entry("MSSQL_DATABASE", MSSQL_DATABASE),
            Map.entry("MSSQL_USER", MSSQL_USER),
            Map.entry("MSSQL_PASSWORD", MSSQL_PASSWORD),
            Map.entry("PG_HOST", POSTGRE_HOST),
            Map.entry("PG_PORT", POSTGRE_PORT),
            Map.entry("PG_DATABASE", POSTGRE_DATABASE),
            Map.entry("PG_USER", POSTGRE_USERNAME),
            Map.entry("PG_PASSWORD", POSTGRE_PASSWORD),
            Map.entry("LOG_LEVEL", LOG_LEVEL),
            Map.entry("MIGRATE_DATA", MIGRATE_DATA),
            Map.entry("IDENTITY_ALWAYS", IDENTITY_ALWAYS),
            Map.entry("SKIP_STEP4", SKIP_COLLATIONS),
            Map.entry("NORMALIZE_COLUMNS", NORMALIZE_NAMES),
            Map.entry("BATCH_SIZE", BATCH_SIZE)
    );

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        initializeDefaultConfiguration();
        applyEnvironment(environment);
    }

    private void initializeDefaultConfiguration() {
        configuration.put(MSSQL_SERVER, "localhost");
        configuration.put(MSSQL_PORT, 1433);
        configuration.put(MSSQL_DATABASE, "master");
        configuration.put(MSSQL_USER, "sa");
        configuration.put(MSSQL_PASSWORD, "");
        configuration.put(MSSQL_ENCRYPT, false);

        configuration.put(POSTGRE_HOST, "localhost");
        configuration.put(POSTGRE_PORT, 5432);
        configuration.put(POSTGRE_DATABASE, "postgres");
        configuration.put(POSTGRE_USERNAME, "postgres");
        configuration.put(POSTGRE_PASSWORD, "");

        configuration.put(LOG_LEVEL, "INFO");
        configuration.put(MIGRATE_DATA, true);
        configuration.put(IDENTITY_ALWAYS, false);
        configuration.put(SKIP_COLLATIONS, false);
        configuration.put(NORMALIZE_NAMES, false);
        configuration.put(SOURCE_SCHEMAS, "");
        configuration.put(EXISTING_TABLE_MODE, "SKIP");
        configuration.put(BATCH_SIZE, 1000);
        configuration.put(MAX_RETRIES, 3);
        configuration.put(RETRY_BACKOFF_MS, 500);
        configuration.put(WORKER_THREADS, 4);

        configuration.put(PATH_TYPE_MAPPINGS, "type_mappings_config.json");
        configuration.put(PATH_COLLATIONS, "collations_config.json");
        configuration.put(PATH_REPORTS, "logs");

        log.info("Configuration service initialized with default values");
    }

    /**
     * Applies environment-style variables, converting values to the type of the default.
     */
    public void applyEnvironment(Map<String, String> environment) {
        Map<String, Object> overrides = new LinkedHashMap<>();
        ENVIRONMENT_KEYS.forEach((variable, key) -> {
            String raw = environment.get(variable);
            if (raw != null && !raw.isBlank()) {
                overrides.put(key, convertLike(configuration.get(key), raw.trim()));
            }
        });

        if (!overrides.isEmpty()) {
            log.info("Applying {} configuration values from environment", overrides.size());
            configuration.putAll(overrides);
        }
    }

    private Object convertLike(Object defaultValue, String raw) {
        if (defaultValue instanceof Boolean) {
            return "true".equalsIgnoreCase(raw) || "1".equals(raw) || "yes".equalsIgnoreCase(raw);
        }
        if (defaultValue instanceof Integer) {
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric value '{}', keeping default {}", raw, defaultValue);
                return defaultValue;
            }
        }
        return raw;
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    public boolean isEnabled(String key) {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(key));
    }

    /**
     * Gets an integer value, accepting numbers and numeric strings.
     *
     * @return the value, or {@code defaultValue} if missing or not numeric
     */
    public int getConfigValueAsInt(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Configuration value {}='{}' is not a number, using {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values: "dbo,sales"
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, isSecret(key) ? "***" : value,
                        isSecret(key) ? "***" : oldValue);
            }
        });
    }

    public void setConfigValue(String key, Object value) {
        configuration.put(key, value);
        log.debug("Config value set: {} = {}", key, isSecret(key) ? "***" : value);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private boolean isSecret(String key) {
        return key.endsWith("password");
    }
}
