package me.christianrobert.mspgsync.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.core.job.DatabaseWriteJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Registry of migration step jobs using CDI-based discovery.
 * Jobs are keyed by "TARGET_OPERATION", e.g. "POSTGRES_DATA_TRANSFER".
 */
@ApplicationScoped
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    @Inject
    Instance<DatabaseWriteJob<?>> writeJobInstances;

    private final Map<String, Class<? extends DatabaseWriteJob<?>>> jobTypeMap = new TreeMap<>();

    @PostConstruct
    public void initialize() {
        log.info("Initializing JobRegistry and discovering migration jobs");

        for (DatabaseWriteJob<?> job : writeJobInstances) {
            String jobTypeKey = createJobTypeKey(job.getTargetDatabase(), job.getWriteOperationType());

            @SuppressWarnings("unchecked")
            Class<? extends DatabaseWriteJob<?>> jobClass = (Class<? extends DatabaseWriteJob<?>>) job.getClass();
            jobTypeMap.put(jobTypeKey, jobClass);

            log.info("Registered job: {} -> {} ({})", jobTypeKey, jobClass.getSimpleName(), job.getDescription());
        }

        if (jobTypeMap.isEmpty()) {
            log.warn("No migration jobs were discovered. Check that job classes carry a CDI scope.");
        }
    }

    /**
     * Creates a new job instance for the specified target and operation type.
     *
     * @return A new (Dependent scoped) job instance, or empty if no matching job is registered
     */
    public Optional<DatabaseWriteJob<?>> createJob(String database, String operationType) {
        String jobTypeKey = createJobTypeKey(database, operationType);

        Class<? extends DatabaseWriteJob<?>> jobClass = jobTypeMap.get(jobTypeKey);
        if (jobClass == null) {
            log.warn("No job registered for key: {}", jobTypeKey);
            return Optional.empty();
        }

        DatabaseWriteJob<?> jobInstance = writeJobInstances.select(jobClass).get();
        log.debug("Created new job instance: {} for key: {}", jobClass.getSimpleName(), jobTypeKey);
        return Optional.of(jobInstance);
    }

    public Map<String, String> getAvailableJobTypes() {
        Map<String, String> result = new TreeMap<>();
        jobTypeMap.forEach((key, value) -> result.put(key, value.getSimpleName()));
        return result;
    }

    public boolean isJobTypeSupported(String database, String operationType) {
        return jobTypeMap.containsKey(createJobTypeKey(database, operationType));
    }

    private String createJobTypeKey(String database, String operationType) {
        return database.toUpperCase() + "_" + operationType.toUpperCase();
    }
}
