package me.christianrobert.mspgsync.core.job.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a job's progress. Data transfer additionally publishes the rows
 * transferred per table as counters.
 */
public class JobProgress {

    private final int percentage;
    private final String currentTask;
    private final String details;
    private final LocalDateTime lastUpdated;
    private final Map<String, Long> counters;

    public JobProgress() {
        this(0, "", "");
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this(percentage, currentTask, details, Map.of());
    }

    public JobProgress(int percentage, String currentTask, String details, Map<String, Long> counters) {
        this.percentage = Math.max(0, Math.min(100, percentage));
        this.currentTask = currentTask != null ? currentTask : "";
        this.details = details != null ? details : "";
        this.counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
        this.lastUpdated = LocalDateTime.now();
    }

    public int getPercentage() {
        return percentage;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public String getDetails() {
        return details;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    public Map<String, Long> getCounters() {
        return counters;
    }

    @Override
    public String toString() {
        return "JobProgress{" +
                "percentage=" + percentage +
                ", currentTask='" + currentTask + '\'' +
                ", details='" + details + '\'' +
                ", counters=" + counters.size() +
                '}';
    }
}
