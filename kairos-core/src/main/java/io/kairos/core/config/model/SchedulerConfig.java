package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    String workspace,
    String storeFile,
    int workerThreads,
    String timezone,
    int storeRetrySeconds
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("~/.kairos/workspace", "scheduler.json", 4, "", 30);
    }

    public SchedulerConfig withWorkspace(String value) {
        return new SchedulerConfig(value, storeFile, workerThreads, timezone, storeRetrySeconds);
    }
}
