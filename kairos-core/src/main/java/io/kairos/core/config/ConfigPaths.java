package io.kairos.core.config;

import io.kairos.core.config.model.SchedulerConfig;
import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".kairos", "config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".kairos", "workspace");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path resolveStoreFile(SchedulerConfig scheduler) {
        Path workspace = resolveWorkspace(scheduler.workspace());
        String storeFile = scheduler.storeFile();
        if (storeFile == null || storeFile.isBlank()) {
            return workspace.resolve("scheduler.json");
        }
        if (storeFile.startsWith("~/") || Path.of(storeFile).isAbsolute()) {
            return resolveWorkspace(storeFile);
        }
        return workspace.resolve(storeFile);
    }
}
