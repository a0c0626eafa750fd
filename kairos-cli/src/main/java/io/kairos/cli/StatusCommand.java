package io.kairos.cli;

import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.scheduler.FileJobStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and job store status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KairosConfig config = context.configService().load(context.configPath());
            Path storeFile = ConfigPaths.resolveStoreFile(config.scheduler());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.scheduler().workspace()));
            System.out.println("Job store: " + storeFile);
            System.out.println("Stored jobs: " + new FileJobStore(storeFile).load().size());
            System.out.println("Calendar sync enabled: " + config.calendar().enabled());
            System.out.println("Calendar command: " + config.calendar().command());
            System.out.println("Default calendar: " + config.calendar().defaultCalendarId());
            System.out.println("API address: http://" + config.api().host() + ":" + config.api().port());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
