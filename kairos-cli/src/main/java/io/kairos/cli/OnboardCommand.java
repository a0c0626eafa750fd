package io.kairos.cli;

import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.OnboardResult;
import io.kairos.core.config.model.CalendarConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.scheduler.FileJobStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Initialize or refresh config, workspace and job store location")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults (stored jobs are kept)")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Reset config to defaults: " + result.configPath());
            } else {
                System.out.println("Merged new defaults into config: " + result.configPath());
            }
            System.out.println("Workspace ready: " + result.workspacePath());

            KairosConfig config = context.configService().load(context.configPath());
            Path storeFile = ConfigPaths.resolveStoreFile(config.scheduler());
            if (Files.exists(storeFile)) {
                int stored = new FileJobStore(storeFile).load().size();
                System.out.println("Job store: " + storeFile + " (" + stored + (stored == 1 ? " job)" : " jobs)"));
            } else {
                System.out.println("Job store: " + storeFile + " (created when the first job is added)");
            }

            CalendarConfig calendar = config.calendar();
            if (calendar.enabled()) {
                System.out.println("Calendar sync: on, via '" + calendar.command() + "' into " + calendar.defaultCalendarId());
            } else {
                System.out.println("Calendar sync: off");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
