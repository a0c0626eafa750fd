package io.kairos.app;

import io.kairos.cli.CliContext;
import io.kairos.cli.DaemonCommand;
import io.kairos.cli.JobsCommand;
import io.kairos.cli.KairosCliCommand;
import io.kairos.cli.OnboardCommand;
import io.kairos.cli.ParseCommand;
import io.kairos.cli.StatusCommand;
import io.kairos.core.api.JobsHttpServer;
import io.kairos.core.calendar.CalendarContext;
import io.kairos.core.calendar.CalendarSyncService;
import io.kairos.core.calendar.CalendarSyncSettings;
import io.kairos.core.calendar.GogCalendarClient;
import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.CalendarConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.config.model.SchedulerConfig;
import io.kairos.core.scheduler.FileJobStore;
import io.kairos.core.scheduler.JobEventType;
import io.kairos.core.scheduler.JobScheduler;
import io.kairos.core.scheduler.TimeParser;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KairosApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KairosApplication.class);

    private KairosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        KairosConfig config = loadConfig(configService, configPath);
        TimeParser timeParser = new TimeParser(Clock.systemDefaultZone(), resolveZone(config.scheduler().timezone()));

        CliContext context = new CliContext(
            configService,
            configPath,
            timeParser,
            (port, workspaceOverride) -> runDaemon(configService, configPath, port, workspaceOverride)
        );

        CommandLine commandLine = new CommandLine(new KairosCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("jobs", new JobsCommand(context));
        commandLine.addSubcommand("parse", new ParseCommand(context));
        commandLine.addSubcommand("daemon", new DaemonCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static KairosConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return KairosConfig.defaults();
        }
    }

    private static int runDaemon(
        ConfigService configService,
        Path configPath,
        Integer portOverride,
        Path workspaceOverride
    ) throws Exception {
        KairosConfig config = configService.load(configPath);
        SchedulerConfig schedulerConfig = config.scheduler();
        if (workspaceOverride != null) {
            schedulerConfig = schedulerConfig.withWorkspace(workspaceOverride.toAbsolutePath().normalize().toString());
        }
        ZoneId zone = resolveZone(schedulerConfig.timezone());
        Path storeFile = ConfigPaths.resolveStoreFile(schedulerConfig);
        CalendarSyncService calendar = buildCalendarSync(config.calendar());

        CountDownLatch shutdown = new CountDownLatch(1);
        try (JobScheduler scheduler = new JobScheduler(
            new FileJobStore(storeFile),
            calendar,
            new LoggingJobExecutor(),
            Clock.systemUTC(),
            zone,
            schedulerConfig.workerThreads(),
            Duration.ofSeconds(Math.max(1, schedulerConfig.storeRetrySeconds()))
        )) {
            scheduler.subscribe(event -> {
                if (event.type() == JobEventType.ERROR) {
                    LOG.warn("{} {}: {}", event.type().topic(), event.jobId(), event.error().getMessage());
                } else if (event.type() == JobEventType.CALENDAR_SYNCED && !event.calendarResult().success()) {
                    LOG.warn("{} {}: {}", event.type().topic(), event.jobId(), event.calendarResult().error());
                }
            });
            scheduler.load();

            int port = portOverride != null ? portOverride : config.api().port();
            try (JobsHttpServer server = new JobsHttpServer(
                port,
                config.api().host(),
                scheduler,
                calendar,
                new TimeParser(Clock.systemDefaultZone(), zone)
            )) {
                Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
                server.start();
                System.out.println("Kairos daemon started on http://" + config.api().host() + ":" + server.port());
                System.out.println("Job store: " + storeFile);
                System.out.println("Endpoints: GET|POST /jobs, GET|DELETE /jobs/{id}, POST /jobs/{id}/run|enable|disable, GET /healthz");
                shutdown.await();
            }
        }
        return 0;
    }

    private static CalendarSyncService buildCalendarSync(CalendarConfig calendarConfig) {
        if (!calendarConfig.enabled() || calendarConfig.command() == null || calendarConfig.command().isBlank()) {
            LOG.info("Calendar sync disabled");
            return null;
        }
        List<String> command = Arrays.asList(calendarConfig.command().trim().split("\\s+"));
        GogCalendarClient client = new GogCalendarClient(
            command,
            Duration.ofSeconds(Math.max(1, calendarConfig.commandTimeoutSeconds()))
        );
        CalendarSyncSettings settings = new CalendarSyncSettings(
            true,
            calendarConfig.defaultCalendarId(),
            calendarConfig.defaultTimezone()
        );
        return new CalendarSyncService(client, settings, CalendarContext.ofProductCalendars(calendarConfig.productCalendarIds()));
    }

    private static ZoneId resolveZone(String raw) {
        if (raw == null || raw.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            LOG.warn("Unknown scheduler timezone {}, using system default", raw);
            return ZoneId.systemDefault();
        }
    }
}
