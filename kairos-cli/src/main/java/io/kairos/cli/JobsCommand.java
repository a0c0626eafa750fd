package io.kairos.cli;

import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.scheduler.FileJobStore;
import io.kairos.core.scheduler.JobFilter;
import io.kairos.core.scheduler.JobType;
import io.kairos.core.scheduler.ScheduledJob;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "jobs", description = "List jobs from the job store")
public final class JobsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--type", description = "Only jobs of this type (post, reminder, task, heartbeat)")
    String type;

    @Option(names = "--product", description = "Only jobs for this product id")
    String productId;

    public JobsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KairosConfig config = context.configService().load(context.configPath());
            JobFilter filter = new JobFilter(type == null ? null : JobType.fromWireName(type), null, productId);
            List<ScheduledJob> jobs = new FileJobStore(ConfigPaths.resolveStoreFile(config.scheduler())).load().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparingLong(ScheduledJob::createdAt))
                .toList();
            if (jobs.isEmpty()) {
                System.out.println("No scheduled jobs");
                return 0;
            }
            for (ScheduledJob job : jobs) {
                System.out.println(format(job));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Jobs command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String format(ScheduledJob job) {
        StringBuilder line = new StringBuilder()
            .append(job.id())
            .append("  ").append(job.type().icon()).append(' ').append(job.name())
            .append("  [").append(job.oneShot() ? "at " + Instant.ofEpochMilli(job.executeAt()) : job.cronExpression()).append(']')
            .append(job.enabled() ? "" : "  (disabled)")
            .append("  runs=").append(job.runCount());
        if (job.nextRun() != null) {
            line.append("  next=").append(Instant.ofEpochMilli(job.nextRun()));
        }
        if (job.eventId() != null) {
            line.append("  event=").append(job.eventId());
        }
        return line.toString();
    }
}
