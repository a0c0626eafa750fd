package io.kairos.core.scheduler;

/**
 * The work a job triggers. Invoked once per firing with the job as it stood when it fired.
 */
@FunctionalInterface
public interface JobExecutor {
    JobExecutor NOOP = job -> {
    };

    void execute(ScheduledJob job) throws Exception;
}
