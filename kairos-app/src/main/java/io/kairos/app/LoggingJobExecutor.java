package io.kairos.app;

import io.kairos.core.scheduler.JobExecutor;
import io.kairos.core.scheduler.JobPayload;
import io.kairos.core.scheduler.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingJobExecutor implements JobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingJobExecutor.class);

    @Override
    public void execute(ScheduledJob job) {
        JobPayload payload = job.payload();
        LOG.info("{} {} [{}] fired (run {}): channel={} product={} action={} content={}",
            job.type().icon(),
            job.name(),
            job.id(),
            job.runCount(),
            payload.channel(),
            payload.productId(),
            payload.action(),
            payload.content());
    }
}
