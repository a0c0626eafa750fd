package io.kairos.core.scheduler;

import io.kairos.core.calendar.CalendarSyncResult;

public record JobEvent(
    JobEventType type,
    ScheduledJob job,
    Throwable error,
    CalendarSyncResult calendarResult,
    long at
) {

    static JobEvent execute(ScheduledJob job, long at) {
        return new JobEvent(JobEventType.EXECUTE, job, null, null, at);
    }

    static JobEvent error(ScheduledJob job, Throwable error, long at) {
        return new JobEvent(JobEventType.ERROR, job, error, null, at);
    }

    static JobEvent calendarSynced(ScheduledJob job, CalendarSyncResult result, long at) {
        return new JobEvent(JobEventType.CALENDAR_SYNCED, job, null, result, at);
    }

    public String jobId() {
        return job.id();
    }
}
