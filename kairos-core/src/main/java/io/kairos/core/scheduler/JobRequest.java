package io.kairos.core.scheduler;

public record JobRequest(
    String name,
    String description,
    String cronExpression,
    Long executeAt,
    boolean oneShot,
    Boolean deleteAfterRun,
    JobType type,
    boolean enabled,
    JobPayload payload,
    CalendarSync calendarSync,
    String timezone
) {

    public static JobRequest recurring(String name, String cronExpression, JobType type) {
        return new JobRequest(name, null, cronExpression, null, false, null, type, true, JobPayload.empty(), null, null);
    }

    public static JobRequest oneShot(String name, long executeAt, JobType type) {
        return new JobRequest(name, null, null, executeAt, true, true, type, true, JobPayload.empty(), null, null);
    }

    public static JobRequest of(String name, ScheduleSpec schedule, JobType type) {
        return schedule.oneShot()
            ? oneShot(name, schedule.executeAt(), type)
            : recurring(name, schedule.cronExpression(), type);
    }

    public JobRequest withDescription(String value) {
        return new JobRequest(name, value, cronExpression, executeAt, oneShot, deleteAfterRun, type, enabled, payload, calendarSync, timezone);
    }

    public JobRequest withEnabled(boolean value) {
        return new JobRequest(name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type, value, payload, calendarSync, timezone);
    }

    public JobRequest withPayload(JobPayload value) {
        return new JobRequest(name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type, enabled, value, calendarSync, timezone);
    }

    public JobRequest withDeleteAfterRun(Boolean value) {
        return new JobRequest(name, description, cronExpression, executeAt, oneShot, value, type, enabled, payload, calendarSync, timezone);
    }

    public JobRequest withCalendarSync(CalendarSync value) {
        return new JobRequest(name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type, enabled, payload, value, timezone);
    }

    public JobRequest withTimezone(String value) {
        return new JobRequest(name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type, enabled, payload, calendarSync, value);
    }
}
