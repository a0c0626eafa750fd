package io.kairos.core.scheduler;

public record JobPatch(
    String name,
    String description,
    String cronExpression,
    Long executeAt,
    Boolean deleteAfterRun,
    JobType type,
    Boolean enabled,
    JobPayload payload,
    CalendarSync calendarSync,
    String timezone
) {

    public static JobPatch none() {
        return new JobPatch(null, null, null, null, null, null, null, null, null, null);
    }

    public static JobPatch toggle(boolean value) {
        return none().withEnabled(value);
    }

    public boolean touchesSchedule() {
        return cronExpression != null || executeAt != null || enabled != null;
    }

    public JobPatch withName(String value) {
        return new JobPatch(value, description, cronExpression, executeAt, deleteAfterRun, type, enabled, payload, calendarSync, timezone);
    }

    public JobPatch withDescription(String value) {
        return new JobPatch(name, value, cronExpression, executeAt, deleteAfterRun, type, enabled, payload, calendarSync, timezone);
    }

    public JobPatch withCronExpression(String value) {
        return new JobPatch(name, description, value, executeAt, deleteAfterRun, type, enabled, payload, calendarSync, timezone);
    }

    public JobPatch withExecuteAt(Long value) {
        return new JobPatch(name, description, cronExpression, value, deleteAfterRun, type, enabled, payload, calendarSync, timezone);
    }

    public JobPatch withEnabled(Boolean value) {
        return new JobPatch(name, description, cronExpression, executeAt, deleteAfterRun, type, value, payload, calendarSync, timezone);
    }

    public JobPatch withPayload(JobPayload value) {
        return new JobPatch(name, description, cronExpression, executeAt, deleteAfterRun, type, enabled, value, calendarSync, timezone);
    }

    public JobPatch withTimezone(String value) {
        return new JobPatch(name, description, cronExpression, executeAt, deleteAfterRun, type, enabled, payload, calendarSync, value);
    }
}
