package io.kairos.core.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduledJob(
    String id,
    String name,
    String description,
    String cronExpression,
    Long executeAt,
    boolean oneShot,
    Boolean deleteAfterRun,
    JobType type,
    boolean enabled,
    JobPayload payload,
    Long lastRun,
    Long nextRun,
    int runCount,
    long createdAt,
    long updatedAt,
    CalendarSync calendarSync,
    String timezone
) {
    public ScheduledJob {
        type = type == null ? JobType.TASK : type;
        payload = payload == null ? JobPayload.empty() : payload;
    }

    public boolean recurring() {
        return !oneShot && cronExpression != null && !cronExpression.isBlank();
    }

    public boolean purgesAfterRun() {
        return oneShot && !Boolean.FALSE.equals(deleteAfterRun);
    }

    public boolean calendarSyncDisabled() {
        return calendarSync != null && !calendarSync.enabled();
    }

    public String eventId() {
        return calendarSync == null ? null : calendarSync.eventId();
    }

    public ScheduledJob withEnabled(boolean value, long now) {
        return new ScheduledJob(id, name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type,
            value, payload, lastRun, nextRun, runCount, createdAt, now, calendarSync, timezone);
    }

    public ScheduledJob withNextRun(Long value) {
        return new ScheduledJob(id, name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type,
            enabled, payload, lastRun, value, runCount, createdAt, updatedAt, calendarSync, timezone);
    }

    public ScheduledJob withCalendarSync(CalendarSync value) {
        return new ScheduledJob(id, name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type,
            enabled, payload, lastRun, nextRun, runCount, createdAt, updatedAt, value, timezone);
    }

    public ScheduledJob fired(long now) {
        return new ScheduledJob(id, name, description, cronExpression, executeAt, oneShot, deleteAfterRun, type,
            enabled, payload, now, nextRun, runCount + 1, createdAt, now, calendarSync, timezone);
    }

    public ScheduledJob apply(JobPatch patch, long now) {
        String cron = cronExpression;
        Long at = executeAt;
        boolean once = oneShot;
        if (patch.cronExpression() != null) {
            cron = patch.cronExpression();
            at = null;
            once = false;
        } else if (patch.executeAt() != null) {
            at = patch.executeAt();
            cron = null;
            once = true;
        }
        return new ScheduledJob(
            id,
            patch.name() != null ? patch.name() : name,
            patch.description() != null ? patch.description() : description,
            cron,
            at,
            once,
            patch.deleteAfterRun() != null ? patch.deleteAfterRun() : deleteAfterRun,
            patch.type() != null ? patch.type() : type,
            patch.enabled() != null ? patch.enabled() : enabled,
            patch.payload() != null ? patch.payload() : payload,
            lastRun,
            nextRun,
            runCount,
            createdAt,
            now,
            patch.calendarSync() != null ? patch.calendarSync() : calendarSync,
            patch.timezone() != null ? patch.timezone() : timezone
        );
    }
}
