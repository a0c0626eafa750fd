package io.kairos.core.scheduler;

public record ScheduleSpec(String cronExpression, Long executeAt) {

    public static ScheduleSpec cron(String cronExpression) {
        return new ScheduleSpec(cronExpression, null);
    }

    public static ScheduleSpec at(long executeAt) {
        return new ScheduleSpec(null, executeAt);
    }

    public boolean oneShot() {
        return executeAt != null;
    }
}
