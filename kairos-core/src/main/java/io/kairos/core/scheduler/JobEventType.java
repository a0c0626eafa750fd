package io.kairos.core.scheduler;

public enum JobEventType {
    EXECUTE("job:execute"),
    ERROR("job:error"),
    CALENDAR_SYNCED("job:calendar-synced");

    private final String topic;

    JobEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
