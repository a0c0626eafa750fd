package io.kairos.core.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum JobType {
    POST("post", "📝"),
    REMINDER("reminder", "🔔"),
    TASK("task", "🤖"),
    HEARTBEAT("heartbeat", "⚙️");

    private final String wireName;
    private final String icon;

    JobType(String wireName, String icon) {
        this.wireName = wireName;
        this.icon = icon;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String icon() {
        return icon;
    }

    @JsonCreator
    public static JobType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return TASK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown job type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
