package io.kairos.core.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalendarSync(
    boolean enabled,
    String eventId,
    String calendarId,
    Long lastSyncedAt,
    String syncError
) {

    public static CalendarSync enabledByDefault() {
        return new CalendarSync(true, null, null, null, null);
    }

    public static CalendarSync disabled() {
        return new CalendarSync(false, null, null, null, null);
    }

    public CalendarSync synced(String newEventId, String newCalendarId, long syncedAt) {
        return new CalendarSync(enabled, newEventId, newCalendarId, syncedAt, null);
    }

    public CalendarSync failed(String error, long syncedAt) {
        return new CalendarSync(enabled, eventId, calendarId, syncedAt, error);
    }

    public CalendarSync cleared(long syncedAt) {
        return new CalendarSync(enabled, null, calendarId, syncedAt, null);
    }
}
