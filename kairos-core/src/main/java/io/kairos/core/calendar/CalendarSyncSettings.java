package io.kairos.core.calendar;

public record CalendarSyncSettings(boolean enabled, String defaultCalendarId, String defaultTimezone) {
    public static final String FALLBACK_CALENDAR_ID = "primary";
    public static final String FALLBACK_TIMEZONE = "UTC";

    public static CalendarSyncSettings defaults() {
        return new CalendarSyncSettings(true, FALLBACK_CALENDAR_ID, FALLBACK_TIMEZONE);
    }

    public static CalendarSyncSettings off() {
        return new CalendarSyncSettings(false, FALLBACK_CALENDAR_ID, FALLBACK_TIMEZONE);
    }
}
