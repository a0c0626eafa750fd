package io.kairos.core.calendar;

public record CalendarSyncResult(boolean success, String eventId, String calendarId, String error) {

    public static CalendarSyncResult created(String eventId, String calendarId) {
        return new CalendarSyncResult(true, eventId, calendarId, null);
    }

    public static CalendarSyncResult removed() {
        return new CalendarSyncResult(true, null, null, null);
    }

    public static CalendarSyncResult failure(String error) {
        return new CalendarSyncResult(false, null, null, error);
    }
}
