package io.kairos.core.calendar;

/**
 * Typed access to the external calendar backend. Every call is independent and may be retried.
 */
public interface CalendarPort {

    /**
     * Creates an event and returns the backend's id for it.
     */
    String create(CalendarEvent event) throws CalendarException;

    /**
     * Moves or renames an existing event. Only title, start and end are sent.
     */
    void update(String calendarId, String eventId, CalendarEvent event) throws CalendarException;

    void delete(String calendarId, String eventId) throws CalendarException;

    boolean exists(String calendarId, String eventId) throws CalendarException;

    boolean isConnected() throws CalendarException;
}
