package io.kairos.core.calendar;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public record CalendarEvent(
    String calendarId,
    String title,
    String description,
    ZonedDateTime start,
    ZonedDateTime end
) {

    public String startIso() {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(start);
    }

    public String endIso() {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(end);
    }
}
