package io.kairos.core.calendar;

import io.kairos.core.scheduler.ScheduledJob;
import java.util.Map;
import java.util.Optional;

/**
 * Caller-supplied lookups that sit between a job's own overrides and the global defaults.
 */
public interface CalendarContext {

    default Optional<String> productCalendarId(String productId) {
        return Optional.empty();
    }

    default Optional<String> memberTimezone(ScheduledJob job) {
        return Optional.empty();
    }

    static CalendarContext none() {
        return new CalendarContext() {
        };
    }

    static CalendarContext ofProductCalendars(Map<String, String> calendarsByProduct) {
        Map<String, String> copy = Map.copyOf(calendarsByProduct);
        return new CalendarContext() {
            @Override
            public Optional<String> productCalendarId(String productId) {
                if (productId == null) {
                    return Optional.empty();
                }
                String calendarId = copy.get(productId);
                return calendarId == null || calendarId.isBlank() ? Optional.empty() : Optional.of(calendarId);
            }
        };
    }
}
