package io.kairos.core.calendar;

import io.kairos.core.scheduler.JobType;
import io.kairos.core.scheduler.ScheduledJob;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one calendar event per job in line with the job's next firing. Nothing here throws:
 * failures come back as a {@link CalendarSyncResult}.
 */
public final class CalendarSyncService {
    private static final Logger LOG = LoggerFactory.getLogger(CalendarSyncService.class);
    private static final Duration EVENT_DURATION = Duration.ofMinutes(30);
    private static final int CONTENT_PREVIEW = 200;
    private static final Pattern MINUTE_STEP = Pattern.compile("^\\*/(\\d+)");

    private final CalendarPort port;
    private final CalendarContext context;
    private volatile CalendarSyncSettings settings;

    public CalendarSyncService(CalendarPort port, CalendarSyncSettings settings, CalendarContext context) {
        this.port = Objects.requireNonNull(port, "port must not be null");
        this.settings = settings == null ? CalendarSyncSettings.defaults() : settings;
        this.context = context == null ? CalendarContext.none() : context;
    }

    public CalendarSyncService(CalendarPort port, CalendarSyncSettings settings) {
        this(port, settings, CalendarContext.none());
    }

    public CalendarSyncSettings settings() {
        return settings;
    }

    public void configure(CalendarSyncSettings updated) {
        this.settings = Objects.requireNonNull(updated, "settings must not be null");
        LOG.info("Calendar sync configured: enabled={}, calendar={}, timezone={}",
            updated.enabled(), updated.defaultCalendarId(), updated.defaultTimezone());
    }

    public boolean isConnected() {
        try {
            return port.isConnected();
        } catch (CalendarException e) {
            LOG.debug("Calendar backend not reachable: {}", e.getMessage());
            return false;
        }
    }

    public String resolveCalendarId(ScheduledJob job) {
        if (job.calendarSync() != null && notBlank(job.calendarSync().calendarId())) {
            return job.calendarSync().calendarId();
        }
        String productCalendar = context.productCalendarId(job.payload().productId()).orElse(null);
        if (notBlank(productCalendar)) {
            return productCalendar;
        }
        if (notBlank(settings.defaultCalendarId())) {
            return settings.defaultCalendarId();
        }
        return CalendarSyncSettings.FALLBACK_CALENDAR_ID;
    }

    public String resolveTimezone(ScheduledJob job) {
        if (notBlank(job.timezone())) {
            return job.timezone();
        }
        String member = context.memberTimezone(job).orElse(null);
        if (notBlank(member)) {
            return member;
        }
        if (notBlank(settings.defaultTimezone())) {
            return settings.defaultTimezone();
        }
        return CalendarSyncSettings.FALLBACK_TIMEZONE;
    }

    public CalendarSyncResult createEvent(ScheduledJob job) {
        if (!settings.enabled()) {
            return CalendarSyncResult.failure("Calendar sync disabled");
        }
        if (job.calendarSyncDisabled()) {
            return CalendarSyncResult.failure("Calendar sync disabled for this job");
        }
        Long start = scheduledTime(job);
        if (start == null) {
            return CalendarSyncResult.failure("No scheduled time found");
        }

        CalendarEvent event = buildEvent(job, start);
        try {
            String eventId = port.create(event);
            LOG.info("Calendar event created for job {}: {} in {}", job.id(), eventId, event.calendarId());
            return CalendarSyncResult.created(eventId, event.calendarId());
        } catch (CalendarException e) {
            LOG.error("Failed to create calendar event for job {}: {}", job.id(), e.getMessage());
            return CalendarSyncResult.failure(e.getMessage());
        }
    }

    public CalendarSyncResult updateEvent(ScheduledJob job) {
        String eventId = job.eventId();
        if (eventId == null) {
            return createEvent(job);
        }
        Long start = scheduledTime(job);
        if (start == null) {
            return CalendarSyncResult.failure("No scheduled time found");
        }

        CalendarEvent event = buildEvent(job, start);
        try {
            port.update(event.calendarId(), eventId, event);
            LOG.info("Calendar event {} updated for job {}", eventId, job.id());
            return CalendarSyncResult.created(eventId, event.calendarId());
        } catch (CalendarException e) {
            LOG.error("Failed to update calendar event {} for job {}, creating a new one: {}",
                eventId, job.id(), e.getMessage());
            return createEvent(job);
        }
    }

    public CalendarSyncResult deleteEvent(ScheduledJob job) {
        String eventId = job.eventId();
        if (eventId == null) {
            return CalendarSyncResult.removed();
        }
        String calendarId = job.calendarSync().calendarId();
        if (!notBlank(calendarId)) {
            calendarId = notBlank(settings.defaultCalendarId())
                ? settings.defaultCalendarId()
                : CalendarSyncSettings.FALLBACK_CALENDAR_ID;
        }

        try {
            port.delete(calendarId, eventId);
            LOG.info("Calendar event {} deleted for job {}", eventId, job.id());
        } catch (CalendarException e) {
            LOG.warn("Failed to delete calendar event {} for job {} (may already be deleted): {}",
                eventId, job.id(), e.getMessage());
        }
        return CalendarSyncResult.removed();
    }

    public boolean eventExists(String eventId, String calendarId) {
        String calendar = notBlank(calendarId) ? calendarId
            : notBlank(settings.defaultCalendarId()) ? settings.defaultCalendarId()
            : CalendarSyncSettings.FALLBACK_CALENDAR_ID;
        try {
            return port.exists(calendar, eventId);
        } catch (CalendarException e) {
            LOG.debug("Calendar event {} lookup failed: {}", eventId, e.getMessage());
            return false;
        }
    }

    public CalendarSyncResult syncAfterRun(ScheduledJob job) {
        if (!job.recurring()) {
            return deleteEvent(job);
        }
        deleteEvent(job);
        return createEvent(job);
    }

    public boolean shouldSyncToCalendar(ScheduledJob job) {
        if (job.calendarSyncDisabled()) {
            return false;
        }
        if (!settings.enabled()) {
            return false;
        }
        if (job.type() == JobType.HEARTBEAT) {
            return false;
        }
        String expression = job.cronExpression();
        if (expression != null) {
            Matcher step = MINUTE_STEP.matcher(expression.trim());
            if (step.find() && isSubHourly(step.group(1))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSubHourly(String minuteStep) {
        String digits = minuteStep.replaceFirst("^0+(?=\\d)", "");
        return digits.length() <= 2 && Integer.parseInt(digits) < 60;
    }

    String buildTitle(ScheduledJob job) {
        return job.type().icon() + " " + job.name();
    }

    String buildDescription(ScheduledJob job) {
        List<String> lines = new ArrayList<>();
        lines.add("**Kairos Scheduled Job**");
        lines.add("");
        lines.add("Type: " + job.type());
        lines.add("ID: " + job.id());

        if (notBlank(job.description())) {
            lines.add("");
            lines.add(job.description());
        }
        String content = job.payload().content();
        if (notBlank(content)) {
            String preview = content.length() > CONTENT_PREVIEW ? content.substring(0, CONTENT_PREVIEW) + "..." : content;
            lines.add("");
            lines.add("Content: " + preview);
        }
        if (notBlank(job.payload().productId())) {
            lines.add("Product: " + job.payload().productId());
        }
        if (notBlank(job.cronExpression())) {
            lines.add("");
            lines.add("Schedule: " + job.cronExpression());
        }
        return String.join("\n", lines);
    }

    private CalendarEvent buildEvent(ScheduledJob job, long startMs) {
        ZoneId zone = zoneFor(job);
        ZonedDateTime start = Instant.ofEpochMilli(startMs).atZone(zone);
        return new CalendarEvent(
            resolveCalendarId(job),
            buildTitle(job),
            buildDescription(job),
            start,
            start.plus(EVENT_DURATION)
        );
    }

    private ZoneId zoneFor(ScheduledJob job) {
        String timezone = resolveTimezone(job);
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            LOG.warn("Unknown timezone {} for job {}, rendering in UTC", timezone, job.id());
            return ZoneOffset.UTC;
        }
    }

    private static Long scheduledTime(ScheduledJob job) {
        if (job.executeAt() != null) {
            return job.executeAt();
        }
        return job.nextRun();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
