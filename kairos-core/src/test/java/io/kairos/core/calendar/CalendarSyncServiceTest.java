package io.kairos.core.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairos.core.scheduler.CalendarSync;
import io.kairos.core.scheduler.JobPayload;
import io.kairos.core.scheduler.JobType;
import io.kairos.core.scheduler.ScheduledJob;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CalendarSyncServiceTest {

    private static final long NEXT_RUN = Instant.parse("2026-02-21T09:00:00Z").toEpochMilli();

    private final RecordingCalendarPort port = new RecordingCalendarPort();
    private final CalendarSyncService service = new CalendarSyncService(port, CalendarSyncSettings.defaults());

    @Test
    void shouldCreateHalfHourEventInResolvedTimezone() {
        ScheduledJob job = recurring("0 9 * * *", JobType.POST).withNextRun(NEXT_RUN);
        job = new ScheduledJob(job.id(), job.name(), "Launch teaser", job.cronExpression(), null, false, null, job.type(),
            true, new JobPayload("x", "Big news", "prod-1", null, null, null), null, NEXT_RUN, 0, 0L, 0L, null, "Europe/Berlin");

        CalendarSyncResult result = service.createEvent(job);

        assertThat(result.success()).isTrue();
        assertThat(result.eventId()).isEqualTo("evt-1");
        assertThat(result.calendarId()).isEqualTo("primary");
        CalendarEvent event = port.created.get(0);
        assertThat(event.title()).isEqualTo("📝 Morning post");
        assertThat(event.startIso()).isEqualTo("2026-02-21T10:00:00+01:00");
        assertThat(event.endIso()).isEqualTo("2026-02-21T10:30:00+01:00");
        assertThat(event.description())
            .startsWith("**Kairos Scheduled Job**\n\nType: post\nID: job_1_aaaaaa")
            .contains("\n\nLaunch teaser")
            .contains("\n\nContent: Big news\nProduct: prod-1")
            .endsWith("\n\nSchedule: 0 9 * * *");
    }

    @Test
    void shouldTruncateLongContentInDescription() {
        String content = "x".repeat(250);
        ScheduledJob job = recurring("0 9 * * *", JobType.TASK);
        job = new ScheduledJob(job.id(), job.name(), null, job.cronExpression(), null, false, null, job.type(),
            true, JobPayload.ofContent(content), null, NEXT_RUN, 0, 0L, 0L, null, null);

        assertThat(service.buildDescription(job)).contains("Content: " + "x".repeat(200) + "...");
    }

    @Test
    void shouldResolveCalendarFromJobThenProductThenDefault() {
        CalendarSyncService withProducts = new CalendarSyncService(
            port,
            new CalendarSyncSettings(true, "team", "UTC"),
            CalendarContext.ofProductCalendars(Map.of("prod-1", "prod-cal"))
        );
        ScheduledJob plain = recurring("0 9 * * *", JobType.TASK);
        ScheduledJob forProduct = new ScheduledJob(plain.id(), plain.name(), null, plain.cronExpression(), null, false, null,
            plain.type(), true, new JobPayload(null, null, "prod-1", null, null, null), null, null, 0, 0L, 0L, null, null);
        ScheduledJob pinned = forProduct.withCalendarSync(CalendarSync.enabledByDefault().synced("evt-9", "pinned", 1L));

        assertThat(withProducts.resolveCalendarId(plain)).isEqualTo("team");
        assertThat(withProducts.resolveCalendarId(forProduct)).isEqualTo("prod-cal");
        assertThat(withProducts.resolveCalendarId(pinned)).isEqualTo("pinned");
    }

    @Test
    void shouldResolveTimezoneFromMemberWhenJobHasNone() {
        CalendarSyncService withMember = new CalendarSyncService(port, CalendarSyncSettings.defaults(), new CalendarContext() {
            @Override
            public Optional<String> memberTimezone(ScheduledJob job) {
                return Optional.of("America/New_York");
            }
        });

        assertThat(withMember.resolveTimezone(recurring("0 9 * * *", JobType.TASK))).isEqualTo("America/New_York");
        assertThat(service.resolveTimezone(recurring("0 9 * * *", JobType.TASK))).isEqualTo("UTC");
    }

    @Test
    void shouldReportFailuresInsteadOfThrowing() {
        ScheduledJob job = recurring("0 9 * * *", JobType.TASK).withNextRun(NEXT_RUN);

        port.failCreate = true;
        assertThat(service.createEvent(job).error()).isEqualTo("create rejected");

        assertThat(service.createEvent(recurring("0 9 * * *", JobType.TASK)).error()).isEqualTo("No scheduled time found");
        assertThat(service.createEvent(job.withCalendarSync(CalendarSync.disabled())).error())
            .isEqualTo("Calendar sync disabled for this job");

        service.configure(CalendarSyncSettings.off());
        assertThat(service.createEvent(job).error()).isEqualTo("Calendar sync disabled");
    }

    @Test
    void shouldFallBackToCreateWhenUpdateFails() {
        ScheduledJob job = recurring("0 9 * * *", JobType.TASK)
            .withNextRun(NEXT_RUN)
            .withCalendarSync(CalendarSync.enabledByDefault().synced("evt-old", "primary", 1L));
        port.failUpdate = true;

        CalendarSyncResult result = service.updateEvent(job);

        assertThat(result.success()).isTrue();
        assertThat(result.eventId()).isEqualTo("evt-1");
    }

    @Test
    void shouldTreatDeleteAsSuccessfulEvenWhenBackendFails() {
        ScheduledJob job = recurring("0 9 * * *", JobType.TASK)
            .withCalendarSync(CalendarSync.enabledByDefault().synced("evt-gone", "primary", 1L));
        port.failDelete = true;

        CalendarSyncResult result = service.deleteEvent(job);

        assertThat(result.success()).isTrue();
        assertThat(result.eventId()).isNull();
        assertThat(port.deleted).containsExactly("evt-gone");
    }

    @Test
    void shouldReplaceEventAfterRecurringRun() {
        ScheduledJob job = recurring("0 9 * * *", JobType.TASK)
            .withNextRun(NEXT_RUN)
            .withCalendarSync(CalendarSync.enabledByDefault().synced("evt-old", "primary", 1L));

        CalendarSyncResult result = service.syncAfterRun(job);

        assertThat(port.deleted).containsExactly("evt-old");
        assertThat(result.eventId()).isEqualTo("evt-1");
    }

    @Test
    void shouldSkipHeartbeatsAndSubHourlySteps() {
        assertThat(service.shouldSyncToCalendar(recurring("0 9 * * *", JobType.TASK))).isTrue();
        assertThat(service.shouldSyncToCalendar(recurring("0 9 * * *", JobType.HEARTBEAT))).isFalse();
        assertThat(service.shouldSyncToCalendar(recurring("*/5 * * * *", JobType.TASK))).isFalse();
        assertThat(service.shouldSyncToCalendar(recurring("0 */2 * * *", JobType.TASK))).isTrue();
        assertThat(service.shouldSyncToCalendar(recurring("*/90 * * * *", JobType.TASK))).isTrue();
        assertThat(service.shouldSyncToCalendar(recurring("*/99999999999 * * * *", JobType.TASK))).isTrue();
        assertThat(service.shouldSyncToCalendar(recurring("0 9 * * *", JobType.TASK).withCalendarSync(CalendarSync.disabled())))
            .isFalse();
    }

    @Test
    void shouldTreatUnreachableBackendAsDisconnected() {
        CalendarSyncService broken = new CalendarSyncService(new RecordingCalendarPort() {
            @Override
            public boolean isConnected() throws CalendarException {
                throw new CalendarException("gog not installed");
            }
        }, CalendarSyncSettings.defaults());

        assertThat(broken.isConnected()).isFalse();
    }

    private static ScheduledJob recurring(String cron, JobType type) {
        String name = type == JobType.POST ? "Morning post" : "Job";
        return new ScheduledJob("job_1_aaaaaa", name, null, cron, null, false, null, type, true,
            JobPayload.empty(), null, null, 0, 0L, 0L, null, null);
    }
}
