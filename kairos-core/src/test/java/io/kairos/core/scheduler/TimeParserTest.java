package io.kairos.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class TimeParserTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    private final TimeParser parser = new TimeParser(Clock.fixed(Instant.parse("2026-02-20T10:00:00Z"), UTC), UTC);

    @Test
    void shouldTranslateFixedPhrasesToCron() {
        assertThat(parser.parseToCron("every minute")).contains("* * * * *");
        assertThat(parser.parseToCron("Every Hour")).contains("0 * * * *");
        assertThat(parser.parseToCron("daily")).contains("0 9 * * *");
        assertThat(parser.parseToCron("weekly")).contains("0 9 * * 1");
        assertThat(parser.parseToCron("every month")).contains("0 9 1 * *");
    }

    @Test
    void shouldTranslateIntervalsAndClockTimes() {
        assertThat(parser.parseToCron("every 5 minutes")).contains("*/5 * * * *");
        assertThat(parser.parseToCron("every 2 hours")).contains("0 */2 * * *");
        assertThat(parser.parseToCron("at 9:00")).contains("00 9 * * *");
        assertThat(parser.parseToCron("at 9:30 on weekdays")).contains("30 9 * * 1-5");
    }

    @Test
    void shouldPassThroughValidCronAndRejectGibberish() {
        assertThat(parser.parseToCron("15 8 * * 1")).contains("15 8 * * 1");
        assertThat(parser.parseToCron("gibberish")).isEmpty();
        assertThat(parser.parseToCron("")).isEmpty();
    }

    @Test
    void shouldParseRelativeOffsets() {
        assertThat(parser.parseToTimestamp("in 15m")).hasValue(Instant.parse("2026-02-20T10:15:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("in 2 hours")).hasValue(Instant.parse("2026-02-20T12:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("in 30 sec")).hasValue(Instant.parse("2026-02-20T10:00:30Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("in 1 day")).hasValue(Instant.parse("2026-02-21T10:00:00Z").toEpochMilli());
    }

    @Test
    void shouldRollClockTimesForwardWhenAlreadyPassed() {
        assertThat(parser.parseToTimestamp("at 11:00")).hasValue(Instant.parse("2026-02-20T11:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("at 9:00")).hasValue(Instant.parse("2026-02-21T09:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("at 10:00")).hasValue(Instant.parse("2026-02-21T10:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("at 3pm")).hasValue(Instant.parse("2026-02-20T15:00:00Z").toEpochMilli());
    }

    @Test
    void shouldParseTomorrowAndTonight() {
        assertThat(parser.parseToTimestamp("tomorrow")).hasValue(Instant.parse("2026-02-21T09:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("tomorrow at 9am")).hasValue(Instant.parse("2026-02-21T09:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("tonight at 8")).hasValue(Instant.parse("2026-02-20T20:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("tonight at 8pm")).hasValue(Instant.parse("2026-02-20T20:00:00Z").toEpochMilli());
    }

    @Test
    void shouldParseIsoInputsWithoutRollingForward() {
        assertThat(parser.parseToTimestamp("2026-03-01")).hasValue(Instant.parse("2026-03-01T09:00:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("2026-03-01T14:30")).hasValue(Instant.parse("2026-03-01T14:30:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("2026-03-01T14:30:00+02:00")).hasValue(Instant.parse("2026-03-01T12:30:00Z").toEpochMilli());
        assertThat(parser.parseToTimestamp("2026-01-01T08:00:00Z")).hasValue(Instant.parse("2026-01-01T08:00:00Z").toEpochMilli());
    }

    @Test
    void shouldRejectUnparseableTimestamps() {
        assertThat(parser.parseToTimestamp("at 25:00")).isEmpty();
        assertThat(parser.parseToTimestamp("next tuesday")).isEmpty();
        assertThat(parser.parseToTimestamp("2026-13-45")).isEmpty();
        assertThat(parser.parseToTimestamp(null)).isEmpty();
        assertThat(parser.parseToTimestamp("in 99999999999999999999 seconds")).isEmpty();
        assertThat(parser.parseToTimestamp("in 999999999999999 hours")).isEmpty();
        assertThat(parser.parseToTimestamp("in 9999999999999999 days")).isEmpty();
    }

    @Test
    void shouldClassifyOneShotPhrases() {
        assertThat(parser.isOneShot("in 10 minutes")).isTrue();
        assertThat(parser.isOneShot("tomorrow at 3pm")).isTrue();
        assertThat(parser.isOneShot("2026-03-01")).isTrue();
        assertThat(parser.isOneShot("at 9:00")).isTrue();
        assertThat(parser.isOneShot("at 9:00 on weekdays")).isFalse();
        assertThat(parser.isOneShot("every 5 minutes")).isFalse();
        assertThat(parser.isOneShot("0 9 * * *")).isFalse();
    }

    @Test
    void shouldResolveToMatchingScheduleKind() {
        assertThat(parser.resolve("in 15m")).contains(ScheduleSpec.at(Instant.parse("2026-02-20T10:15:00Z").toEpochMilli()));
        assertThat(parser.resolve("at 9:30 on weekdays")).contains(ScheduleSpec.cron("30 9 * * 1-5"));
        assertThat(parser.resolve("whenever")).isEmpty();
    }
}
