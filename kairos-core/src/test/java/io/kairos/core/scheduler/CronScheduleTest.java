package io.kairos.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class CronScheduleTest {

    @Test
    void shouldComputeNextExecutionInZone() {
        CronSchedule schedule = CronSchedule.parse("0 9 * * *");

        Instant next = schedule.nextAfter(Instant.parse("2026-02-20T10:00:00Z"), ZoneId.of("Europe/Berlin")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-02-21T08:00:00Z"));
    }

    @Test
    void shouldRejectExpressionsWithoutFiveFields() {
        assertThatThrownBy(() -> CronSchedule.parse("0 0 9 * * *")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronSchedule.parse("gibberish")).isInstanceOf(IllegalArgumentException.class);
        assertThat(CronSchedule.isValid(null)).isFalse();
        assertThat(CronSchedule.isValid("*/5 * * * *")).isTrue();
    }
}
