package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KairosConfig(
    SchedulerConfig scheduler,
    CalendarConfig calendar,
    ApiConfig api
) {

    public static KairosConfig defaults() {
        return new KairosConfig(
            SchedulerConfig.defaults(),
            CalendarConfig.defaults(),
            ApiConfig.defaults()
        );
    }

    public KairosConfig withScheduler(SchedulerConfig value) {
        return new KairosConfig(value, calendar, api);
    }

    public KairosConfig withCalendar(CalendarConfig value) {
        return new KairosConfig(scheduler, value, api);
    }
}
