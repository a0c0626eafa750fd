package io.kairos.core.scheduler;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TimeParser {
    private static final Map<String, String> FIXED_CRON = Map.of(
        "every minute", "* * * * *",
        "every hour", "0 * * * *",
        "every day", "0 9 * * *",
        "daily", "0 9 * * *",
        "every week", "0 9 * * 1",
        "weekly", "0 9 * * 1",
        "every month", "0 9 1 * *",
        "monthly", "0 9 1 * *"
    );
    private static final Pattern EVERY_MINUTES = Pattern.compile("every (\\d+) minutes?");
    private static final Pattern EVERY_HOURS = Pattern.compile("every (\\d+) hours?");
    private static final Pattern AT_WEEKDAYS = Pattern.compile("at (\\d{1,2}):(\\d{2}) on weekdays");
    private static final Pattern AT_CLOCK = Pattern.compile("at (\\d{1,2}):(\\d{2})");

    private static final Pattern IN_PATTERN = Pattern.compile("^in\\s+(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days)$");
    private static final Pattern TOMORROW_PATTERN = Pattern.compile("^tomorrow(?:\\s+at\\s+(.+))?$");
    private static final Pattern TONIGHT_PATTERN = Pattern.compile("^tonight\\s+at\\s+(.+)$");
    private static final Pattern AT_PATTERN = Pattern.compile("^at\\s+(.+)$");
    private static final Pattern MERIDIEM_TIME = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(am|pm)$");
    private static final Pattern CLOCK_TIME = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");
    private static final Pattern ISO_DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME = Pattern.compile(
        "^\\d{4}-\\d{2}-\\d{2}[t ]\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d{1,9})?)?(z|[+-]\\d{2}:\\d{2})?$"
    );
    private static final Pattern RECURRING_HINT = Pattern.compile("\\b(every|daily|weekly|monthly|weekdays)\\b");
    private static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);
    private static final int MAX_AMOUNT_DIGITS = 18;

    private final Clock clock;
    private final ZoneId zone;

    public TimeParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public static TimeParser systemDefault() {
        return new TimeParser(Clock.systemUTC(), ZoneId.systemDefault());
    }

    public Optional<String> parseToCron(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String lower = input.trim().toLowerCase(Locale.ROOT);

        String fixed = FIXED_CRON.get(lower);
        if (fixed != null) {
            return Optional.of(fixed);
        }

        Matcher minutes = EVERY_MINUTES.matcher(lower);
        if (minutes.find()) {
            return valid("*/" + minutes.group(1) + " * * * *");
        }

        Matcher hours = EVERY_HOURS.matcher(lower);
        if (hours.find()) {
            return valid("0 */" + hours.group(1) + " * * *");
        }

        Matcher weekdays = AT_WEEKDAYS.matcher(lower);
        if (weekdays.find()) {
            return valid(weekdays.group(2) + " " + weekdays.group(1) + " * * 1-5");
        }

        Matcher clockTime = AT_CLOCK.matcher(lower);
        if (clockTime.find()) {
            return valid(clockTime.group(2) + " " + clockTime.group(1) + " * * *");
        }

        return valid(input.trim());
    }

    private static OptionalLong relativeTo(Instant now, String amount, String unit) {
        if (amount.length() > MAX_AMOUNT_DIGITS) {
            return OptionalLong.empty();
        }
        long value = Long.parseLong(amount);
        long multiplier = switch (unit) {
            case "s", "sec", "secs", "second", "seconds" -> 1;
            case "m", "min", "mins", "minute", "minutes" -> 60;
            case "h", "hr", "hrs", "hour", "hours" -> 3600;
            default -> 86400;
        };
        try {
            return OptionalLong.of(now.plusSeconds(Math.multiplyExact(value, multiplier)).toEpochMilli());
        } catch (ArithmeticException | DateTimeException e) {
            return OptionalLong.empty();
        }
    }

    public OptionalLong parseToTimestamp(String input) {
        if (input == null || input.isBlank()) {
            return OptionalLong.empty();
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        Matcher inMatcher = IN_PATTERN.matcher(normalized);
        if (inMatcher.matches()) {
            return relativeTo(now, inMatcher.group(1), inMatcher.group(2));
        }

        LocalDate today = LocalDateTime.ofInstant(now, zone).toLocalDate();

        Matcher tomorrow = TOMORROW_PATTERN.matcher(normalized);
        if (tomorrow.matches()) {
            Optional<LocalTime> time = tomorrow.group(1) == null ? Optional.of(DEFAULT_TIME) : parseTime(tomorrow.group(1), false);
            return time
                .map(t -> OptionalLong.of(toEpochMs(today.plusDays(1), t)))
                .orElse(OptionalLong.empty());
        }

        Matcher tonight = TONIGHT_PATTERN.matcher(normalized);
        if (tonight.matches()) {
            return parseTime(tonight.group(1), true)
                .map(t -> OptionalLong.of(rollForward(today, t, now)))
                .orElse(OptionalLong.empty());
        }

        Matcher at = AT_PATTERN.matcher(normalized);
        if (at.matches()) {
            return parseTime(at.group(1), false)
                .map(t -> OptionalLong.of(rollForward(today, t, now)))
                .orElse(OptionalLong.empty());
        }

        return parseIso(normalized);
    }

    public boolean isOneShot(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        String lower = input.trim().toLowerCase(Locale.ROOT);
        if (RECURRING_HINT.matcher(lower).find()) {
            return false;
        }
        return lower.startsWith("in ")
            || lower.startsWith("at ")
            || lower.startsWith("tomorrow")
            || lower.startsWith("tonight")
            || ISO_DATE_PREFIX.matcher(lower).matches();
    }

    public Optional<ScheduleSpec> resolve(String input) {
        if (isOneShot(input)) {
            OptionalLong executeAt = parseToTimestamp(input);
            return executeAt.isPresent() ? Optional.of(ScheduleSpec.at(executeAt.getAsLong())) : Optional.empty();
        }
        return parseToCron(input).map(ScheduleSpec::cron);
    }

    private Optional<String> valid(String expression) {
        return CronSchedule.isValid(expression) ? Optional.of(expression) : Optional.empty();
    }

    private long rollForward(LocalDate date, LocalTime time, Instant now) {
        ZonedDateTime candidate = LocalDateTime.of(date, time).atZone(zone);
        if (!candidate.toInstant().isAfter(now)) {
            candidate = LocalDateTime.of(date.plusDays(1), time).atZone(zone);
        }
        return candidate.toInstant().toEpochMilli();
    }

    private long toEpochMs(LocalDate date, LocalTime time) {
        return LocalDateTime.of(date, time).atZone(zone).toInstant().toEpochMilli();
    }

    private OptionalLong parseIso(String normalized) {
        try {
            if (ISO_DATE_ONLY.matcher(normalized).matches()) {
                return OptionalLong.of(toEpochMs(LocalDate.parse(normalized), DEFAULT_TIME));
            }
            Matcher matcher = ISO_DATE_TIME.matcher(normalized);
            if (!matcher.matches()) {
                return OptionalLong.empty();
            }
            String text = normalized.replace(' ', 'T').toUpperCase(Locale.ROOT);
            if (matcher.group(1) != null) {
                return OptionalLong.of(OffsetDateTime.parse(text).toInstant().toEpochMilli());
            }
            return OptionalLong.of(LocalDateTime.parse(text).atZone(zone).toInstant().toEpochMilli());
        } catch (DateTimeParseException e) {
            return OptionalLong.empty();
        }
    }

    private Optional<LocalTime> parseTime(String token, boolean evening) {
        String value = token.trim().toLowerCase(Locale.ROOT).replace(" ", "");

        Matcher meridiem = MERIDIEM_TIME.matcher(value);
        if (meridiem.matches()) {
            int hour = Integer.parseInt(meridiem.group(1));
            int minute = meridiem.group(2) == null ? 0 : Integer.parseInt(meridiem.group(2));
            if (hour < 1 || hour > 12 || minute > 59) {
                return Optional.empty();
            }
            hour = hour % 12;
            if ("pm".equals(meridiem.group(3))) {
                hour += 12;
            }
            return Optional.of(LocalTime.of(hour, minute));
        }

        Matcher twentyFour = CLOCK_TIME.matcher(value);
        if (twentyFour.matches()) {
            int hour = Integer.parseInt(twentyFour.group(1));
            int minute = twentyFour.group(2) == null ? 0 : Integer.parseInt(twentyFour.group(2));
            if (hour > 23 || minute > 59) {
                return Optional.empty();
            }
            if (evening && hour >= 1 && hour <= 11) {
                hour += 12;
            }
            return Optional.of(LocalTime.of(hour, minute));
        }

        return Optional.empty();
    }
}
