package io.kairos.core.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class GogCalendarClientTest {

    @TempDir
    Path tempDir;

    private Path argsLog;
    private GogCalendarClient client;

    @BeforeEach
    void setUp() throws Exception {
        argsLog = tempDir.resolve("args.log");
        Path script = tempDir.resolve("fake-gog.sh");
        Files.writeString(script, """
            #!/bin/sh
            echo "$@" >> "%s"
            case "$2" in
              create) echo "Created event"; echo '{"id":"evt-123","status":"confirmed"}' ;;
              update) head -c 262144 /dev/zero | tr '\\000' 'x'; echo; echo '{"id":"evt-123"}' ;;
              delete) echo "event not found"; exit 3 ;;
              get) exit 1 ;;
              list) echo '[{"id":"evt-123"}]' ;;
            esac
            """.formatted(argsLog));
        client = new GogCalendarClient(List.of("sh", script.toString()), Duration.ofSeconds(10));
    }

    @Test
    void shouldCreateEventAndParseIdFromJsonOutput() throws Exception {
        ZonedDateTime start = ZonedDateTime.of(2026, 2, 21, 9, 0, 0, 0, ZoneOffset.UTC);
        CalendarEvent event = new CalendarEvent("primary", "Standup", "Daily", start, start.plusMinutes(30));

        String eventId = client.create(event);

        assertThat(eventId).isEqualTo("evt-123");
        assertThat(Files.readString(argsLog))
            .contains("calendar create --calendar primary --title Standup")
            .contains("--start 2026-02-21T09:00:00Z --end 2026-02-21T09:30:00Z")
            .contains("--json");
    }

    @Test
    void shouldReadOutputLargerThanThePipeBuffer() throws Exception {
        GogCalendarClient quick = new GogCalendarClient(List.of("sh", tempDir.resolve("fake-gog.sh").toString()), Duration.ofSeconds(3));
        ZonedDateTime start = ZonedDateTime.of(2026, 2, 21, 9, 0, 0, 0, ZoneOffset.UTC);

        quick.update("primary", "evt-123", new CalendarEvent("primary", "Standup", "Daily", start, start.plusMinutes(30)));

        assertThat(Files.readString(argsLog)).contains("calendar update --calendar primary --event evt-123");
    }

    @Test
    void shouldSurfaceNonZeroExitAsCalendarException() {
        assertThatThrownBy(() -> client.delete("primary", "evt-missing"))
            .isInstanceOf(CalendarException.class)
            .hasMessageContaining("exit 3")
            .hasMessageContaining("event not found");
    }

    @Test
    void shouldProbeExistenceAndConnectivityByExitCode() throws Exception {
        assertThat(client.exists("primary", "evt-123")).isFalse();
        assertThat(client.isConnected()).isTrue();
    }

    @Test
    void shouldFailWhenExecutableIsMissing() {
        GogCalendarClient missing = new GogCalendarClient(tempDir.resolve("no-such-gog").toString(), Duration.ofSeconds(5));

        assertThatThrownBy(missing::isConnected)
            .isInstanceOf(CalendarException.class)
            .hasMessageContaining("failed to start calendar command");
    }
}
