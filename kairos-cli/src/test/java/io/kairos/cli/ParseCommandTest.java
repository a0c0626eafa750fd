package io.kairos.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairos.core.config.ConfigService;
import io.kairos.core.scheduler.TimeParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ParseCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPrintCronForRecurringPhrase() {
        String out = run(0, "every", "5", "minutes");

        assertThat(out).contains("Recurring cron */5 * * * *");
    }

    @Test
    void shouldPrintInstantForOneShotPhrase() {
        String out = run(0, "tomorrow at 3pm");

        assertThat(out).contains("One-shot at 2026-02-21T15:00:00Z");
    }

    @Test
    void shouldFailOnUnknownPhrase() {
        run(1, "whenever", "you", "like");
    }

    private String run(int expectedCode, String... args) {
        TimeParser parser = new TimeParser(Clock.fixed(Instant.parse("2026-02-20T10:00:00Z"), ZoneId.of("UTC")), ZoneId.of("UTC"));
        CliContext context = new CliContext(new ConfigService(Map.of()), tempDir.resolve("config.json"), parser);

        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new ParseCommand(context)).execute(args);
            assertThat(code).isEqualTo(expectedCode);
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
