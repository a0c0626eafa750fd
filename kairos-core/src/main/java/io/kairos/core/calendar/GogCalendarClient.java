package io.kairos.core.calendar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CalendarPort} backed by the {@code gog} command-line calendar client. Arguments are passed
 * as a list, never through a shell.
 */
public final class GogCalendarClient implements CalendarPort {
    private static final Logger LOG = LoggerFactory.getLogger(GogCalendarClient.class);
    private static final int MAX_ERROR_OUTPUT = 500;

    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    public GogCalendarClient(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("calendar command is required");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    public GogCalendarClient(String executable, Duration timeout) {
        this(List.of(executable), timeout);
    }

    @Override
    public String create(CalendarEvent event) throws CalendarException {
        CommandResult result = run(List.of(
            "calendar", "create",
            "--calendar", event.calendarId(),
            "--title", event.title(),
            "--start", event.startIso(),
            "--end", event.endIso(),
            "--description", event.description() == null ? "" : event.description(),
            "--json"
        ));
        result.requireSuccess("create");

        JsonNode body = readJsonObject(result.output());
        String id = text(body, "id");
        if (id.isBlank()) {
            id = text(body, "eventId");
        }
        if (id.isBlank()) {
            throw new CalendarException("calendar create returned no event id");
        }
        return id;
    }

    @Override
    public void update(String calendarId, String eventId, CalendarEvent event) throws CalendarException {
        run(List.of(
            "calendar", "update",
            "--calendar", calendarId,
            "--event", eventId,
            "--title", event.title(),
            "--start", event.startIso(),
            "--end", event.endIso(),
            "--json"
        )).requireSuccess("update");
    }

    @Override
    public void delete(String calendarId, String eventId) throws CalendarException {
        run(List.of("calendar", "delete", "--calendar", calendarId, "--event", eventId, "--json"))
            .requireSuccess("delete");
    }

    @Override
    public boolean exists(String calendarId, String eventId) throws CalendarException {
        return run(List.of("calendar", "get", "--calendar", calendarId, "--event", eventId, "--json")).exitCode() == 0;
    }

    @Override
    public boolean isConnected() throws CalendarException {
        CommandResult result = run(List.of("calendar", "list", "--limit", "1", "--json"));
        return result.exitCode() == 0 && result.output().contains("[");
    }

    private CommandResult run(List<String> args) throws CalendarException {
        List<String> full = new ArrayList<>(command);
        full.addAll(args);
        LOG.debug("Running calendar command: {} {}", command, args.subList(0, 2));

        Process process;
        try {
            process = new ProcessBuilder(full)
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            throw new CalendarException("failed to start calendar command " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new CalendarException("calendar command timed out after " + timeout.toSeconds() + "s");
            }
            return new CommandResult(process.exitValue(), output.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            throw new CalendarException("failed to read calendar command output: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new CalendarException("calendar command output not closed after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CalendarException("calendar command interrupted", e);
        }
    }

    private static String drain(Process process) {
        try {
            return new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private JsonNode readJsonObject(String output) throws CalendarException {
        int start = output.indexOf('{');
        if (start < 0) {
            throw new CalendarException("calendar command returned no JSON object: " + truncate(output));
        }
        try {
            return mapper.readTree(output.substring(start));
        } catch (JsonProcessingException e) {
            throw new CalendarException("calendar command returned malformed JSON: " + truncate(output), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }

    private static String truncate(String value) {
        String trimmed = value == null ? "" : value.trim();
        return trimmed.length() <= MAX_ERROR_OUTPUT ? trimmed : trimmed.substring(0, MAX_ERROR_OUTPUT) + "...";
    }

    private record CommandResult(int exitCode, String output) {
        void requireSuccess(String operation) throws CalendarException {
            if (exitCode != 0) {
                throw new CalendarException("calendar " + operation + " failed (exit " + exitCode + "): " + truncate(output));
            }
        }
    }
}
