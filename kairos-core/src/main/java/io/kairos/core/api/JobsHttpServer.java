package io.kairos.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.calendar.CalendarSyncService;
import io.kairos.core.scheduler.CalendarSync;
import io.kairos.core.scheduler.JobExecutionException;
import io.kairos.core.scheduler.JobFilter;
import io.kairos.core.scheduler.JobPayload;
import io.kairos.core.scheduler.JobRequest;
import io.kairos.core.scheduler.JobScheduler;
import io.kairos.core.scheduler.JobType;
import io.kairos.core.scheduler.ScheduleSpec;
import io.kairos.core.scheduler.ScheduledJob;
import io.kairos.core.scheduler.TimeParser;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JobsHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobsHttpServer.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JobScheduler scheduler;
    private final CalendarSyncService calendar;
    private final TimeParser timeParser;
    private final String host;
    private final int requestedPort;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public JobsHttpServer(int port, JobScheduler scheduler, TimeParser timeParser) {
        this(port, "127.0.0.1", scheduler, null, timeParser);
    }

    public JobsHttpServer(
        int port,
        String host,
        JobScheduler scheduler,
        CalendarSyncService calendar,
        TimeParser timeParser
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.calendar = calendar;
        this.timeParser = timeParser == null ? TimeParser.systemDefault() : timeParser;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/jobs", exchange -> dispatch(exchange, this::handleJobs))
            .addPrefixPath("/jobs", exchange -> dispatch(exchange, this::handleJob))
            .addPrefixPath("/calendar/events", exchange -> dispatch(exchange, this::handleCalendarEvent));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Jobs API listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "jobs", scheduler.listJobs(JobFilter.all()).size()));
    }

    private void handleJobs(HttpServerExchange exchange) throws Exception {
        String method = exchange.getRequestMethod().toString();
        if ("GET".equalsIgnoreCase(method)) {
            JobFilter filter;
            try {
                filter = new JobFilter(
                    queryParam(exchange, "type").map(JobType::fromWireName).orElse(null),
                    queryParam(exchange, "enabled").map(Boolean::parseBoolean).orElse(null),
                    queryParam(exchange, "productId").orElse(null)
                );
            } catch (IllegalArgumentException e) {
                sendJson(exchange, 400, Map.of("error", e.getMessage()));
                return;
            }
            sendJson(exchange, 200, Map.of("jobs", scheduler.listJobs(filter)));
            return;
        }
        if ("POST".equalsIgnoreCase(method)) {
            JobRequest request;
            try {
                request = toJobRequest(readJsonBody(exchange));
            } catch (JsonProcessingException e) {
                sendJson(exchange, 400, Map.of("error", "invalid_json"));
                return;
            } catch (IllegalArgumentException e) {
                sendJson(exchange, 400, Map.of("error", e.getMessage()));
                return;
            }
            ScheduledJob created;
            try {
                created = scheduler.addJob(request);
            } catch (IllegalArgumentException e) {
                sendJson(exchange, 400, Map.of("error", e.getMessage()));
                return;
            }
            sendJson(exchange, 201, created);
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleJob(HttpServerExchange exchange) throws Exception {
        String[] segments = exchange.getRelativePath().replaceAll("^/+", "").split("/");
        String id = segments[0];
        if (id.isBlank() || segments.length > 2) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        String method = exchange.getRequestMethod().toString();

        if (segments.length == 1) {
            if ("GET".equalsIgnoreCase(method)) {
                Optional<ScheduledJob> job = scheduler.getJob(id);
                if (job.isEmpty()) {
                    sendJson(exchange, 404, Map.of("error", "job_not_found"));
                    return;
                }
                sendJson(exchange, 200, job.get());
                return;
            }
            if ("DELETE".equalsIgnoreCase(method)) {
                if (!scheduler.removeJob(id)) {
                    sendJson(exchange, 404, Map.of("error", "job_not_found"));
                    return;
                }
                sendJson(exchange, 200, Map.of("removed", id));
                return;
            }
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        if (!"POST".equalsIgnoreCase(method)) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        boolean found;
        switch (segments[1]) {
            case "run" -> {
                try {
                    found = scheduler.runNow(id);
                } catch (JobExecutionException e) {
                    sendJson(exchange, 500, Map.of("error", e.getMessage(), "jobId", e.jobId()));
                    return;
                }
            }
            case "enable" -> found = scheduler.enableJob(id);
            case "disable" -> found = scheduler.disableJob(id);
            default -> {
                sendJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
        }
        if (!found) {
            sendJson(exchange, 404, Map.of("error", "job_not_found"));
            return;
        }
        sendJson(exchange, 200, scheduler.getJob(id).map(Object.class::cast).orElse(Map.of("id", id)));
    }

    private void handleCalendarEvent(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        if (calendar == null) {
            sendJson(exchange, 503, Map.of("error", "calendar_not_configured"));
            return;
        }
        String eventId = exchange.getRelativePath().replaceAll("^/+", "");
        if (eventId.isBlank() || eventId.contains("/")) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        String calendarId = queryParam(exchange, "calendarId").orElse(calendar.settings().defaultCalendarId());
        sendJson(exchange, 200, Map.of("eventId", eventId, "exists", calendar.eventExists(eventId, calendarId)));
    }

    private JobRequest toJobRequest(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        String name = readString(body, "name", null);
        if (name == null) {
            throw new IllegalArgumentException("name is required");
        }

        ScheduleSpec schedule;
        String when = readString(body, "when", null);
        String cron = readString(body, "cronExpression", null);
        if (when != null) {
            schedule = timeParser.resolve(when)
                .orElseThrow(() -> new IllegalArgumentException("Could not parse schedule: " + when));
        } else if (cron != null) {
            schedule = ScheduleSpec.cron(cron);
        } else if (body.hasNonNull("executeAt")) {
            schedule = ScheduleSpec.at(readExecuteAt(body.get("executeAt")));
        } else {
            throw new IllegalArgumentException("one of when, cronExpression or executeAt is required");
        }

        Map<String, Object> metadata = body.hasNonNull("metadata")
            ? mapper.convertValue(body.get("metadata"), METADATA_TYPE)
            : null;
        JobPayload payload = new JobPayload(
            readString(body, "channel", null),
            readString(body, "content", null),
            readString(body, "productId", null),
            readString(body, "campaignId", null),
            readString(body, "action", null),
            metadata
        );

        JobRequest request = JobRequest.of(name, schedule, JobType.fromWireName(readString(body, "type", null)))
            .withDescription(readString(body, "description", null))
            .withPayload(payload)
            .withTimezone(readString(body, "timezone", null));
        if (body.has("syncToCalendar") && !body.get("syncToCalendar").asBoolean(true)) {
            request = request.withCalendarSync(CalendarSync.disabled());
        }
        if (body.hasNonNull("deleteAfterRun") && schedule.oneShot()) {
            request = request.withDeleteAfterRun(body.get("deleteAfterRun").asBoolean());
        }
        if (body.hasNonNull("enabled")) {
            request = request.withEnabled(body.get("enabled").asBoolean());
        }
        return request;
    }

    private long readExecuteAt(JsonNode node) {
        if (node.isNumber()) {
            return node.asLong();
        }
        OptionalLong parsed = timeParser.parseToTimestamp(node.asText());
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("Could not parse executeAt: " + node.asText());
        }
        return parsed.getAsLong();
    }

    private void dispatch(HttpServerExchange exchange, ExchangeHandler handler) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> runHandler(exchange, handler));
            return;
        }
        runHandler(exchange, handler);
    }

    private void runHandler(HttpServerExchange exchange, ExchangeHandler handler) {
        try {
            handler.handle(exchange);
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange, e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private Optional<String> queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        String value = values == null || values.isEmpty() ? null : values.peekFirst();
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private String readString(JsonNode body, String field, String fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        String value = node.asText();
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        if (exchange.isResponseStarted()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error.getMessage() == null ? "internal_error" : error.getMessage());
        try {
            sendJson(exchange, 500, payload);
        } catch (IOException e) {
            LOG.warn("Failed to send error response: {}", e.getMessage());
            exchange.endExchange();
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
