package io.pgvault.core.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pgvault.core.schedule.JobSnapshot;
import io.pgvault.core.scheduler.NotInitializedException;
import io.pgvault.core.scheduler.SchedulerService;
import io.pgvault.core.submission.ScheduleRequest;
import io.pgvault.core.submission.ScheduleRequestParser;
import io.pgvault.core.submission.ValidationException;
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
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SchedulerGateway implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerGateway.class);
    private static final String JOB_PREFIX = "/backup/job";
    private static final TypeReference<Map<String, Object>> BODY = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final SchedulerService scheduler;
    private final ScheduleRequestParser parser;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public SchedulerGateway(int port, SchedulerService scheduler) {
        this(port, "127.0.0.1", scheduler, new ScheduleRequestParser());
    }

    public SchedulerGateway(int port, String host, SchedulerService scheduler, ScheduleRequestParser parser) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/scheduler/status", this::handleStatus)
            .addExactPath("/scheduler/jobs", this::handleJobs)
            .addPrefixPath(JOB_PREFIX, this::handleSubmit);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Scheduler gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStatus(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, scheduler.status());
    }

    private void handleJobs(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String owner = queryParam(exchange, "owner");
        List<JobSnapshot> jobs;
        if (owner.isBlank()) {
            jobs = scheduler.jobs();
        } else {
            Integer ownerId = parseOwnerId(owner);
            if (ownerId == null) {
                sendJson(exchange, 400, Map.of("error", "owner must be an integer"));
                return;
            }
            jobs = scheduler.jobsFor(ownerId);
        }
        sendJson(exchange, 200, Map.of("jobs", jobs));
    }

    private void handleSubmit(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleSubmit(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        // relative path is "/{ownerId}" below the prefix
        String rest = exchange.getRelativePath();
        Integer ownerId = parseOwnerId(rest.startsWith("/") ? rest.substring(1) : rest);
        if (ownerId == null) {
            sendJson(exchange, 404, Map.of("error", "unknown_path"));
            return;
        }

        Map<String, Object> body;
        try {
            body = readJsonBody(exchange);
        } catch (IOException e) {
            sendJson(exchange, 400, Map.of("error", "request body must be a JSON object"));
            return;
        }
        if (!parser.isSchedulingRequest(body)) {
            sendJson(exchange, 400, Map.of("error", "only scheduled backups are accepted here"));
            return;
        }

        try {
            ScheduleRequest request = parser.parse(ownerId, body);
            String jobId = scheduler.submit(request);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("job_id", jobId);
            payload.put("next_run", scheduler.job(jobId).map(JobSnapshot::nextRun).orElse(null));
            payload.put("message", "Backup scheduled successfully");
            sendJson(exchange, 200, payload);
        } catch (ValidationException e) {
            sendJson(exchange, 400, Map.of("error", e.getMessage()));
        } catch (NotInitializedException e) {
            sendJson(exchange, 409, Map.of("error", e.getMessage()));
        }
    }

    private Map<String, Object> readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return Map.of();
        }
        return mapper.readValue(bytes, BODY);
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.warn("Gateway request {} failed", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not send error response", e);
        }
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.peekFirst();
        return value == null ? "" : value.trim();
    }

    private Integer parseOwnerId(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
