package com.metersentinel.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * HTTP health, readiness and status endpoints for the scheduler process.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 {"status":"UP"}} while the job
 * orchestrator runs, {@code 503 {"status":"DOWN"}} otherwise</li>
 * <li>{@code GET /readiness}: {@code 200 {"status":"READY"}} once the
 * orchestrator runs and production models are loaded; {@code 503} with
 * {@code NOT_READY} before that, since anomaly scans would only run the
 * statistical detectors</li>
 * <li>{@code GET /status}: job stats and production model versions as
 * JSON</li>
 * </ul>
 * Other methods get {@code 405}.
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final BooleanSupplier schedulerRunning;
    private final BooleanSupplier modelsLoaded;
    private final Supplier<Map<String, Object>> statusSupplier;
    private final ObjectMapper mapper;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    public HealthServer(BooleanSupplier schedulerRunning, BooleanSupplier modelsLoaded,
            Supplier<Map<String, Object>> statusSupplier, ObjectMapper mapper) {
        this.schedulerRunning = Objects.requireNonNull(schedulerRunning, "schedulerRunning must not be null");
        this.modelsLoaded = Objects.requireNonNull(modelsLoaded, "modelsLoaded must not be null");
        this.statusSupplier = Objects.requireNonNull(statusSupplier, "statusSupplier must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Start the server on the given port. A bind failure is logged and
     * leaves the scheduler running without health checks.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", exchange -> handle(exchange, this::health));
            server.createContext("/readiness", exchange -> handle(exchange, this::readiness));
            server.createContext("/status", exchange -> handle(exchange, this::status));
            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));
            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, or {@code -1} when not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private Response health() {
        return schedulerRunning.getAsBoolean()
                ? Response.json(200, "{\"status\":\"UP\"}")
                : Response.json(503, "{\"status\":\"DOWN\"}");
    }

    private Response readiness() {
        return schedulerRunning.getAsBoolean() && modelsLoaded.getAsBoolean()
                ? Response.json(200, "{\"status\":\"READY\"}")
                : Response.json(503, "{\"status\":\"NOT_READY\"}");
    }

    private Response status() {
        try {
            return new Response(200, mapper.writeValueAsBytes(statusSupplier.get()));
        } catch (RuntimeException | IOException e) {
            LOG.warn("Failed to render status: {}", e.getMessage(), e);
            return Response.json(500, "{\"status\":\"ERROR\"}");
        }
    }

    private static void handle(HttpExchange exchange, Supplier<Response> handler) throws IOException {
        Response response = "GET".equals(exchange.getRequestMethod())
                ? handler.get()
                : Response.json(405, "{\"status\":\"METHOD_NOT_ALLOWED\"}");
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.code, response.body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response.body);
        }
    }

    private static final class Response {

        private final int code;
        private final byte[] body;

        private Response(int code, byte[] body) {
            this.code = code;
            this.body = body;
        }

        private static Response json(int code, String body) {
            return new Response(code, body.getBytes(StandardCharsets.UTF_8));
        }
    }
}
