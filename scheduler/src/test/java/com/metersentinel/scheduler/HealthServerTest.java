package com.metersentinel.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metersentinel.core.registry.FileModelRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    @TempDir
    Path registryDir;

    private final ObjectMapper mapper = FileModelRegistry.newMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private final AtomicBoolean schedulerUp = new AtomicBoolean(true);
    private final AtomicBoolean modelsLoaded = new AtomicBoolean(false);
    private final JobOrchestrator orchestrator = new JobOrchestrator(Clock.systemUTC(), ZoneId.of("UTC"), 1);
    private HealthServer server;

    @BeforeEach
    void setUp() throws IOException {
        FileModelRegistry registry = new FileModelRegistry(registryDir, Clock.systemUTC());
        orchestrator.register(new Job() {
            @Override
            public String name() {
                return "anomaly-scan";
            }

            @Override
            public void run() {
            }
        }, new IntervalTrigger(Duration.ofMinutes(60)));
        server = new HealthServer(schedulerUp::get, modelsLoaded::get,
                () -> MeterSentinelApp.status(orchestrator, registry), mapper);
        server.start(freePort());
    }

    @AfterEach
    void tearDown() {
        server.stop();
        orchestrator.close();
    }

    @Test
    @DisplayName("Status lists job counters and the production pointer as JSON")
    void shouldServeStatus() throws Exception {
        orchestrator.runNow("anomaly-scan");

        HttpResponse<String> response = get("/status");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");
        JsonNode json = mapper.readTree(response.body());
        assertThat(json.get("status").asText()).isEqualTo("STOPPED");
        assertThat(json.get("production").isNull()).isTrue();
        JsonNode scan = json.get("jobs").get("anomaly-scan");
        assertThat(scan.get("executed").asLong()).isEqualTo(1);
        assertThat(scan.get("lastStatus").asText()).isEqualTo("SUCCEEDED");
        assertThat(scan.get("schedule").asText()).isEqualTo("every 60 min");
    }

    @Test
    @DisplayName("Liveness follows the scheduler")
    void shouldReportLiveness() throws Exception {
        assertThat(get("/health").statusCode()).isEqualTo(200);

        schedulerUp.set(false);

        HttpResponse<String> down = get("/health");
        assertThat(down.statusCode()).isEqualTo(503);
        assertThat(down.body()).contains("DOWN");
    }

    @Test
    @DisplayName("Readiness waits for production models")
    void shouldReportReadinessOnceModelsLoad() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        modelsLoaded.set(true);

        HttpResponse<String> ready = get("/readiness");
        assertThat(ready.statusCode()).isEqualTo(200);
        assertThat(ready.body()).contains("READY");
    }

    @Test
    @DisplayName("Only GET is accepted")
    void shouldRejectOtherMethods() throws Exception {
        HttpRequest post = HttpRequest.newBuilder(uri("/status"))
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();

        assertThat(client.send(post, HttpResponse.BodyHandlers.ofString()).statusCode()).isEqualTo(405);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
