package com.bitcoinsprint.gateway.backend;

import com.bitcoinsprint.gateway.metrics.GatewayMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class BackendClientTest {

    private static final String CHAINS = "{\"chains\":{\"bitcoin\":{\"status\":\"ok\",\"peers\":8,\"message\":\"synced\"}}}";

    private MockWebServer server;
    private GatewayMetrics metrics;
    private BackendClient client;

    @BeforeEach
    void start() throws IOException {
        server = new MockWebServer();
        server.start();
        metrics = new GatewayMetrics(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
        client = new BackendClient(server.url("/").toString(), Duration.ofSeconds(1), Duration.ofSeconds(2), metrics);
    }

    @AfterEach
    void stop() throws IOException {
        server.shutdown();
    }

    @Test
    void forward_shouldRelayStatusHeadersAndBodyVerbatim() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setHeader("X-Backend", "go")
                .setBody(CHAINS));

        BackendResponse res = client.forward(HttpMethod.GET, "/chains?verbose=1", new HttpHeaders(), null);

        assertThat(res.status()).isEqualTo(200);
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo(CHAINS);
        assertThat(res.headers().getFirst("X-Backend")).isEqualTo("go");
        assertThat(res.headers().getFirst("Content-Type")).isEqualTo("application/json");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/chains?verbose=1");
    }

    @Test
    void forward_shouldRelayErrorStatusesWithoutRaising() {
        server.enqueue(new MockResponse().setResponseCode(418).setBody("{\"error\":\"teapot\"}"));

        BackendResponse res = client.forward(HttpMethod.GET, "/brew", new HttpHeaders(), null);

        assertThat(res.status()).isEqualTo(418);
        assertThat(res.is2xx()).isFalse();
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("{\"error\":\"teapot\"}");
    }

    @Test
    void forward_shouldSendBodyAndHeadersButNotCallerCredential() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer demo-key-pro");
        headers.set(HttpHeaders.CONTENT_TYPE, "application/json");
        headers.set(HttpHeaders.CONNECTION, "keep-alive");
        headers.set("X-Request-Source", "sdk");

        BackendResponse res = client.forward(HttpMethod.POST, "/blocks", headers,
                "{\"height\":1}".getBytes(StandardCharsets.UTF_8));

        assertThat(res.status()).isEqualTo(201);
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"height\":1}");
        assertThat(recorded.getHeader("Authorization")).isNull();
        assertThat(recorded.getHeader("X-Request-Source")).isEqualTo("sdk");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
    }

    @Test
    void forward_whenBackendHangs_shouldTimeOutAtConfiguredTimeout() {
        server.enqueue(new MockResponse().setHeadersDelay(5, TimeUnit.SECONDS).setBody("late"));

        long start = System.nanoTime();
        BackendUnavailableException ex = catchThrowableOfType(
                () -> client.forward(HttpMethod.GET, "/status", new HttpHeaders(), null),
                BackendUnavailableException.class);
        Duration took = Duration.ofNanos(System.nanoTime() - start);

        assertThat(ex).isNotNull();
        assertThat(ex.isTimedOut()).isTrue();
        assertThat(took).isGreaterThanOrEqualTo(Duration.ofMillis(1900)).isLessThan(Duration.ofSeconds(4));
        assertThat(metrics.dump()).contains("api_backend_request_duration_seconds_count{outcome=\"timeout\"} 1");
    }

    @Test
    void forward_whenBodyStallsAfterHeaders_shouldStillTimeOutAtConfiguredTimeout() {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(CHAINS)
                .setBodyDelay(5, TimeUnit.SECONDS));

        long start = System.nanoTime();
        BackendUnavailableException ex = catchThrowableOfType(
                () -> client.forward(HttpMethod.GET, "/chains", new HttpHeaders(), null),
                BackendUnavailableException.class);
        Duration took = Duration.ofNanos(System.nanoTime() - start);

        assertThat(ex).isNotNull();
        assertThat(ex.isTimedOut()).isTrue();
        assertThat(took).isLessThan(Duration.ofSeconds(4));
    }

    @Test
    void forward_whenConnectionRefused_shouldFailWithoutRetry() throws Exception {
        int freePort;
        try (ServerSocket s = new ServerSocket(0)) {
            freePort = s.getLocalPort();
        }
        BackendClient refused = new BackendClient("http://127.0.0.1:" + freePort, Duration.ofSeconds(1),
                Duration.ofSeconds(2), metrics);

        assertThatThrownBy(() -> refused.forward(HttpMethod.GET, "/status", new HttpHeaders(), null))
                .isInstanceOf(BackendUnavailableException.class)
                .satisfies(ex -> assertThat(((BackendUnavailableException) ex).isTimedOut()).isFalse());
        assertThat(metrics.dump()).contains("api_backend_request_duration_seconds_count{outcome=\"error\"} 1");
    }

    @Test
    void forward_shouldNeverRetry() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        BackendResponse res = client.forward(HttpMethod.GET, "/status", new HttpHeaders(), null);

        assertThat(res.status()).isEqualTo(503);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void forward_shouldStripHopByHopResponseHeaders() {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setHeader("Keep-Alive", "timeout=5")
                .setHeader("X-Chain", "bitcoin")
                .setBody("{}"));

        BackendResponse res = client.forward(HttpMethod.GET, "/x", new HttpHeaders(), null);

        assertThat(res.headers().containsKey("Keep-Alive")).isFalse();
        assertThat(res.headers().containsKey("Content-Length")).isFalse();
        assertThat(res.headers().getFirst("X-Chain")).isEqualTo("bitcoin");
    }
}
