package com.bitcoinsprint.gateway.api;

import com.bitcoinsprint.gateway.api.dto.StatusResponse;
import com.bitcoinsprint.gateway.auth.CallerContext;
import com.bitcoinsprint.gateway.backend.BackendClient;
import com.bitcoinsprint.gateway.backend.BackendResponse;
import com.bitcoinsprint.gateway.backend.BackendUnavailableException;
import com.bitcoinsprint.gateway.config.GatewayProperties;
import com.bitcoinsprint.gateway.support.MutableClock;
import com.bitcoinsprint.gateway.tier.Tier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StatusControllerTest {

    private final BackendClient backend = mock(BackendClient.class);
    private final StatusController controller = new StatusController(
            backend, new ObjectMapper(), new GatewayProperties(), MutableClock.startingAt("2024-05-01T12:00:00Z"));
    private final CallerContext caller = CallerContext.authenticated("apiKey:x", Tier.ENTERPRISE);

    private static BackendResponse response(int status, String body) {
        return new BackendResponse(status, new HttpHeaders(), body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void status_shouldFillUnknownForMissingFields() {
        when(backend.get("/status")).thenReturn(response(200, "{\"chains\":{}}"));

        StatusResponse res = controller.status(caller);

        assertThat(res.tier()).isEqualTo("enterprise");
        assertThat(res.data().backendStatus()).isEqualTo("unknown");
        assertThat(res.data().uptime()).isEqualTo("unknown");
        assertThat(res.data().slaAssessment().isObject()).isTrue();
        assertThat(res.data().timestamp()).hasToString("2024-05-01T12:00:00Z");
    }

    @Test
    void status_withNon2xxBackend_shouldBeUnavailable() {
        when(backend.get("/status")).thenReturn(response(502, "{\"status\":\"down\"}"));

        assertThatThrownBy(() -> controller.status(caller))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("502");
    }

    @Test
    void readiness_withUnreadableBackendDocument_shouldBeUnavailable() {
        when(backend.get("/readiness")).thenReturn(response(200, "<html>oops</html>"));

        assertThatThrownBy(() -> controller.readiness(caller))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void readiness_withNonObjectDocument_shouldBeUnavailable() {
        when(backend.get("/readiness")).thenReturn(response(200, "[1,2,3]"));

        assertThatThrownBy(() -> controller.readiness(caller))
                .isInstanceOf(BackendUnavailableException.class);
    }
}
