package com.bitcoinsprint.gateway.api;

import com.bitcoinsprint.gateway.api.dto.ReadinessResponse;
import com.bitcoinsprint.gateway.api.dto.StatusResponse;
import com.bitcoinsprint.gateway.api.dto.SystemStatus;
import com.bitcoinsprint.gateway.auth.CallerContext;
import com.bitcoinsprint.gateway.backend.BackendClient;
import com.bitcoinsprint.gateway.backend.BackendResponse;
import com.bitcoinsprint.gateway.backend.BackendUnavailableException;
import com.bitcoinsprint.gateway.config.GatewayProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Forward-and-enrich endpoints: the backend document is fetched, checked and wrapped.
 * A non-2xx or non-JSON-object backend answer counts as unavailable.
 */
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final BackendClient backend;
    private final ObjectMapper objectMapper;
    private final GatewayProperties props;
    private final Clock clock;

    @GetMapping("/status")
    public StatusResponse status(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        JsonNode doc = fetch("/status");
        SystemStatus data = new SystemStatus(
                "operational",
                props.getVersion(),
                text(doc, "status"),
                text(doc, "uptime"),
                objectOrEmpty(doc, "chains"),
                objectOrEmpty(doc, "sla_assessment"),
                objectOrEmpty(doc, "system_health"),
                Instant.now(clock)
        );
        return new StatusResponse(true, data, caller.tierLabel());
    }

    @GetMapping("/readiness")
    public ReadinessResponse readiness(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        return new ReadinessResponse(true, fetch("/readiness"), caller.tierLabel());
    }

    private JsonNode fetch(String path) {
        BackendResponse res = backend.get(path);
        if (!res.is2xx()) {
            throw new BackendUnavailableException("Backend returned status " + res.status() + " for " + path);
        }
        JsonNode doc;
        try {
            doc = objectMapper.readTree(res.body());
        } catch (IOException ex) {
            throw new BackendUnavailableException("Backend returned an unreadable document for " + path, false, ex);
        }
        if (doc == null || !doc.isObject()) {
            throw new BackendUnavailableException("Backend returned a non-object document for " + path);
        }
        return doc;
    }

    private static String text(JsonNode doc, String field) {
        JsonNode v = doc.get(field);
        return (v == null || v.isNull()) ? "unknown" : v.asText();
    }

    private JsonNode objectOrEmpty(JsonNode doc, String field) {
        JsonNode v = doc.get(field);
        return (v != null && v.isObject()) ? v : objectMapper.createObjectNode();
    }
}
