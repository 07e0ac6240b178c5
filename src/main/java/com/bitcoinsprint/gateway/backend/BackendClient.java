package com.bitcoinsprint.gateway.backend;

import com.bitcoinsprint.gateway.metrics.GatewayMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-attempt HTTP client for the backend service.
 *
 * <p>Connections are pooled by the JDK {@link HttpClient}. Each call has one deadline covering
 * the whole exchange: connect, response headers and the complete body. A backend that accepts the
 * connection and then stalls, before or after sending headers, fails the call when the deadline
 * passes. Any non-2xx status is relayed, not raised; only transport failures become
 * {@link BackendUnavailableException}. Nothing is retried.
 */
@Slf4j
public class BackendClient {

    private final String baseUrl;
    @Getter
    private final Duration timeout;
    private final HttpClient httpClient;
    private final GatewayMetrics metrics;

    public BackendClient(String baseUrl, Duration connectTimeout, Duration timeout, GatewayMetrics metrics) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Sends one request and relays the backend's status, headers and body.
     *
     * @param pathAndQuery raw request target starting with {@code /}, query string included
     * @param headers      inbound headers; hop-by-hop headers and {@code Authorization} are not sent
     * @param body         request body, may be null or empty
     */
    public BackendResponse forward(HttpMethod method, String pathAndQuery, HttpHeaders headers, byte[] body) {
        HttpRequest request = buildRequest(method, resolve(pathAndQuery), ForwardedHeaders.toBackend(headers), body);
        long start = System.nanoTime();
        CompletableFuture<HttpResponse<byte[]>> call =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try {
            HttpResponse<byte[]> res = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordBackendCall("ok", System.nanoTime() - start);
            return new BackendResponse(res.statusCode(), ForwardedHeaders.toCaller(toSpring(res.headers())), res.body());
        } catch (TimeoutException ex) {
            call.cancel(true);
            throw failed(method, request.uri(), start, true, "Backend timed out after " + timeout.toMillis() + "ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            boolean timedOut = cause instanceof HttpTimeoutException;
            throw failed(method, request.uri(), start, timedOut,
                    timedOut ? "Backend timed out after " + timeout.toMillis() + "ms" : "Backend unavailable: " + rootMessage(cause),
                    cause);
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw failed(method, request.uri(), start, false, "Backend call interrupted", ex);
        }
    }

    public BackendResponse get(String path) {
        return forward(HttpMethod.GET, path, new HttpHeaders(), null);
    }

    private HttpRequest buildRequest(HttpMethod method, URI uri, HttpHeaders outbound, byte[] body) {
        HttpRequest.BodyPublisher publisher = (body == null || body.length == 0)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .method(method.name(), publisher);
        try {
            outbound.forEach((name, values) -> values.forEach(v -> builder.header(name, v)));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid request header");
        }
        return builder.build();
    }

    private BackendUnavailableException failed(HttpMethod method, URI uri, long start, boolean timedOut,
                                               String message, Throwable cause) {
        metrics.recordBackendCall(timedOut ? "timeout" : "error", System.nanoTime() - start);
        log.debug("Backend call {} {} failed", method, uri, cause);
        return new BackendUnavailableException(message, timedOut, cause);
    }

    private URI resolve(String pathAndQuery) {
        String target = (pathAndQuery == null || pathAndQuery.isEmpty()) ? "/" : pathAndQuery;
        if (!target.startsWith("/")) target = "/" + target;
        try {
            return URI.create(baseUrl + target);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid request target");
        }
    }

    private static HttpHeaders toSpring(java.net.http.HttpHeaders jdkHeaders) {
        HttpHeaders out = new HttpHeaders();
        for (Map.Entry<String, List<String>> e : jdkHeaders.map().entrySet()) {
            out.addAll(e.getKey(), e.getValue());
        }
        return out;
    }

    private static String rootMessage(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        String msg = root.getMessage();
        return msg == null ? root.getClass().getSimpleName() : msg;
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
