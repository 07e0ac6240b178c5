package com.bitcoinsprint.gateway.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String RATE_LIMIT_LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";

    /** Request attribute set when the caller went away before the response was written. */
    public static final String CLIENT_CANCELLED_ATTRIBUTE = RequestContextKeys.class.getName() + ".clientCancelled";

    /** Nginx convention for "client closed request"; not a registered HTTP status. */
    public static final int CLIENT_CLOSED_REQUEST = 499;
}
