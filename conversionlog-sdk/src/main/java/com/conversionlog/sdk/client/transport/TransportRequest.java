package com.conversionlog.sdk.client.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

public final class TransportRequest {
    private final URI uri;
    private final String method;
    private final String body;
    private final Map<String, String> headers;
    private final Duration timeout;

    public TransportRequest(URI uri, String method, String body, Map<String, String> headers, Duration timeout) {
        this.uri = uri;
        this.method = method;
        this.body = body;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.timeout = timeout;
    }

    public static TransportRequest postJson(URI uri, String json, Map<String, String> headers, Duration timeout) {
        java.util.HashMap<String, String> merged = new java.util.HashMap<>();
        merged.put("Content-Type", "application/json");
        merged.put("Accept", "application/json");
        if (headers != null) {
            merged.putAll(headers);
        }
        return new TransportRequest(uri, "POST", json, merged, timeout);
    }

    public URI getUri() {
        return uri;
    }

    public String getMethod() {
        return method;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
