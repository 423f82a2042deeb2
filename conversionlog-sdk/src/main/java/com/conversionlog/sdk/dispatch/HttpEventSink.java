package com.conversionlog.sdk.dispatch;

import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Posts each event as JSON to a collector endpoint. Any non-2xx status fails the push.
 */
public class HttpEventSink implements EventSink {

    private final String name;
    private final URI endpoint;
    private final ConversionTransport transport;
    private final ObjectMapper objectMapper;
    private final Map<String, String> headers;
    private final Duration requestTimeout;

    public HttpEventSink(String name, URI endpoint, ConversionTransport transport) {
        this(name, endpoint, transport, ConversionLogUtils.defaultObjectMapper(), Map.of(), Duration.ofSeconds(10));
    }

    public HttpEventSink(String name, URI endpoint, ConversionTransport transport, ObjectMapper objectMapper,
                         Map<String, String> headers, Duration requestTimeout) {
        this.name = Objects.requireNonNull(name, "name");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.objectMapper = objectMapper != null ? objectMapper : ConversionLogUtils.defaultObjectMapper();
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<Void> push(SinkEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new ConversionLogException("Failed to serialize " + event, e));
        }
        return transport.sendAsync(TransportRequest.postJson(endpoint, json, headers, requestTimeout))
                .thenAccept(response -> {
                    if (!response.isSuccessful()) {
                        throw new ConversionLogException(
                                name + " rejected event: " + response.getStatusCode(),
                                response.getStatusCode(),
                                null);
                    }
                });
    }

    @Override
    public String toString() {
        return "HttpEventSink{name='" + name + "', endpoint=" + endpoint + "}";
    }
}
