package com.conversionlog.sdk.client;

import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.client.transport.TransportResponse;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ConversionTransport} that answers without a network. Upload calls succeed with one
 * result per row unless responses have been queued; every request is recorded.
 */
public class FakePlatformTransport implements ConversionTransport {

    private final ObjectMapper objectMapper = ConversionLogUtils.defaultObjectMapper();
    private final CopyOnWriteArrayList<TransportRequest> requests = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedDeque<TransportResponse> queued = new ConcurrentLinkedDeque<>();

    @Override
    public TransportResponse send(TransportRequest request) {
        requests.add(request);
        TransportResponse next = queued.pollFirst();
        if (next != null) {
            return next;
        }
        if (request.getUri().getPath().endsWith(":uploadConversions")) {
            return new TransportResponse(200, uploadSuccess(request.getBody()));
        }
        return new TransportResponse(200, "{}");
    }

    @Override
    public CompletableFuture<TransportResponse> sendAsync(TransportRequest request) {
        return CompletableFuture.completedFuture(send(request));
    }

    /**
     * Answer the next request with {@code response} instead of the default
     */
    public FakePlatformTransport enqueue(TransportResponse response) {
        queued.addLast(response);
        return this;
    }

    public List<TransportRequest> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    /**
     * Order ids of every conversion row posted to the upload endpoint
     */
    public List<String> getUploadedOrderIds() {
        List<String> orderIds = new ArrayList<>();
        for (TransportRequest request : requests) {
            if (!request.getUri().getPath().endsWith(":uploadConversions")) {
                continue;
            }
            for (JsonNode row : conversions(request.getBody())) {
                orderIds.add(row.path("order_id").asText(null));
            }
        }
        return orderIds;
    }

    public void reset() {
        requests.clear();
        queued.clear();
    }

    private String uploadSuccess(String body) {
        StringBuilder results = new StringBuilder("{\"results\":[");
        List<JsonNode> rows = conversions(body);
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) {
                results.append(',');
            }
            results.append("{\"order_id\":")
                    .append(objectMapper.valueToTree(rows.get(i).path("order_id").asText("")).toString())
                    .append('}');
        }
        return results.append("]}").toString();
    }

    private List<JsonNode> conversions(String body) {
        List<JsonNode> rows = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return rows;
        }
        try {
            objectMapper.readTree(body).path("conversions").forEach(rows::add);
        } catch (IOException e) {
            throw new IllegalArgumentException("Upload body is not JSON: " + e.getMessage(), e);
        }
        return rows;
    }
}
