package com.conversionlog.sdk.client;

import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.client.transport.TransportResponse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Replays canned responses in order and records every request.
 */
public class SequencedTransport implements ConversionTransport {

    private final Deque<Object> responses;
    private final List<TransportRequest> requests = new ArrayList<>();

    public SequencedTransport(Object... responses) {
        this.responses = new ArrayDeque<>(Arrays.asList(responses));
    }

    @Override
    public synchronized TransportResponse send(TransportRequest request) throws Exception {
        requests.add(request);
        Object next = responses.isEmpty() ? new TransportResponse(500, "{}") : responses.removeFirst();
        if (next instanceof Exception exception) {
            throw exception;
        }
        return (TransportResponse) next;
    }

    @Override
    public CompletableFuture<TransportResponse> sendAsync(TransportRequest request) {
        try {
            return CompletableFuture.completedFuture(send(request));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public synchronized List<TransportRequest> getRequests() {
        return List.copyOf(requests);
    }

    public synchronized int getRequestCount() {
        return requests.size();
    }
}
