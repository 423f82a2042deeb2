package com.conversionlog.sdk.client.transport;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public final class JdkHttpTransport implements ConversionTransport {

    // managed by HttpClient itself
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "host");

    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws Exception {
        HttpRequest httpRequest = buildRequest(request);
        HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        return new TransportResponse(response.statusCode(), response.body());
    }

    @Override
    public CompletableFuture<TransportResponse> sendAsync(TransportRequest request) {
        HttpRequest httpRequest = buildRequest(request);
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> new TransportResponse(response.statusCode(), response.body()));
    }

    private HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.getUri());
        if (request.getTimeout() != null) {
            builder.timeout(request.getTimeout());
        }

        request.getHeaders().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(java.util.Locale.ROOT))) {
                builder.header(name, value);
            }
        });

        String method = request.getMethod();
        String body = request.getBody();
        if ("POST".equals(method)) {
            builder.POST(body != null
                    ? HttpRequest.BodyPublishers.ofString(body)
                    : HttpRequest.BodyPublishers.noBody());
        } else if ("PUT".equals(method) && body != null) {
            builder.PUT(HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.GET();
        }

        return builder.build();
    }
}
