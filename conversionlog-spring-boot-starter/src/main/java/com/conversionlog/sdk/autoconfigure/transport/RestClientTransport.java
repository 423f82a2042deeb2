package com.conversionlog.sdk.autoconfigure.transport;

import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.client.transport.TransportResponse;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * {@link ConversionTransport} over Spring's {@link RestClient}.
 *
 * <p>Error statuses come back as responses so the platform client's retry and 401 handling stay
 * in charge. I/O failures are rethrown as the underlying {@link IOException}, the same as
 * {@code JdkHttpTransport}, so they are retried and classified as network errors. Per-request
 * timeouts are left to the {@code RestClient}'s request factory.</p>
 */
public final class RestClientTransport implements ConversionTransport {

    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "host");

    private final RestClient restClient;
    private final Executor asyncExecutor;

    public RestClientTransport(RestClient restClient, Executor asyncExecutor) {
        this.restClient = restClient;
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException {
        RestClient.RequestBodySpec spec = restClient.method(HttpMethod.valueOf(request.getMethod()))
                .uri(request.getUri());
        request.getHeaders().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                spec.header(name, value);
            }
        });
        if (request.getBody() != null) {
            spec.body(request.getBody());
        }
        try {
            ResponseEntity<String> response = spec.retrieve().toEntity(String.class);
            return new TransportResponse(response.getStatusCode().value(),
                    response.getBody() != null ? response.getBody() : "");
        } catch (RestClientResponseException ex) {
            return new TransportResponse(ex.getStatusCode().value(), ex.getResponseBodyAsString());
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof IOException io) {
                throw io;
            }
            throw ex;
        }
    }

    @Override
    public CompletableFuture<TransportResponse> sendAsync(TransportRequest request) {
        if (asyncExecutor != null) {
            return CompletableFuture.supplyAsync(() -> sendUnchecked(request), asyncExecutor);
        }
        return CompletableFuture.supplyAsync(() -> sendUnchecked(request));
    }

    private TransportResponse sendUnchecked(TransportRequest request) {
        try {
            return send(request);
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }
}
