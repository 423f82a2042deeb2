package com.conversionlog.sdk.autoconfigure.transport;

import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.client.transport.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

class RestClientTransportTest {

    private static final String UPLOAD_URL = "https://ads.test/v14/customers/1234567890:uploadConversions";

    private MockRestServiceServer mockServer;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        mockServer = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Test
    void postsUploadWithPlatformHeaders() throws Exception {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer tok"))
                .andExpect(header("developer-token", "dev-token"))
                .andExpect(content().string("{\"partial_failure_enabled\":true}"))
                .andRespond(withSuccess("{\"results\":[{\"order_id\":\"B1\"}]}", MediaType.APPLICATION_JSON));

        TransportRequest request = TransportRequest.postJson(URI.create(UPLOAD_URL),
                "{\"partial_failure_enabled\":true}",
                Map.of("Authorization", "Bearer tok", "developer-token", "dev-token"),
                Duration.ofSeconds(10));

        TransportResponse response = new RestClientTransport(restClient, null).send(request);

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getBody()).contains("order_id");
        mockServer.verify();
    }

    @Test
    void unauthorizedComesBackAsResponse() throws Exception {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andRespond(withUnauthorizedRequest().body("{\"error\":{\"code\":401}}"));

        TransportResponse response = new RestClientTransport(restClient, null)
                .send(TransportRequest.postJson(URI.create(UPLOAD_URL), "{}", Map.of(), Duration.ofSeconds(10)));

        assertThat(response.getStatusCode()).isEqualTo(401);
        assertThat(response.isSuccessful()).isFalse();
        mockServer.verify();
    }

    @Test
    void rateLimitComesBackAsResponse() throws Exception {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        TransportResponse response = new RestClientTransport(restClient, null)
                .send(TransportRequest.postJson(URI.create(UPLOAD_URL), "{}", Map.of(), Duration.ofSeconds(10)));

        assertThat(response.getStatusCode()).isEqualTo(429);
        assertThat(response.getBody()).isEqualTo("slow down");
        mockServer.verify();
    }

    @Test
    void sendsWithoutBody() throws Exception {
        mockServer.expect(requestTo("https://collector.test/health"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        TransportRequest request = new TransportRequest(URI.create("https://collector.test/health"), "GET", null,
                Map.of(), Duration.ofSeconds(5));

        assertThat(new RestClientTransport(restClient, null).send(request).getStatusCode()).isEqualTo(200);
        mockServer.verify();
    }

    @Test
    void sendAsyncUsesExecutor() throws Exception {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<TransportResponse> future = new RestClientTransport(restClient, executor)
                    .sendAsync(TransportRequest.postJson(URI.create(UPLOAD_URL), "{}", Map.of(), Duration.ofSeconds(10)));
            assertThat(future.get().getStatusCode()).isEqualTo(200);
        } finally {
            executor.shutdown();
        }
        mockServer.verify();
    }

    @Test
    void sendAsyncWithoutExecutor() throws Exception {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andRespond(withSuccess("{\"results\":[]}", MediaType.APPLICATION_JSON));

        TransportResponse response = new RestClientTransport(restClient, null)
                .sendAsync(TransportRequest.postJson(URI.create(UPLOAD_URL), "{}", Map.of(), Duration.ofSeconds(10)))
                .get();

        assertThat(response.getBody()).isEqualTo("{\"results\":[]}");
        mockServer.verify();
    }

    @Test
    void connectionFailureSurfacesAsIOException() {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andRespond(withException(new IOException("Connection refused")));

        RestClientTransport transport = new RestClientTransport(restClient, null);

        assertThatThrownBy(() -> transport.send(
                TransportRequest.postJson(URI.create(UPLOAD_URL), "{}", Map.of(), Duration.ofSeconds(10))))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Connection refused");
    }

    @Test
    void asyncConnectionFailureCompletesExceptionally() {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andRespond(withException(new IOException("Connection reset")));

        CompletableFuture<TransportResponse> future = new RestClientTransport(restClient, null)
                .sendAsync(TransportRequest.postJson(URI.create(UPLOAD_URL), "{}", Map.of(), Duration.ofSeconds(10)));

        assertThatThrownBy(future::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void restrictedHeadersAreNotForwarded() throws Exception {
        mockServer.expect(requestTo(UPLOAD_URL))
                .andExpect(headerDoesNotExist("Host"))
                .andExpect(header("developer-token", "dev-token"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        TransportRequest request = TransportRequest.postJson(URI.create(UPLOAD_URL), "{}",
                Map.of("Host", "spoofed.test", "developer-token", "dev-token"), Duration.ofSeconds(10));

        assertThat(new RestClientTransport(restClient, null).send(request).getStatusCode()).isEqualTo(200);
        mockServer.verify();
    }
}
