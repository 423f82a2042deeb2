package com.conversionlog.sdk.client;

import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.client.transport.JdkHttpTransport;
import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.client.transport.TransportResponse;
import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.exception.ErrorType;
import com.conversionlog.sdk.model.ApiResponses.UploadConversionsResponse;
import com.conversionlog.sdk.model.ConversionUpload;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Advertising platform API client - uploads offline click conversions
 *
 * <p>Thread-safe. Every request carries a bearer token from the {@link TokenProvider} and the
 * {@code developer-token} header. Server errors and rate limiting are retried with a linear
 * delay; a 401 invalidates the cached token and is retried once with a fresh one.</p>
 *
 * <pre>{@code
 * AdPlatformClient client = AdPlatformClient.builder()
 *     .customerId("1234567890")
 *     .developerToken("dev-token")
 *     .tokenProvider(oauthTokenProvider)
 *     .build();
 *
 * UploadConversionsResponse response = client.uploadConversions(List.of(row));
 * }</pre>
 */
public class AdPlatformClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdPlatformClient.class);

    public static final String DEFAULT_BASE_URL = "https://googleads.googleapis.com";
    public static final String DEFAULT_API_VERSION = "v14";

    private final String baseUrl;
    private final String apiVersion;
    private final String customerId;
    private final String loginCustomerId;
    private final String developerToken;
    private final TokenProvider tokenProvider;
    private final ConversionTransport transport;
    private final ObjectMapper objectMapper;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration requestTimeout;

    private AdPlatformClient(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.apiVersion = builder.apiVersion;
        this.customerId = stripDashes(builder.customerId);
        this.loginCustomerId = stripDashes(builder.loginCustomerId);
        this.developerToken = builder.developerToken;
        this.tokenProvider = builder.tokenProvider;

        if (builder.transport != null) {
            this.transport = builder.transport;
        } else {
            HttpClient httpClient = builder.httpClient != null
                    ? builder.httpClient
                    : HttpClient.newBuilder()
                        .connectTimeout(builder.connectTimeout)
                        .build();
            this.transport = new JdkHttpTransport(httpClient);
        }

        this.objectMapper = builder.objectMapper != null
                ? builder.objectMapper
                : ConversionLogUtils.defaultObjectMapper();
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Conversion Operations
    // ========================================================================

    /**
     * Upload click conversions with partial failure enabled
     *
     * <p>A 200 response may still carry {@code partial_failure_error}; callers decide whether
     * that is fatal via {@link UploadConversionsResponse#hasPartialFailure()}.</p>
     *
     * @throws ConversionLogException on API, auth or network errors
     */
    public UploadConversionsResponse uploadConversions(List<ConversionUpload> conversions) {
        if (conversions == null || conversions.isEmpty()) {
            throw new IllegalArgumentException("conversions must not be empty");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("conversions", conversions);
        body.put("partial_failure_enabled", true);

        String path = "/" + apiVersion + "/customers/" + customerId + ":uploadConversions";
        try {
            String json = objectMapper.writeValueAsString(body);
            return executeWithRetry(URI.create(baseUrl + path), json, UploadConversionsResponse.class);
        } catch (ConversionLogException e) {
            throw e;
        } catch (Exception e) {
            throw new ConversionLogException("Failed to upload conversions: " + path, e);
        }
    }

    /**
     * Resource name of a conversion action for this customer
     */
    public String conversionActionResource(String conversionActionId) {
        return "customers/" + customerId + "/conversionActions/" + conversionActionId;
    }

    public String getCustomerId() {
        return customerId;
    }

    // ========================================================================
    // HTTP
    // ========================================================================

    private TransportRequest buildRequest(URI uri, String json) {
        String token;
        try {
            token = tokenProvider.getToken();
        } catch (RuntimeException e) {
            throw new ConversionLogException("Failed to obtain access token: " + e.getMessage(),
                    0, "AUTH_FAILED", ErrorType.CONFIGURATION_ERROR, e);
        }
        Map<String, String> headers = new HashMap<>();
        headers.put("Authorization", "Bearer " + token);
        headers.put("developer-token", developerToken);
        if (loginCustomerId != null) {
            headers.put("login-customer-id", loginCustomerId);
        }
        return TransportRequest.postJson(uri, json, headers, requestTimeout);
    }

    private <T> T executeWithRetry(URI uri, String json, Class<T> responseClass) {
        Exception lastException = null;
        boolean tokenRefreshed = false;
        int attempt = 0;

        while (attempt <= maxRetries) {
            try {
                if (attempt > 0) {
                    log.debug("Retry attempt {} for {}", attempt, uri);
                    Thread.sleep(retryDelay.toMillis() * attempt);
                }

                TransportResponse response = transport.send(buildRequest(uri, json));
                int status = response.getStatusCode();
                String responseBody = response.getBody();

                if (response.isSuccessful()) {
                    return readResponse(uri, responseBody, responseClass);
                } else if (status == 401 && !tokenRefreshed) {
                    // stale token: refresh once without spending a retry
                    log.debug("Access token rejected by {}, refreshing", uri);
                    tokenProvider.invalidateToken();
                    tokenRefreshed = true;
                    continue;
                } else if ((status >= 500 || status == 429) && attempt < maxRetries) {
                    lastException = new ConversionLogException(
                            status == 429 ? "Rate limited" : "Server error: " + status,
                            status,
                            status == 429 ? "RATE_LIMITED" : null);
                } else {
                    throw new ConversionLogException(
                            "API error: " + status + " - " + responseBody,
                            status,
                            extractErrorCode(responseBody),
                            status == 401 || status == 403 ? ErrorType.CONFIGURATION_ERROR : ErrorType.TRACKING_FAILURE,
                            null);
                }
            } catch (ConversionLogException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConversionLogException("Interrupted while uploading conversions", e);
            } catch (Exception e) {
                lastException = e;
                log.debug("Upload attempt {} to {} failed: {}", attempt, uri,
                        ConversionLogUtils.getRootCauseMessage(e));
            }
            attempt++;
        }

        throw new ConversionLogException("Request failed after " + maxRetries + " retries", 0,
                null, ErrorType.NETWORK_ERROR, lastException);
    }

    private <T> T readResponse(URI uri, String responseBody, Class<T> responseClass) {
        try {
            return objectMapper.readValue(responseBody, responseClass);
        } catch (IOException e) {
            throw new ConversionLogException("Malformed response from " + uri, e);
        }
    }

    private String extractErrorCode(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            JsonNode error = node.get("error");
            if (error == null) {
                return null;
            }
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.has("status")) {
                return error.get("status").asText();
            }
        } catch (IOException e) {
            log.debug("Error response is not JSON: {}", e.getMessage());
        }
        return null;
    }

    private static String stripDashes(String id) {
        return id != null ? id.replace("-", "") : null;
    }

    @Override
    public void close() {
        log.debug("AdPlatformClient closed");
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String apiVersion = DEFAULT_API_VERSION;
        private String customerId;
        private String loginCustomerId;
        private String developerToken;
        private TokenProvider tokenProvider;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int maxRetries = 2;
        private Duration retryDelay = Duration.ofMillis(500);
        private ObjectMapper objectMapper;
        private HttpClient httpClient;
        private ConversionTransport transport;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        /**
         * Platform customer (account) id, dashes allowed (required)
         */
        public Builder customerId(String customerId) {
            this.customerId = customerId;
            return this;
        }

        /**
         * Manager account id when uploading through a manager account
         */
        public Builder loginCustomerId(String loginCustomerId) {
            this.loginCustomerId = loginCustomerId;
            return this;
        }

        public Builder developerToken(String developerToken) {
            this.developerToken = developerToken;
            return this;
        }

        public Builder tokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = tokenProvider;
            return this;
        }

        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        /**
         * Maximum retries for 5xx and 429 responses (default: 2)
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Base delay between retries, multiplied by the attempt number (default: 500ms)
         */
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Provide a custom transport (overrides any HttpClient settings)
         */
        public Builder transport(ConversionTransport transport) {
            this.transport = transport;
            return this;
        }

        public AdPlatformClient build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalStateException("baseUrl is required");
            }
            if (customerId == null || customerId.isBlank()) {
                throw new IllegalStateException("customerId is required");
            }
            if (developerToken == null || developerToken.isBlank()) {
                throw new IllegalStateException("developerToken is required");
            }
            if (tokenProvider == null) {
                throw new IllegalStateException("tokenProvider is required");
            }
            if (maxRetries < 0) {
                throw new IllegalStateException("maxRetries must be >= 0");
            }
            return new AdPlatformClient(this);
        }
    }
}
