package com.conversionlog.sdk.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * OAuth 2.0 token provider for the advertising platform, using the refresh-token grant
 *
 * <p>Exchanges a long-lived refresh token for short-lived access tokens. Tokens are cached
 * and refreshed {@code refreshBuffer} before they expire.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * OAuthTokenProvider tokenProvider = OAuthTokenProvider.builder()
 *     .clientId("your-client-id")
 *     .clientSecret("your-client-secret")
 *     .refreshToken("your-refresh-token")
 *     .build();
 *
 * AdPlatformClient client = AdPlatformClient.builder()
 *     .customerId("1234567890")
 *     .developerToken("dev-token")
 *     .tokenProvider(tokenProvider)
 *     .build();
 * }</pre>
 *
 * <h2>Thread Safety:</h2>
 * <p>Fully thread-safe. Concurrent callers that find the cache stale block on a single refresh
 * instead of each issuing their own token request.</p>
 */
public class OAuthTokenProvider implements TokenProvider {

    private static final Logger log = LoggerFactory.getLogger(OAuthTokenProvider.class);

    public static final String DEFAULT_TOKEN_URL = "https://oauth2.googleapis.com/token";
    private static final int DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String refreshToken;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration refreshBuffer;
    private final Duration requestTimeout;
    private final Clock clock;

    // Token cache
    private volatile CachedToken cachedToken;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private OAuthTokenProvider(Builder builder) {
        this.tokenUrl = builder.tokenUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.refreshToken = builder.refreshToken;
        this.refreshBuffer = builder.refreshBuffer;
        this.requestTimeout = builder.requestTimeout;
        this.clock = builder.clock;
        this.objectMapper = builder.objectMapper != null
                ? builder.objectMapper
                : new ObjectMapper();
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder()
                    .connectTimeout(builder.connectTimeout)
                    .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // TokenProvider Interface
    // ========================================================================

    /**
     * Get a valid access token, refreshing if necessary
     *
     * @return Valid access token
     * @throws OAuthException if token cannot be obtained
     */
    @Override
    public String getToken() {
        lock.readLock().lock();
        try {
            if (cachedToken != null && !cachedToken.isExpired(clock, refreshBuffer)) {
                return cachedToken.accessToken;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // another thread may have refreshed while we waited
            if (cachedToken != null && !cachedToken.isExpired(clock, refreshBuffer)) {
                return cachedToken.accessToken;
            }

            log.debug("Refreshing OAuth access token from {}", tokenUrl);
            cachedToken = fetchToken();
            log.info("OAuth access token refreshed, expires in {} seconds", cachedToken.expiresInSeconds(clock));

            return cachedToken.accessToken;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Force refresh on next use (called after a 401 from the platform)
     */
    @Override
    public void invalidateToken() {
        lock.writeLock().lock();
        try {
            cachedToken = null;
            log.debug("OAuth access token invalidated");
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Token Fetching
    // ========================================================================

    private CachedToken fetchToken() {
        try {
            String body = "grant_type=refresh_token" +
                    "&client_id=" + encode(clientId) +
                    "&client_secret=" + encode(clientSecret) +
                    "&refresh_token=" + encode(refreshToken);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(tokenUrl))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .header("Accept", "application/json")
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new OAuthException("Token request failed: " + response.statusCode() +
                        " - " + response.body());
            }

            TokenResponse tokenResponse = objectMapper.readValue(response.body(), TokenResponse.class);

            if (tokenResponse.accessToken == null || tokenResponse.accessToken.isBlank()) {
                throw new OAuthException("Token response missing access_token");
            }

            int expiresIn = tokenResponse.expiresIn != null ? tokenResponse.expiresIn : DEFAULT_EXPIRES_IN_SECONDS;
            Instant expiresAt = clock.instant().plusSeconds(expiresIn);

            return new CachedToken(tokenResponse.accessToken, expiresAt);

        } catch (OAuthException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OAuthException("Interrupted while fetching OAuth token", e);
        } catch (Exception e) {
            throw new OAuthException("Failed to fetch OAuth token: " + e.getMessage(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Supporting Classes
    // ========================================================================

    private static class CachedToken {
        final String accessToken;
        final Instant expiresAt;

        CachedToken(String accessToken, Instant expiresAt) {
            this.accessToken = accessToken;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Clock clock, Duration buffer) {
            return clock.instant().plus(buffer).isAfter(expiresAt);
        }

        long expiresInSeconds(Clock clock) {
            return Duration.between(clock.instant(), expiresAt).toSeconds();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class TokenResponse {
        @JsonProperty("access_token")
        String accessToken;

        @JsonProperty("token_type")
        String tokenType;

        @JsonProperty("expires_in")
        Integer expiresIn;

        @JsonProperty("scope")
        String scope;
    }

    /**
     * Exception thrown when OAuth token operations fail
     */
    public static class OAuthException extends RuntimeException {
        public OAuthException(String message) {
            super(message);
        }

        public OAuthException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private String tokenUrl = DEFAULT_TOKEN_URL;
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private Duration refreshBuffer = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private ObjectMapper objectMapper;
        private HttpClient httpClient;
        private Clock clock = Clock.systemUTC();

        /**
         * OAuth token endpoint URL (default: Google OAuth token endpoint)
         */
        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        /**
         * Long-lived refresh token exchanged for access tokens (required)
         */
        public Builder refreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        /**
         * How early to refresh token before expiry (default: 60 seconds)
         */
        public Builder refreshBuffer(Duration refreshBuffer) {
            this.refreshBuffer = refreshBuffer;
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

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Provide a pre-configured HttpClient (connectTimeout will be ignored if set)
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public OAuthTokenProvider build() {
            if (tokenUrl == null || tokenUrl.isBlank()) {
                throw new IllegalStateException("tokenUrl is required");
            }
            if (clientId == null || clientId.isBlank()) {
                throw new IllegalStateException("clientId is required");
            }
            if (clientSecret == null || clientSecret.isBlank()) {
                throw new IllegalStateException("clientSecret is required");
            }
            if (refreshToken == null || refreshToken.isBlank()) {
                throw new IllegalStateException("refreshToken is required");
            }
            if (clock == null) {
                throw new IllegalStateException("clock must not be null");
            }
            return new OAuthTokenProvider(this);
        }
    }
}
