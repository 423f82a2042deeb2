package com.conversionlog.sdk.client;

/**
 * Supplies bearer tokens for the advertising platform API.
 *
 * <ul>
 *   <li>{@link OAuthTokenProvider} - OAuth 2.0 refresh-token grant with caching</li>
 *   <li>{@link StaticTokenProvider} - fixed token (for development/testing)</li>
 * </ul>
 */
@FunctionalInterface
public interface TokenProvider {

    /**
     * @return A valid bearer token (without "Bearer " prefix)
     * @throws RuntimeException if token cannot be obtained
     */
    String getToken();

    /**
     * Drop any cached token so the next {@link #getToken()} fetches a fresh one.
     * Called after the platform rejects a token with 401.
     */
    default void invalidateToken() {
    }

    static TokenProvider of(String token) {
        return new StaticTokenProvider(token);
    }
}
