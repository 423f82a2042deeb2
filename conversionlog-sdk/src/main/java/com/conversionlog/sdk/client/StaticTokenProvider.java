package com.conversionlog.sdk.client;

/**
 * Token provider that always returns the same value.
 */
public final class StaticTokenProvider implements TokenProvider {

    private final String token;

    public StaticTokenProvider(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must not be blank");
        }
        this.token = token;
    }

    @Override
    public String getToken() {
        return token;
    }
}
