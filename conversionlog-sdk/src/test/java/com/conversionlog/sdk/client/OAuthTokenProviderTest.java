package com.conversionlog.sdk.client;

import com.conversionlog.sdk.client.OAuthTokenProvider.OAuthException;
import com.conversionlog.sdk.util.MutableClock;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OAuthTokenProviderTest {

    @SuppressWarnings("unchecked")
    private HttpClient mockHttpClient(int statusCode, String body) throws Exception {
        HttpClient httpClient = mock(HttpClient.class);
        HttpResponse<String> httpResponse = mock(HttpResponse.class);
        when(httpResponse.statusCode()).thenReturn(statusCode);
        when(httpResponse.body()).thenReturn(body);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(httpResponse);
        return httpClient;
    }

    private OAuthTokenProvider.Builder provider(HttpClient httpClient) {
        return OAuthTokenProvider.builder()
                .tokenUrl("https://auth.test/token")
                .clientId("client-id")
                .clientSecret("client-secret")
                .refreshToken("refresh-token")
                .httpClient(httpClient);
    }

    @Test
    void getTokenFetchesAndCachesToken() throws Exception {
        HttpClient httpClient = mockHttpClient(200, "{\"access_token\":\"tok-123\",\"expires_in\":3600}");
        OAuthTokenProvider provider = provider(httpClient).build();

        assertEquals("tok-123", provider.getToken());
        assertEquals("tok-123", provider.getToken());

        verify(httpClient, times(1)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void requestUsesRefreshTokenGrant() throws Exception {
        HttpClient httpClient = mockHttpClient(200, "{\"access_token\":\"tok\",\"expires_in\":3600}");
        provider(httpClient).build().getToken();

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        HttpRequest request = captor.getValue();
        assertEquals("POST", request.method());
        assertEquals("https://auth.test/token", request.uri().toString());
        assertEquals("application/x-www-form-urlencoded",
                request.headers().firstValue("Content-Type").orElse(null));
    }

    @Test
    void refreshesWhenWithinBufferOfExpiry() throws Exception {
        HttpClient httpClient = mockHttpClient(200, "{\"access_token\":\"tok\",\"expires_in\":120}");
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        OAuthTokenProvider provider = provider(httpClient)
                .refreshBuffer(Duration.ofSeconds(60))
                .clock(clock)
                .build();

        provider.getToken();
        clock.advance(Duration.ofSeconds(30));
        provider.getToken();
        verify(httpClient, times(1)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));

        clock.advance(Duration.ofSeconds(40));
        provider.getToken();
        verify(httpClient, times(2)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void invalidateTokenForcesRefresh() throws Exception {
        HttpClient httpClient = mockHttpClient(200, "{\"access_token\":\"tok-first\",\"expires_in\":3600}");
        OAuthTokenProvider provider = provider(httpClient).build();
        assertEquals("tok-first", provider.getToken());

        @SuppressWarnings("unchecked")
        HttpResponse<String> secondResponse = mock(HttpResponse.class);
        when(secondResponse.statusCode()).thenReturn(200);
        when(secondResponse.body()).thenReturn("{\"access_token\":\"tok-second\",\"expires_in\":3600}");
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(secondResponse);

        provider.invalidateToken();
        assertEquals("tok-second", provider.getToken());
        verify(httpClient, times(2)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void fetchTokenThrowsOnNon200Status() throws Exception {
        OAuthTokenProvider provider = provider(mockHttpClient(400, "{\"error\":\"invalid_grant\"}")).build();

        OAuthException ex = assertThrows(OAuthException.class, provider::getToken);
        assertTrue(ex.getMessage().contains("400"));
    }

    @Test
    void fetchTokenThrowsOnMissingAccessToken() throws Exception {
        OAuthTokenProvider provider = provider(mockHttpClient(200, "{\"expires_in\":3600}")).build();

        OAuthException ex = assertThrows(OAuthException.class, provider::getToken);
        assertTrue(ex.getMessage().contains("access_token"));
    }

    @Test
    void builderRequiresCredentials() {
        assertThrows(IllegalStateException.class, () -> OAuthTokenProvider.builder()
                .clientId("id").clientSecret("secret").build());
        assertThrows(IllegalStateException.class, () -> OAuthTokenProvider.builder()
                .clientId("id").refreshToken("refresh").build());
    }
}
