package com.conversionlog.sdk.client.transport;

public final class TransportResponse {
    private final int statusCode;
    private final String body;

    public TransportResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
