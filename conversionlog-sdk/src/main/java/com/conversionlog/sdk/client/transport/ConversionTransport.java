package com.conversionlog.sdk.client.transport;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP seam for every outbound call the SDK makes: platform uploads, collector sinks and alert webhooks.
 */
public interface ConversionTransport {
    TransportResponse send(TransportRequest request) throws Exception;

    CompletableFuture<TransportResponse> sendAsync(TransportRequest request);
}
