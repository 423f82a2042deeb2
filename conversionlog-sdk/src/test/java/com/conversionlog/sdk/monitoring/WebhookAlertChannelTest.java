package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.client.SequencedTransport;
import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.client.transport.TransportResponse;
import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.model.AlertSeverity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAlertChannelTest {

    private static final Instant AT = Instant.parse("2024-05-01T00:00:00Z");

    private static Alert alert(AlertSeverity severity) {
        return new Alert("alert_1", "tracking_error", severity, "Tracking error: boom", AT, Map.of("booking_id", "B1"));
    }

    @Test
    void postsAlertPayload() throws Exception {
        SequencedTransport transport = new SequencedTransport(new TransportResponse(204, ""));
        WebhookAlertChannel channel = WebhookAlertChannel.builder()
                .webhookUrl("https://hooks.test/alerts")
                .transport(transport)
                .environment("staging")
                .build();

        channel.send(alert(AlertSeverity.HIGH));

        TransportRequest request = transport.getRequests().get(0);
        assertEquals("https://hooks.test/alerts", request.getUri().toString());
        assertEquals("POST", request.getMethod());
        assertTrue(request.getBody().contains("\"alert_type\":\"tracking_error\""));
        assertTrue(request.getBody().contains("\"severity\":\"high\""));
        assertTrue(request.getBody().contains("\"timestamp\":" + AT.toEpochMilli()));
        assertTrue(request.getBody().contains("\"environment\":\"staging\""));
        assertTrue(request.getBody().contains("\"service\":\"conversion-tracking\""));
        assertTrue(request.getBody().contains("\"booking_id\":\"B1\""));
    }

    @Test
    void payloadFieldOrder() {
        WebhookAlertChannel channel = WebhookAlertChannel.builder()
                .webhookUrl("https://hooks.test/alerts")
                .transport(new SequencedTransport())
                .build();

        Map<String, Object> payload = channel.payload(alert(AlertSeverity.LOW));

        assertEquals(List.of("alert_type", "severity", "message", "timestamp", "environment", "service", "data"),
                List.copyOf(payload.keySet()));
        assertEquals("production", payload.get("environment"));
    }

    @Test
    void alertsBelowMinimumSeverityAreNotSent() throws Exception {
        SequencedTransport transport = new SequencedTransport();
        WebhookAlertChannel channel = WebhookAlertChannel.builder()
                .webhookUrl("https://hooks.test/alerts")
                .transport(transport)
                .minimumSeverity(AlertSeverity.HIGH)
                .build();

        channel.send(alert(AlertSeverity.MEDIUM));

        assertEquals(0, transport.getRequestCount());
    }

    @Test
    void rejectedWebhookThrows() {
        WebhookAlertChannel channel = WebhookAlertChannel.builder()
                .webhookUrl("https://hooks.test/alerts")
                .transport(new SequencedTransport(new TransportResponse(500, "oops")))
                .build();

        ConversionLogException e = assertThrows(ConversionLogException.class, () -> channel.send(alert(AlertSeverity.CRITICAL)));
        assertEquals(500, e.getStatusCode());
        assertEquals("WEBHOOK_REJECTED", e.getErrorCode());
    }

    @Test
    void builderRequiresUrlAndTransport() {
        assertThrows(IllegalStateException.class, () -> WebhookAlertChannel.builder()
                .transport(new SequencedTransport()).build());
        assertThrows(IllegalStateException.class, () -> WebhookAlertChannel.builder()
                .webhookUrl("https://hooks.test/alerts").build());
    }
}
