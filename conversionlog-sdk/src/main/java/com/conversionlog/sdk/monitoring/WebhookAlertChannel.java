package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.client.transport.TransportRequest;
import com.conversionlog.sdk.client.transport.TransportResponse;
import com.conversionlog.sdk.exception.ConversionLogException;
import com.conversionlog.sdk.model.Alert;
import com.conversionlog.sdk.model.AlertSeverity;
import com.conversionlog.sdk.util.ConversionLogUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts alerts as JSON to a webhook:
 * <pre>
 * {"alert_type": ..., "severity": ..., "message": ..., "timestamp": epochMillis,
 *  "environment": ..., "service": ..., "data": {...}}
 * </pre>
 */
public class WebhookAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertChannel.class);

    public static final String DEFAULT_SERVICE = "conversion-tracking";

    private final URI webhookUri;
    private final ConversionTransport transport;
    private final ObjectMapper objectMapper;
    private final String environment;
    private final String service;
    private final AlertSeverity minimumSeverity;
    private final Duration timeout;

    private WebhookAlertChannel(Builder builder) {
        this.webhookUri = builder.webhookUri;
        this.transport = builder.transport;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : ConversionLogUtils.defaultObjectMapper();
        this.environment = builder.environment;
        this.service = builder.service;
        this.minimumSeverity = builder.minimumSeverity;
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void send(Alert alert) throws Exception {
        if (!alert.getSeverity().isAtLeast(minimumSeverity)) {
            log.debug("Alert {} below webhook threshold {}", alert.getId(), minimumSeverity.getValue());
            return;
        }
        String json = objectMapper.writeValueAsString(payload(alert));
        TransportResponse response = transport.send(TransportRequest.postJson(webhookUri, json, Map.of(), timeout));
        if (!response.isSuccessful()) {
            throw new ConversionLogException("Alert webhook returned HTTP " + response.getStatusCode(),
                    response.getStatusCode(), "WEBHOOK_REJECTED");
        }
        log.debug("Alert {} forwarded to webhook", alert.getId());
    }

    Map<String, Object> payload(Alert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert_type", alert.getType());
        payload.put("severity", alert.getSeverity().getValue());
        payload.put("message", alert.getMessage());
        payload.put("timestamp", alert.getTimestamp().toEpochMilli());
        payload.put("environment", environment);
        payload.put("service", service);
        payload.put("data", alert.getData());
        return payload;
    }

    public static class Builder {
        private URI webhookUri;
        private ConversionTransport transport;
        private ObjectMapper objectMapper;
        private String environment = "production";
        private String service = DEFAULT_SERVICE;
        private AlertSeverity minimumSeverity = AlertSeverity.LOW;
        private Duration timeout = Duration.ofSeconds(5);

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUri = webhookUrl != null ? URI.create(webhookUrl) : null;
            return this;
        }

        public Builder webhookUri(URI webhookUri) {
            this.webhookUri = webhookUri;
            return this;
        }

        public Builder transport(ConversionTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        /**
         * Alerts below this severity are not forwarded (default: low, i.e. everything)
         */
        public Builder minimumSeverity(AlertSeverity minimumSeverity) {
            this.minimumSeverity = minimumSeverity;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public WebhookAlertChannel build() {
            if (webhookUri == null) {
                throw new IllegalStateException("webhookUrl is required");
            }
            if (transport == null) {
                throw new IllegalStateException("transport is required");
            }
            if (minimumSeverity == null) {
                throw new IllegalStateException("minimumSeverity must not be null");
            }
            return new WebhookAlertChannel(this);
        }
    }
}
