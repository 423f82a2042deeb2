package com.conversionlog.sdk.reconciliation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A booking whose client and server paths did not both succeed.
 */
public record Discrepancy(
        @JsonProperty("booking_id") String bookingId,
        @JsonProperty("client_tracked") boolean clientTracked,
        @JsonProperty("server_tracked") boolean serverTracked,
        @JsonIgnore DiscrepancyType type) {

    @JsonProperty("issue")
    public String issue() {
        return type.getIssue();
    }
}
