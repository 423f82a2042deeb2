package com.conversionlog.sdk.reconciliation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a booking's two delivery paths disagree.
 */
public enum DiscrepancyType {
    NO_TRACKING("No conversion tracking found for successful booking"),
    SERVER_BACKUP_MISSING("Client-side tracked but server-side backup missing"),
    CLIENT_TRACKING_FAILED("Server-side backup fired but client-side tracking failed");

    private final String issue;

    DiscrepancyType(String issue) {
        this.issue = issue;
    }

    @JsonValue
    public String getIssue() {
        return issue;
    }

    /**
     * @return the type for the given outcome, or {@code null} when both paths succeeded
     */
    static DiscrepancyType classify(boolean clientTracked, boolean serverTracked) {
        if (clientTracked && serverTracked) {
            return null;
        }
        if (clientTracked) {
            return SERVER_BACKUP_MISSING;
        }
        return serverTracked ? CLIENT_TRACKING_FAILED : NO_TRACKING;
    }
}
