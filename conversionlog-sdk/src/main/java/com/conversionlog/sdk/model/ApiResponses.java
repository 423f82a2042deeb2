package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response models for the advertising platform API
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    /**
     * Response from the conversion upload endpoint.
     *
     * <p>With partial failure enabled the call returns 200 even when rows are rejected;
     * rejected rows are reported in {@code partial_failure_error}.</p>
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UploadConversionsResponse {
        @JsonProperty("results")
        public List<Map<String, Object>> results;

        @JsonProperty("partial_failure_error")
        public PartialFailureError partialFailureError;

        @JsonProperty("job_id")
        public String jobId;

        public boolean hasPartialFailure() {
            return partialFailureError != null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PartialFailureError {
        @JsonProperty("code")
        public Integer code;

        @JsonProperty("message")
        public String message;

        @JsonProperty("details")
        public List<Map<String, Object>> details;
    }
}
