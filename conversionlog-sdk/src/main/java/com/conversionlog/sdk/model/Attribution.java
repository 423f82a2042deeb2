package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Click identifiers and campaign context attached to a conversion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attribution {

    @JsonProperty("gclid")
    private String gclid;

    @JsonProperty("wbraid")
    private String wbraid;

    @JsonProperty("gbraid")
    private String gbraid;

    @JsonProperty("source")
    private String source;

    @JsonProperty("medium")
    private String medium;

    @JsonProperty("campaign")
    private String campaign;

    // Default constructor for Jackson
    public Attribution() {
    }

    private Attribution(Builder builder) {
        this.gclid = builder.gclid;
        this.wbraid = builder.wbraid;
        this.gbraid = builder.gbraid;
        this.source = builder.source;
        this.medium = builder.medium;
        this.campaign = builder.campaign;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getGclid() { return gclid; }
    public String getWbraid() { return wbraid; }
    public String getGbraid() { return gbraid; }
    public String getSource() { return source; }
    public String getMedium() { return medium; }
    public String getCampaign() { return campaign; }

    @JsonIgnore
    public boolean hasClickId() {
        return gclid != null || wbraid != null || gbraid != null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !hasClickId() && source == null && medium == null && campaign == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Attribution that = (Attribution) o;
        return Objects.equals(gclid, that.gclid) &&
               Objects.equals(wbraid, that.wbraid) &&
               Objects.equals(gbraid, that.gbraid) &&
               Objects.equals(source, that.source) &&
               Objects.equals(medium, that.medium) &&
               Objects.equals(campaign, that.campaign);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gclid, wbraid, gbraid, source, medium, campaign);
    }

    @Override
    public String toString() {
        return "Attribution{gclid='" + gclid + "', wbraid='" + wbraid + "', gbraid='" + gbraid +
                "', source='" + source + "', medium='" + medium + "', campaign='" + campaign + "'}";
    }

    public static class Builder {
        private String gclid;
        private String wbraid;
        private String gbraid;
        private String source;
        private String medium;
        private String campaign;

        public Builder gclid(String gclid) {
            this.gclid = gclid;
            return this;
        }

        public Builder wbraid(String wbraid) {
            this.wbraid = wbraid;
            return this;
        }

        public Builder gbraid(String gbraid) {
            this.gbraid = gbraid;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder medium(String medium) {
            this.medium = medium;
            return this;
        }

        public Builder campaign(String campaign) {
            this.campaign = campaign;
            return this;
        }

        public Attribution build() {
            return new Attribution(this);
        }
    }
}
