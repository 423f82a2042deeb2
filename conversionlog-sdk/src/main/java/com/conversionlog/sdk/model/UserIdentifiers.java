package com.conversionlog.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SHA-256 hashed customer identifiers for enhanced conversions.
 *
 * <p>Every value is a 64 character lower-case hex digest. Raw identifiers are hashed
 * with {@link com.conversionlog.sdk.hashing.IdentifierHasher} before they reach this class.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserIdentifiers {

    @JsonProperty("hashed_email")
    private String hashedEmail;

    @JsonProperty("hashed_phone_number")
    private String hashedPhoneNumber;

    @JsonProperty("hashed_first_name")
    private String hashedFirstName;

    @JsonProperty("hashed_last_name")
    private String hashedLastName;

    @JsonProperty("hashed_street_address")
    private String hashedStreetAddress;

    @JsonProperty("hashed_city")
    private String hashedCity;

    @JsonProperty("hashed_region")
    private String hashedRegion;

    @JsonProperty("hashed_postal_code")
    private String hashedPostalCode;

    @JsonProperty("hashed_country")
    private String hashedCountry;

    // Default constructor for Jackson
    public UserIdentifiers() {
    }

    private UserIdentifiers(Builder builder) {
        this.hashedEmail = builder.hashedEmail;
        this.hashedPhoneNumber = builder.hashedPhoneNumber;
        this.hashedFirstName = builder.hashedFirstName;
        this.hashedLastName = builder.hashedLastName;
        this.hashedStreetAddress = builder.hashedStreetAddress;
        this.hashedCity = builder.hashedCity;
        this.hashedRegion = builder.hashedRegion;
        this.hashedPostalCode = builder.hashedPostalCode;
        this.hashedCountry = builder.hashedCountry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHashedEmail() { return hashedEmail; }
    public String getHashedPhoneNumber() { return hashedPhoneNumber; }
    public String getHashedFirstName() { return hashedFirstName; }
    public String getHashedLastName() { return hashedLastName; }
    public String getHashedStreetAddress() { return hashedStreetAddress; }
    public String getHashedCity() { return hashedCity; }
    public String getHashedRegion() { return hashedRegion; }
    public String getHashedPostalCode() { return hashedPostalCode; }
    public String getHashedCountry() { return hashedCountry; }

    /**
     * Present values keyed by their wire name, in declaration order.
     */
    @JsonIgnore
    public Map<String, String> asMap() {
        Map<String, String> values = new LinkedHashMap<>();
        putIfPresent(values, "hashed_email", hashedEmail);
        putIfPresent(values, "hashed_phone_number", hashedPhoneNumber);
        putIfPresent(values, "hashed_first_name", hashedFirstName);
        putIfPresent(values, "hashed_last_name", hashedLastName);
        putIfPresent(values, "hashed_street_address", hashedStreetAddress);
        putIfPresent(values, "hashed_city", hashedCity);
        putIfPresent(values, "hashed_region", hashedRegion);
        putIfPresent(values, "hashed_postal_code", hashedPostalCode);
        putIfPresent(values, "hashed_country", hashedCountry);
        return values;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return asMap().isEmpty();
    }

    private static void putIfPresent(Map<String, String> values, String key, String value) {
        if (value != null) {
            values.put(key, value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return asMap().equals(((UserIdentifiers) o).asMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(asMap());
    }

    @Override
    public String toString() {
        return "UserIdentifiers{fields=" + asMap().keySet() + "}";
    }

    public static class Builder {
        private String hashedEmail;
        private String hashedPhoneNumber;
        private String hashedFirstName;
        private String hashedLastName;
        private String hashedStreetAddress;
        private String hashedCity;
        private String hashedRegion;
        private String hashedPostalCode;
        private String hashedCountry;

        public Builder hashedEmail(String hashedEmail) {
            this.hashedEmail = hashedEmail;
            return this;
        }

        public Builder hashedPhoneNumber(String hashedPhoneNumber) {
            this.hashedPhoneNumber = hashedPhoneNumber;
            return this;
        }

        public Builder hashedFirstName(String hashedFirstName) {
            this.hashedFirstName = hashedFirstName;
            return this;
        }

        public Builder hashedLastName(String hashedLastName) {
            this.hashedLastName = hashedLastName;
            return this;
        }

        public Builder hashedStreetAddress(String hashedStreetAddress) {
            this.hashedStreetAddress = hashedStreetAddress;
            return this;
        }

        public Builder hashedCity(String hashedCity) {
            this.hashedCity = hashedCity;
            return this;
        }

        public Builder hashedRegion(String hashedRegion) {
            this.hashedRegion = hashedRegion;
            return this;
        }

        public Builder hashedPostalCode(String hashedPostalCode) {
            this.hashedPostalCode = hashedPostalCode;
            return this;
        }

        public Builder hashedCountry(String hashedCountry) {
            this.hashedCountry = hashedCountry;
            return this;
        }

        public UserIdentifiers build() {
            return new UserIdentifiers(this);
        }
    }
}
