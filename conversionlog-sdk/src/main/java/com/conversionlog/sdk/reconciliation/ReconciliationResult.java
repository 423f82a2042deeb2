package com.conversionlog.sdk.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Outcome of reconciling the attempt log against eligible bookings over a date range.
 */
public final class ReconciliationResult {

    private final String dateRange;
    private final int totalEligibleBookings;
    private final int clientSideConversions;
    private final int serverSideConversions;
    private final int matchedConversions;
    private final List<Discrepancy> discrepancies;
    private final BigDecimal accuracyPercentage;
    private final BigDecimal agreementPercentage;

    public ReconciliationResult(String dateRange, int totalEligibleBookings, int clientSideConversions,
                                int serverSideConversions, int matchedConversions, List<Discrepancy> discrepancies) {
        this.dateRange = dateRange;
        this.totalEligibleBookings = totalEligibleBookings;
        this.clientSideConversions = clientSideConversions;
        this.serverSideConversions = serverSideConversions;
        this.matchedConversions = matchedConversions;
        this.discrepancies = List.copyOf(discrepancies);
        this.accuracyPercentage = percentage(Math.max(clientSideConversions, serverSideConversions), totalEligibleBookings);
        this.agreementPercentage = percentage(matchedConversions, totalEligibleBookings);
    }

    /**
     * {@code part / total * 100} rounded half-up to two decimals; zero when total is zero
     */
    static BigDecimal percentage(int part, int total) {
        if (total == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(part)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }

    @JsonProperty("date_range")
    public String getDateRange() {
        return dateRange;
    }

    @JsonProperty("total_eligible_bookings")
    public int getTotalEligibleBookings() {
        return totalEligibleBookings;
    }

    @JsonProperty("client_side_conversions")
    public int getClientSideConversions() {
        return clientSideConversions;
    }

    @JsonProperty("server_side_conversions")
    public int getServerSideConversions() {
        return serverSideConversions;
    }

    @JsonProperty("matched_conversions")
    public int getMatchedConversions() {
        return matchedConversions;
    }

    @JsonProperty("discrepancies")
    public List<Discrepancy> getDiscrepancies() {
        return discrepancies;
    }

    /**
     * Share of eligible bookings reported by the better of the two paths
     */
    @JsonProperty("accuracy_percentage")
    public BigDecimal getAccuracyPercentage() {
        return accuracyPercentage;
    }

    /**
     * Share of eligible bookings reported by both paths
     */
    @JsonProperty("agreement_percentage")
    public BigDecimal getAgreementPercentage() {
        return agreementPercentage;
    }

    public boolean hasDiscrepancy(DiscrepancyType type) {
        return discrepancies.stream().anyMatch(d -> d.type() == type);
    }

    @Override
    public String toString() {
        return "ReconciliationResult{dateRange='" + dateRange + "', total=" + totalEligibleBookings
                + ", client=" + clientSideConversions + ", server=" + serverSideConversions
                + ", matched=" + matchedConversions + ", accuracy=" + accuracyPercentage
                + "%, discrepancies=" + discrepancies.size() + "}";
    }
}
