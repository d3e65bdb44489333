package com.nyctaxi.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The three reports produced by a single pass over the input.
 */
@JsonPropertyOrder({"peak_zones", "hourly_patterns", "payment_analysis"})
public record MultiAnalysisResults(
        @JsonProperty("peak_zones") List<PeakZone> peakZones,
        @JsonProperty("hourly_patterns") List<HourlyPattern> hourlyPatterns,
        @JsonProperty("payment_analysis") List<PaymentStats> paymentAnalysis
) {
    public MultiAnalysisResults {
        peakZones = peakZones != null ? List.copyOf(peakZones) : List.of();
        hourlyPatterns = hourlyPatterns != null ? List.copyOf(hourlyPatterns) : List.of();
        paymentAnalysis = paymentAnalysis != null ? List.copyOf(paymentAnalysis) : List.of();
    }
}
