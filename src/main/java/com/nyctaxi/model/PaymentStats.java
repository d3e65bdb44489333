package com.nyctaxi.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Report row of the payment analysis.
 *
 * @param paymentType 1=Credit card, 2=Cash, 3=No charge, 4=Dispute, 5=Unknown, 6=Voided trip
 * @param tripCount number of trips paid this way
 * @param totalAmount total amount charged
 * @param avgAmount average amount charged per trip
 * @param percentage share of trips relative to all valid trips
 */
@JsonPropertyOrder({"payment_type", "trip_count", "total_amount", "avg_amount", "percentage"})
public record PaymentStats(
        @JsonProperty("payment_type") int paymentType,
        @JsonProperty("trip_count") long tripCount,
        @JsonProperty("total_amount") double totalAmount,
        @JsonProperty("avg_amount") double avgAmount,
        @JsonProperty("percentage") double percentage
) {
}
