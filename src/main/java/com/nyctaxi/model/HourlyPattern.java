package com.nyctaxi.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Report row of the hourly pattern analysis.
 * Averages are taken over the trips picked up during the hour.
 */
@JsonPropertyOrder({"hour", "trip_count", "avg_distance", "avg_fare", "avg_duration"})
public record HourlyPattern(
        @JsonProperty("hour") int hour,
        @JsonProperty("trip_count") long tripCount,
        @JsonProperty("avg_distance") double avgDistance,
        @JsonProperty("avg_fare") double avgFare,
        @JsonProperty("avg_duration") double avgDuration
) {
}
