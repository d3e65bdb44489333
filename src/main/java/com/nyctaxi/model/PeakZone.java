package com.nyctaxi.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Report row of the peak zone analysis: revenue of one zone during one hour of the day.
 *
 * @param zoneName name of the zone, see {@link com.nyctaxi.geo.ZoneClassifier}
 * @param hour hour of the day (0-23)
 * @param tripCount number of trips picked up in this zone during the hour
 * @param totalRevenue sum of total amounts
 * @param avgFare average fare amount
 * @param centerLat mean pickup latitude of the trips
 * @param centerLng mean pickup longitude of the trips
 */
@JsonPropertyOrder({"zone_name", "hour", "trip_count", "total_revenue", "avg_fare", "center_lat", "center_lng"})
public record PeakZone(
        @JsonProperty("zone_name") String zoneName,
        @JsonProperty("hour") int hour,
        @JsonProperty("trip_count") long tripCount,
        @JsonProperty("total_revenue") double totalRevenue,
        @JsonProperty("avg_fare") double avgFare,
        @JsonProperty("center_lat") double centerLat,
        @JsonProperty("center_lng") double centerLng
) {
}
