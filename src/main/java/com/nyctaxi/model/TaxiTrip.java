package com.nyctaxi.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single yellow-taxi trip record as published by the NYC TLC.
 * This is the entity type that is streamed out of the CSV input files.
 *
 * <p>Timestamps are the wall-clock times recorded by the meter; no time zone
 * conversion is applied.
 *
 * @param vendorId TPEP provider, either Creative Mobile Technologies (1) or VeriFone Inc. (2)
 * @param pickupDatetime time when the meter was engaged
 * @param dropoffDatetime time when the meter was disengaged
 * @param passengerCount number of passengers, {@code null} when not recorded
 * @param tripDistance elapsed trip distance in miles
 * @param pickupLongitude longitude where the meter was engaged
 * @param pickupLatitude latitude where the meter was engaged
 * @param rateCodeId final rate code in effect at the end of the trip
 * @param storeAndFwdFlag whether the record was held in vehicle memory, {@code null} when absent
 * @param dropoffLongitude longitude where the meter was disengaged
 * @param dropoffLatitude latitude where the meter was disengaged
 * @param paymentType 1=Credit card, 2=Cash, 3=No charge, 4=Dispute, 5=Unknown, 6=Voided trip
 * @param fareAmount time-and-distance fare calculated by the meter
 * @param extra rush hour and overnight charges
 * @param mtaTax MTA tax triggered by the metered rate in use
 * @param tipAmount tip amount, credit card tips only
 * @param tollsAmount total tolls paid in the trip
 * @param improvementSurcharge improvement surcharge, {@code null} for older files
 * @param totalAmount total amount charged to the passenger, cash tips excluded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaxiTrip(
        int vendorId,
        LocalDateTime pickupDatetime,
        LocalDateTime dropoffDatetime,
        Integer passengerCount,
        double tripDistance,
        double pickupLongitude,
        double pickupLatitude,
        int rateCodeId,
        String storeAndFwdFlag,
        double dropoffLongitude,
        double dropoffLatitude,
        int paymentType,
        double fareAmount,
        double extra,
        double mtaTax,
        double tipAmount,
        double tollsAmount,
        Double improvementSurcharge,
        double totalAmount
) {
    public static final String DATE_TIME_PATTERN = "yyyy-MM-dd HH:mm:ss";

    @JsonCreator
    public TaxiTrip(
            @JsonProperty("VendorID") int vendorId,
            @JsonProperty("tpep_pickup_datetime")
            @JsonFormat(pattern = DATE_TIME_PATTERN) LocalDateTime pickupDatetime,
            @JsonProperty("tpep_dropoff_datetime")
            @JsonFormat(pattern = DATE_TIME_PATTERN) LocalDateTime dropoffDatetime,
            @JsonProperty("passenger_count") Integer passengerCount,
            @JsonProperty("trip_distance") double tripDistance,
            @JsonProperty("pickup_longitude") double pickupLongitude,
            @JsonProperty("pickup_latitude") double pickupLatitude,
            @JsonProperty("RateCodeID") @JsonAlias("RatecodeID") int rateCodeId,
            @JsonProperty("store_and_fwd_flag") String storeAndFwdFlag,
            @JsonProperty("dropoff_longitude") double dropoffLongitude,
            @JsonProperty("dropoff_latitude") double dropoffLatitude,
            @JsonProperty("payment_type") int paymentType,
            @JsonProperty("fare_amount") double fareAmount,
            @JsonProperty("extra") double extra,
            @JsonProperty("mta_tax") double mtaTax,
            @JsonProperty("tip_amount") double tipAmount,
            @JsonProperty("tolls_amount") double tollsAmount,
            @JsonProperty("improvement_surcharge") Double improvementSurcharge,
            @JsonProperty("total_amount") double totalAmount
    ) {
        this.vendorId = vendorId;
        this.pickupDatetime = Objects.requireNonNull(pickupDatetime, "pickupDatetime must not be null");
        this.dropoffDatetime = Objects.requireNonNull(dropoffDatetime, "dropoffDatetime must not be null");
        this.passengerCount = passengerCount;
        this.tripDistance = tripDistance;
        this.pickupLongitude = pickupLongitude;
        this.pickupLatitude = pickupLatitude;
        this.rateCodeId = rateCodeId;
        this.storeAndFwdFlag = storeAndFwdFlag;
        this.dropoffLongitude = dropoffLongitude;
        this.dropoffLatitude = dropoffLatitude;
        this.paymentType = paymentType;
        this.fareAmount = fareAmount;
        this.extra = extra;
        this.mtaTax = mtaTax;
        this.tipAmount = tipAmount;
        this.tollsAmount = tollsAmount;
        this.improvementSurcharge = improvementSurcharge;
        this.totalAmount = totalAmount;
    }
}
