package com.nyctaxi.util;

import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.model.TaxiTrip;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Derived per-trip values shared by the aggregators.
 */
public final class TripMetrics {

    private static final DateTimeFormatter TLC_FORMAT = DateTimeFormatter.ofPattern(TaxiTrip.DATE_TIME_PATTERN);

    private TripMetrics() {
    }

    /**
     * Parses a timestamp in NYC TLC format ({@code yyyy-MM-dd HH:mm:ss}).
     *
     * @param value the timestamp text
     * @return the parsed wall-clock time
     * @throws ProcessingException of kind {@code VALIDATION} if the text does not match the format
     */
    public static LocalDateTime parseDateTime(String value) throws ProcessingException {
        try {
            return LocalDateTime.parse(value, TLC_FORMAT);
        } catch (DateTimeParseException e) {
            throw ProcessingException.validation("Invalid datetime format: " + value);
        }
    }

    public static int hourOfDay(TaxiTrip trip) {
        return trip.pickupDatetime().getHour();
    }

    /**
     * Day of week of the pickup, 0 for Monday through 6 for Sunday.
     */
    public static int dayOfWeek(TaxiTrip trip) {
        return trip.pickupDatetime().getDayOfWeek().getValue() - 1;
    }

    /**
     * Whole minutes between pickup and dropoff, truncated toward zero.
     * Negative when the dropoff is recorded before the pickup.
     */
    public static long durationMinutes(TaxiTrip trip) {
        return Duration.between(trip.pickupDatetime(), trip.dropoffDatetime()).toMinutes();
    }

    /**
     * Morning (7-9) and evening (17-19) rush hours, inclusive.
     */
    public static boolean isPeakHour(int hour) {
        return (hour >= 7 && hour <= 9) || (hour >= 17 && hour <= 19);
    }

    /**
     * Rounds half away from zero to two decimal places.
     */
    public static double roundTo2Decimals(double value) {
        return Math.signum(value) * Math.round(Math.abs(value) * 100.0) / 100.0;
    }
}
