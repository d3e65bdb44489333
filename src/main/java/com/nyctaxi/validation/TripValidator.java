package com.nyctaxi.validation;

import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.model.TaxiTrip;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Record-level data integrity check applied before a trip enters any batch.
 *
 * <p>A trip is rejected when its distance is negative, its vendor is not one
 * of the two TPEP providers, or its total amount is negative. Rejected trips
 * are dropped silently by the batch source; the rejection reason is only
 * available for diagnostics.
 */
public class TripValidator implements Predicate<TaxiTrip> {

    /**
     * Returns {@code true} if the trip passes every rule.
     */
    @Override
    public boolean test(TaxiTrip trip) {
        return rejectionReason(trip).isEmpty();
    }

    /**
     * Checks the trip and throws on the first violated rule.
     *
     * @param trip the trip to check
     * @throws ProcessingException of kind {@code VALIDATION} describing the violation
     */
    public void validate(TaxiTrip trip) throws ProcessingException {
        Optional<String> reason = rejectionReason(trip);
        if (reason.isPresent()) {
            throw ProcessingException.validation(reason.get());
        }
    }

    /**
     * Returns the first rule the trip violates, if any.
     *
     * @param trip the trip to check
     * @return the violation message, or empty for a valid trip
     */
    public Optional<String> rejectionReason(TaxiTrip trip) {
        if (trip.tripDistance() < 0.0) {
            return Optional.of("Trip distance cannot be negative");
        }
        if (trip.vendorId() != 1 && trip.vendorId() != 2) {
            return Optional.of("Invalid vendor ID: " + trip.vendorId());
        }
        if (trip.totalAmount() < 0.0) {
            return Optional.of("Total amount cannot be negative");
        }
        return Optional.empty();
    }
}
