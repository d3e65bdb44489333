package com.nyctaxi.aggregation;

import com.nyctaxi.model.PaymentStats;
import com.nyctaxi.model.TaxiTrip;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.nyctaxi.util.TripMetrics.roundTo2Decimals;

/**
 * Analyzes trip counts and amounts per payment type (credit card, cash, etc.)
 * and each type's share of all valid trips.
 *
 * <p>Trips with a non-positive payment type or a non-positive total amount are
 * ignored and do not count towards the percentage base either.
 */
public class PaymentAggregator implements BatchAggregator<PaymentAggregator.Accumulator, List<PaymentStats>> {

    /**
     * Running totals of one payment type.
     */
    public static class PaymentTotals {
        private long tripCount;
        private double totalAmount;

        public long getTripCount() {
            return tripCount;
        }

        public double getTotalAmount() {
            return totalAmount;
        }
    }

    /**
     * Mutable per-batch state: totals per payment type plus the number of
     * valid trips, which is the base of the percentage column.
     */
    public static class Accumulator {
        private final Map<Integer, PaymentTotals> totals = new HashMap<>();
        private long validTrips = 0;

        public void accumulate(TaxiTrip trip) {
            PaymentTotals entry = totals.computeIfAbsent(trip.paymentType(), k -> new PaymentTotals());
            entry.tripCount++;
            entry.totalAmount += trip.totalAmount();
            validTrips++;
        }

        /**
         * Adds another accumulator's totals into this one. The other accumulator is not modified.
         */
        public Accumulator combine(Accumulator other) {
            other.totals.forEach((paymentType, value) -> {
                PaymentTotals entry = totals.computeIfAbsent(paymentType, k -> new PaymentTotals());
                entry.tripCount += value.tripCount;
                entry.totalAmount += value.totalAmount;
            });
            validTrips += other.validTrips;
            return this;
        }

        public Map<Integer, PaymentTotals> getTotals() {
            return Collections.unmodifiableMap(totals);
        }

        public long getValidTrips() {
            return validTrips;
        }

        public boolean isEmpty() {
            return totals.isEmpty();
        }
    }

    private final Accumulator paymentStats = new Accumulator();
    private boolean finished = false;

    public static boolean accepts(TaxiTrip trip) {
        return trip.paymentType() > 0 && trip.totalAmount() > 0.0;
    }

    @Override
    public Accumulator processBatch(List<TaxiTrip> batch) {
        return BatchAggregator.foldInParallel(
                batch,
                PaymentAggregator::accepts,
                Accumulator::new,
                Accumulator::accumulate,
                Accumulator::combine
        );
    }

    @Override
    public void mergeAccumulators(List<Accumulator> accumulators) {
        checkNotFinished();
        for (Accumulator accumulator : accumulators) {
            paymentStats.combine(accumulator);
        }
    }

    /**
     * Returns one row per payment type, ordered by payment type.
     * Returns an empty list if no valid trip was seen.
     */
    @Override
    public List<PaymentStats> finish() {
        checkNotFinished();
        finished = true;

        long totalValid = paymentStats.validTrips;
        if (totalValid == 0) {
            return List.of();
        }

        return paymentStats.totals.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> {
                    PaymentTotals totals = entry.getValue();
                    return new PaymentStats(
                            entry.getKey(),
                            totals.tripCount,
                            roundTo2Decimals(totals.totalAmount),
                            roundTo2Decimals(totals.totalAmount / totals.tripCount),
                            roundTo2Decimals(100.0 * totals.tripCount / totalValid)
                    );
                })
                .toList();
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("PaymentAggregator has already been finished");
        }
    }
}
