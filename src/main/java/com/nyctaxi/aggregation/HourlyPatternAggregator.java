package com.nyctaxi.aggregation;

import com.nyctaxi.model.HourlyPattern;
import com.nyctaxi.model.TaxiTrip;
import com.nyctaxi.util.TripMetrics;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.nyctaxi.util.TripMetrics.roundTo2Decimals;

/**
 * Computes average distance, fare and duration of trips per pickup hour.
 *
 * <p>Trips with a non-positive total amount or distance are ignored. Trips whose
 * dropoff is recorded before the pickup are kept and contribute a negative duration.
 */
public class HourlyPatternAggregator implements BatchAggregator<HourlyPatternAggregator.Accumulator, List<HourlyPattern>> {

    /**
     * Running sums of one hour of the day.
     */
    public static class HourStats {
        private long tripCount;
        private double totalDistance;
        private double totalFare;
        private double totalDurationMinutes;

        public long getTripCount() {
            return tripCount;
        }

        public double getTotalDistance() {
            return totalDistance;
        }

        public double getTotalFare() {
            return totalFare;
        }

        public double getTotalDurationMinutes() {
            return totalDurationMinutes;
        }
    }

    /**
     * Mutable per-batch state, at most 24 entries.
     */
    public static class Accumulator {
        private final Map<Integer, HourStats> stats = new HashMap<>();

        public void accumulate(TaxiTrip trip) {
            HourStats entry = stats.computeIfAbsent(TripMetrics.hourOfDay(trip), k -> new HourStats());
            entry.tripCount++;
            entry.totalDistance += trip.tripDistance();
            entry.totalFare += trip.fareAmount();
            entry.totalDurationMinutes += TripMetrics.durationMinutes(trip);
        }

        /**
         * Adds another accumulator's sums into this one. The other accumulator is not modified.
         */
        public Accumulator combine(Accumulator other) {
            other.stats.forEach((hour, value) -> {
                HourStats entry = stats.computeIfAbsent(hour, k -> new HourStats());
                entry.tripCount += value.tripCount;
                entry.totalDistance += value.totalDistance;
                entry.totalFare += value.totalFare;
                entry.totalDurationMinutes += value.totalDurationMinutes;
            });
            return this;
        }

        public Map<Integer, HourStats> getStats() {
            return Collections.unmodifiableMap(stats);
        }

        public boolean isEmpty() {
            return stats.isEmpty();
        }
    }

    private final Accumulator hourlyStats = new Accumulator();
    private boolean finished = false;

    public static boolean accepts(TaxiTrip trip) {
        return trip.totalAmount() > 0.0 && trip.tripDistance() > 0.0;
    }

    @Override
    public Accumulator processBatch(List<TaxiTrip> batch) {
        return BatchAggregator.foldInParallel(
                batch,
                HourlyPatternAggregator::accepts,
                Accumulator::new,
                Accumulator::accumulate,
                Accumulator::combine
        );
    }

    @Override
    public void mergeAccumulators(List<Accumulator> accumulators) {
        checkNotFinished();
        for (Accumulator accumulator : accumulators) {
            hourlyStats.combine(accumulator);
        }
    }

    /**
     * Returns one row per hour that saw at least one trip, ordered by hour.
     */
    @Override
    public List<HourlyPattern> finish() {
        checkNotFinished();
        finished = true;

        return hourlyStats.stats.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> {
                    HourStats stats = entry.getValue();
                    return new HourlyPattern(
                            entry.getKey(),
                            stats.tripCount,
                            roundTo2Decimals(stats.totalDistance / stats.tripCount),
                            roundTo2Decimals(stats.totalFare / stats.tripCount),
                            roundTo2Decimals(stats.totalDurationMinutes / stats.tripCount)
                    );
                })
                .toList();
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("HourlyPatternAggregator has already been finished");
        }
    }
}
