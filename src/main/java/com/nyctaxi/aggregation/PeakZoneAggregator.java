package com.nyctaxi.aggregation;

import com.nyctaxi.geo.ZoneClassifier;
import com.nyctaxi.model.PeakZone;
import com.nyctaxi.model.TaxiTrip;
import com.nyctaxi.util.TripMetrics;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.nyctaxi.util.TripMetrics.roundTo2Decimals;

/**
 * Identifies the zones and hours of the day that generate the most revenue.
 *
 * <p>Trips are bucketed by (pickup zone, pickup hour). For every bucket the
 * aggregator keeps the trip count, revenue and fare sums, and coordinate sums
 * for the bucket's centroid. The report holds the {@value #TOP_ZONES} buckets
 * with the highest revenue.
 *
 * <p>Trips without pickup coordinates or with a non-positive total amount are
 * ignored.
 *
 * <p>Example usage:
 * <pre>{@code
 * PeakZoneAggregator aggregator = new PeakZoneAggregator();
 * aggregator.mergeAccumulators(List.of(aggregator.processBatch(trips)));
 * List<PeakZone> top = aggregator.finish();
 * }</pre>
 */
public class PeakZoneAggregator implements BatchAggregator<PeakZoneAggregator.Accumulator, List<PeakZone>> {

    /** Number of rows kept in the report. */
    public static final int TOP_ZONES = 50;

    /**
     * Report order: revenue descending, then zone name and hour ascending so that
     * buckets with equal revenue are truncated deterministically.
     */
    static final Comparator<PeakZone> REPORT_ORDER = Comparator
            .comparingDouble(PeakZone::totalRevenue).reversed()
            .thenComparing(PeakZone::zoneName)
            .thenComparingInt(PeakZone::hour);

    /**
     * Bucket key.
     *
     * @param zoneName zone of the pickup
     * @param hour hour of the pickup (0-23)
     */
    public record ZoneHour(String zoneName, int hour) {
    }

    /**
     * Running sums of one bucket.
     *
     * <p>The coordinate count is tracked separately from the trip count so the
     * centroid stays correct if trips without usable coordinates are ever counted.
     */
    public static class ZoneStats {
        private long tripCount;
        private double totalRevenue;
        private double totalFare;
        private double latSum;
        private double lngSum;
        private long coordCount;

        void add(TaxiTrip trip) {
            tripCount++;
            totalRevenue += trip.totalAmount();
            totalFare += trip.fareAmount();
            latSum += trip.pickupLatitude();
            lngSum += trip.pickupLongitude();
            coordCount++;
        }

        void add(ZoneStats other) {
            tripCount += other.tripCount;
            totalRevenue += other.totalRevenue;
            totalFare += other.totalFare;
            latSum += other.latSum;
            lngSum += other.lngSum;
            coordCount += other.coordCount;
        }

        PeakZone toPeakZone(ZoneHour key) {
            return new PeakZone(
                    key.zoneName(),
                    key.hour(),
                    tripCount,
                    roundTo2Decimals(totalRevenue),
                    roundTo2Decimals(totalFare / tripCount),
                    roundTo2Decimals(latSum / coordCount),
                    roundTo2Decimals(lngSum / coordCount)
            );
        }

        public long getTripCount() {
            return tripCount;
        }

        public double getTotalRevenue() {
            return totalRevenue;
        }

        public double getTotalFare() {
            return totalFare;
        }
    }

    /**
     * Mutable per-batch state: one {@link ZoneStats} per (zone, hour) bucket.
     * Holds at most (number of zones + 1) x 24 entries.
     */
    public static class Accumulator {
        private final Map<ZoneHour, ZoneStats> stats = new HashMap<>();

        /**
         * Adds a single trip to its bucket.
         *
         * @param trip a trip that passed {@link #accepts(TaxiTrip)}
         */
        public void accumulate(TaxiTrip trip) {
            ZoneHour key = new ZoneHour(
                    ZoneClassifier.classify(trip.pickupLatitude(), trip.pickupLongitude()),
                    TripMetrics.hourOfDay(trip)
            );
            stats.computeIfAbsent(key, k -> new ZoneStats()).add(trip);
        }

        /**
         * Adds another accumulator's sums into this one. The other accumulator is not modified.
         *
         * @param other the accumulator to add
         * @return this accumulator
         */
        public Accumulator combine(Accumulator other) {
            other.stats.forEach((key, value) -> stats.computeIfAbsent(key, k -> new ZoneStats()).add(value));
            return this;
        }

        public Map<ZoneHour, ZoneStats> getStats() {
            return Collections.unmodifiableMap(stats);
        }

        public boolean isEmpty() {
            return stats.isEmpty();
        }
    }

    private final Accumulator zoneStats = new Accumulator();
    private boolean finished = false;

    /**
     * Returns {@code true} if the trip has pickup coordinates and a positive total amount.
     */
    public static boolean accepts(TaxiTrip trip) {
        return trip.pickupLatitude() != 0.0
                && trip.pickupLongitude() != 0.0
                && trip.totalAmount() > 0.0;
    }

    @Override
    public Accumulator processBatch(List<TaxiTrip> batch) {
        return BatchAggregator.foldInParallel(
                batch,
                PeakZoneAggregator::accepts,
                Accumulator::new,
                Accumulator::accumulate,
                Accumulator::combine
        );
    }

    @Override
    public void mergeAccumulators(List<Accumulator> accumulators) {
        checkNotFinished();
        for (Accumulator accumulator : accumulators) {
            zoneStats.combine(accumulator);
        }
    }

    /**
     * Returns the top {@value #TOP_ZONES} buckets by total revenue.
     */
    @Override
    public List<PeakZone> finish() {
        checkNotFinished();
        finished = true;

        return zoneStats.stats.entrySet().stream()
                .map(entry -> entry.getValue().toPeakZone(entry.getKey()))
                .sorted(REPORT_ORDER)
                .limit(TOP_ZONES)
                .toList();
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("PeakZoneAggregator has already been finished");
        }
    }
}
