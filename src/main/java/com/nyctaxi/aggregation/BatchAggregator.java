package com.nyctaxi.aggregation;

import com.nyctaxi.model.TaxiTrip;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * Aggregates batches of trips into a report with memory bounded by the key space,
 * not by the number of trips.
 *
 * <p>This is the batch-oriented counterpart of {@link java.util.stream.Collector}.
 * Instead of folding one element at a time into a single accumulator, every batch
 * is folded into its own accumulator, and the accumulators of all batches are
 * merged at the end. Because merging is pointwise addition per key, the result
 * does not depend on how the input was split into batches or files.
 *
 * <p>The aggregation process consists of three phases:
 * <ol>
 *   <li><b>Batch processing:</b> fold one batch into a fresh accumulator via
 *       {@link #processBatch(List)}. This must not read or write aggregator state.</li>
 *   <li><b>Merging:</b> fold any number of accumulators into the aggregator's own
 *       consolidated state via {@link #mergeAccumulators(List)}.</li>
 *   <li><b>Finishing:</b> derive averages and ratios and emit the report via
 *       {@link #finish()}. The aggregator is spent afterwards.</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>{@code
 * PeakZoneAggregator folder = new PeakZoneAggregator();
 * List<PeakZoneAggregator.Accumulator> accumulators = new ArrayList<>();
 * for (List<TaxiTrip> batch : batches) {
 *     accumulators.add(folder.processBatch(batch));
 * }
 *
 * PeakZoneAggregator consolidated = new PeakZoneAggregator();
 * consolidated.mergeAccumulators(accumulators);
 * List<PeakZone> report = consolidated.finish();
 * }</pre>
 *
 * <p><b>Thread Safety:</b> {@link #processBatch(List)} may be called concurrently.
 * {@link #mergeAccumulators(List)} and {@link #finish()} must be called from a
 * single thread.
 *
 * @param <A> the per-batch accumulator type (intermediate state)
 * @param <R> the report type
 */
public interface BatchAggregator<A, R> {

    /**
     * Folds a single batch into a new accumulator.
     *
     * <p>Trips rejected by the aggregator's own filter are skipped. The fold
     * runs as a parallel stream, so it uses the {@link java.util.concurrent.ForkJoinPool}
     * of the calling thread.
     *
     * @param batch the trips of one batch
     * @return the accumulator holding this batch's sums
     */
    A processBatch(List<TaxiTrip> batch);

    /**
     * Adds the given accumulators into this aggregator's consolidated state.
     *
     * <p>Calling this several times is equivalent to calling it once with the
     * concatenated list, in any order.
     *
     * @param accumulators per-batch accumulators
     * @throws IllegalStateException if the aggregator has already been finished
     */
    void mergeAccumulators(List<A> accumulators);

    /**
     * Produces the report from the consolidated state.
     *
     * @return the report
     * @throws IllegalStateException if the aggregator has already been finished
     */
    R finish();

    /**
     * Folds a batch in parallel: each stream partition fills its own accumulator
     * and the partial accumulators are combined pairwise.
     *
     * <p>The combiner must be associative and commutative, which pointwise
     * addition per key is.
     *
     * @param batch the trips to fold
     * @param filter trips that enter the fold
     * @param supplier creates an empty accumulator
     * @param accumulator adds one trip to an accumulator
     * @param combiner merges the second accumulator into the first and returns it
     * @param <A> the accumulator type
     * @return the accumulator of the whole batch
     */
    static <A> A foldInParallel(
            List<TaxiTrip> batch,
            Predicate<TaxiTrip> filter,
            Supplier<A> supplier,
            BiConsumer<A, TaxiTrip> accumulator,
            BinaryOperator<A> combiner) {
        return batch.parallelStream()
                .filter(filter)
                .collect(Collector.of(supplier, accumulator, combiner, Collector.Characteristics.UNORDERED));
    }
}
