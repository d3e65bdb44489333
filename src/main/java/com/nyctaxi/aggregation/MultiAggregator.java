package com.nyctaxi.aggregation;

import com.nyctaxi.model.MultiAnalysisResults;
import com.nyctaxi.model.TaxiTrip;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the peak zone, hourly pattern and payment aggregations over the same batches.
 *
 * <p>Each batch is read from the source once and handed to all three aggregators,
 * which scan it independently. Their accumulators travel together in a
 * {@link Accumulator} and are split apart again when merging.
 *
 * <p>Example usage:
 * <pre>{@code
 * MultiAggregator aggregator = new MultiAggregator();
 * aggregator.mergeAccumulators(List.of(aggregator.processBatch(trips)));
 * MultiAnalysisResults results = aggregator.finish();
 * }</pre>
 */
public class MultiAggregator implements BatchAggregator<MultiAggregator.Accumulator, MultiAnalysisResults> {

    /**
     * The three per-batch accumulators of one batch.
     */
    public record Accumulator(
            PeakZoneAggregator.Accumulator peakZones,
            HourlyPatternAggregator.Accumulator hourlyPatterns,
            PaymentAggregator.Accumulator paymentAnalysis
    ) {
    }

    private final PeakZoneAggregator peakZoneAggregator = new PeakZoneAggregator();
    private final HourlyPatternAggregator hourlyPatternAggregator = new HourlyPatternAggregator();
    private final PaymentAggregator paymentAggregator = new PaymentAggregator();

    @Override
    public Accumulator processBatch(List<TaxiTrip> batch) {
        return new Accumulator(
                peakZoneAggregator.processBatch(batch),
                hourlyPatternAggregator.processBatch(batch),
                paymentAggregator.processBatch(batch)
        );
    }

    @Override
    public void mergeAccumulators(List<Accumulator> accumulators) {
        List<PeakZoneAggregator.Accumulator> peakZones = new ArrayList<>(accumulators.size());
        List<HourlyPatternAggregator.Accumulator> hourlyPatterns = new ArrayList<>(accumulators.size());
        List<PaymentAggregator.Accumulator> paymentAnalysis = new ArrayList<>(accumulators.size());

        for (Accumulator accumulator : accumulators) {
            peakZones.add(accumulator.peakZones());
            hourlyPatterns.add(accumulator.hourlyPatterns());
            paymentAnalysis.add(accumulator.paymentAnalysis());
        }

        peakZoneAggregator.mergeAccumulators(peakZones);
        hourlyPatternAggregator.mergeAccumulators(hourlyPatterns);
        paymentAggregator.mergeAccumulators(paymentAnalysis);
    }

    @Override
    public MultiAnalysisResults finish() {
        return new MultiAnalysisResults(
                peakZoneAggregator.finish(),
                hourlyPatternAggregator.finish(),
                paymentAggregator.finish()
        );
    }
}
