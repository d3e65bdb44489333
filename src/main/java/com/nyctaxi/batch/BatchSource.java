package com.nyctaxi.batch;

import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.model.TaxiTrip;
import com.nyctaxi.validation.TripValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Streams validated trips into fixed-size batches.
 *
 * <p>Only one batch is held in memory at a time: once the buffer reaches the
 * chunk size it is handed to the {@link BatchConsumer} and cleared. After the
 * input is exhausted, a partial batch is delivered once more.
 *
 * <p>Trips that fail validation are dropped without notice. A row that cannot
 * be decoded aborts the whole run.
 *
 * <p>Example usage:
 * <pre>{@code
 * BatchSource source = new BatchSource(50_000);
 * source.processFile(Path.of("yellow_tripdata_2015-01.csv"), batch -> {
 *     accumulators.add(aggregator.processBatch(batch));
 * });
 * }</pre>
 *
 * <p><b>Thread Safety:</b> instances are immutable and may be shared; every
 * call uses its own buffer.
 */
public class BatchSource {

    private static final Logger log = LoggerFactory.getLogger(BatchSource.class);

    private final int chunkSize;
    private final Predicate<TaxiTrip> validator;
    private final CsvTripParser parser;

    /**
     * Creates a batch source using the default {@link TripValidator} and CSV parser.
     *
     * @param chunkSize maximum number of trips per batch
     */
    public BatchSource(int chunkSize) {
        this(chunkSize, new TripValidator(), new CsvTripParser());
    }

    /**
     * Creates a batch source with a custom validator and parser.
     *
     * @param chunkSize maximum number of trips per batch
     * @param validator trips that enter a batch
     * @param parser decoder for CSV files
     */
    public BatchSource(int chunkSize, Predicate<TaxiTrip> validator, CsvTripParser parser) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.validator = validator;
        this.parser = parser;
    }

    /**
     * Reads a CSV file and delivers its valid trips in batches.
     *
     * @param file the CSV file
     * @param consumer called once per batch
     * @return number of trips delivered
     * @throws ProcessingException {@code INPUT} if the file cannot be read, {@code DECODE}
     *         if a row cannot be decoded, or whatever the consumer throws
     */
    public long processFile(Path file, BatchConsumer consumer) throws ProcessingException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            Stream<TaxiTrip> trips = openTrips(file, in);
            try (trips) {
                long delivered = processInBatches(trips.iterator(), consumer);
                log.debug("Read {} valid trips from {}", delivered, file);
                return delivered;
            }
        } catch (IOException e) {
            throw ProcessingException.input("Cannot read " + file + ": " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw ProcessingException.decode(file + ": " + e.getMessage(), e.getCause());
        }
    }

    /**
     * Groups the trips of an iterator into batches.
     *
     * @param trips the record feed; decode failures surface as {@link UncheckedIOException}
     * @param consumer called once per batch
     * @return number of trips delivered
     * @throws ProcessingException whatever the consumer throws
     */
    public long processInBatches(Iterator<TaxiTrip> trips, BatchConsumer consumer) throws ProcessingException {
        List<TaxiTrip> batch = new ArrayList<>(chunkSize);
        List<TaxiTrip> view = Collections.unmodifiableList(batch);
        long delivered = 0;

        while (trips.hasNext()) {
            TaxiTrip trip = trips.next();
            if (!validator.test(trip)) {
                continue;
            }

            batch.add(trip);
            if (batch.size() >= chunkSize) {
                consumer.accept(view);
                delivered += batch.size();
                batch.clear();
            }
        }

        if (!batch.isEmpty()) {
            consumer.accept(view);
            delivered += batch.size();
            batch.clear();
        }

        return delivered;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    private Stream<TaxiTrip> openTrips(Path file, InputStream in) throws ProcessingException {
        try {
            return parser.parseTrips(in);
        } catch (IOException e) {
            throw ProcessingException.decode(file + ": cannot read CSV header: " + e.getMessage(), e);
        }
    }
}
