package com.nyctaxi.batch;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nyctaxi.model.TaxiTrip;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Jackson CSV parser for memory-efficient reading of trip files.
 *
 * <p>Rows are decoded one at a time as the returned stream is consumed, so
 * only the current row is held in memory. Columns are bound by the header
 * row; columns the model does not know are ignored.
 *
 * <p>A row that cannot be decoded surfaces as an {@link UncheckedIOException}
 * from the stream and ends it. There is no skip-and-continue mode.
 *
 * <p>Example CSV:
 * <pre>
 * VendorID,tpep_pickup_datetime,tpep_dropoff_datetime,passenger_count,trip_distance,...
 * 1,2015-01-01 12:00:00,2015-01-01 12:30:00,1,5.0,...
 * </pre>
 */
public class CsvTripParser {

    private final ObjectReader tripReader;

    public CsvTripParser() {
        this(createMapper());
    }

    /**
     * Creates a parser with a custom CsvMapper.
     * The mapper needs the {@link JavaTimeModule} to decode timestamps.
     */
    public CsvTripParser(CsvMapper csvMapper) {
        this.tripReader = csvMapper
                .readerFor(TaxiTrip.class)
                .with(CsvSchema.emptySchema().withHeader());
    }

    /**
     * Creates the default mapper: header-bound columns, trimmed values, empty
     * cells read as missing, and empty cells in numeric columns rejected.
     */
    public static CsvMapper createMapper() {
        return CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .addModule(new JavaTimeModule())
                .build();
    }

    /**
     * Parses trips from an input stream, returning a lazy stream.
     *
     * <p>The caller owns the input stream and should close it after the
     * returned stream has been consumed. Closing the returned stream releases
     * the underlying CSV parser.
     *
     * @param inputStream the CSV input, starting with a header row
     * @return a lazy stream of trips in file order
     * @throws IOException if the header row cannot be read
     */
    public Stream<TaxiTrip> parseTrips(InputStream inputStream) throws IOException {
        MappingIterator<TaxiTrip> rows = tripReader.readValues(inputStream);
        Spliterator<TaxiTrip> spliterator = new CsvRowSpliterator(rows);
        return StreamSupport.stream(spliterator, false)
                .onClose(() -> closeRows(rows));
    }

    private static void closeRows(MappingIterator<TaxiTrip> rows) {
        try {
            rows.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close CSV parser", e);
        }
    }

    /**
     * Spliterator that decodes one CSV row per advance.
     */
    private static class CsvRowSpliterator extends Spliterators.AbstractSpliterator<TaxiTrip> {

        private final MappingIterator<TaxiTrip> rows;
        private boolean finished = false;

        CsvRowSpliterator(MappingIterator<TaxiTrip> rows) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rows = rows;
        }

        @Override
        public boolean tryAdvance(Consumer<? super TaxiTrip> action) {
            if (finished) {
                return false;
            }

            try {
                if (!rows.hasNextValue()) {
                    finished = true;
                    return false;
                }
                action.accept(rows.nextValue());
                return true;
            } catch (IOException e) {
                finished = true;
                long line = rows.getCurrentLocation().getLineNr();
                throw new UncheckedIOException("Failed to decode trip record near line " + line, e);
            }
        }
    }
}
