package com.nyctaxi.processor;

import com.nyctaxi.aggregation.PaymentAggregator;
import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.fixtures.TripCsv;
import com.nyctaxi.model.MultiAnalysisResults;
import com.nyctaxi.model.PaymentStats;
import com.nyctaxi.model.TaxiTrip;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import static com.nyctaxi.fixtures.TripBuilder.trip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Integration tests for TaxiProcessor - the full pipeline from CSV files to reports.
 *
 * <h2>What This Tests</h2>
 * <ul>
 *   <li>Reading a single file and a directory of files</li>
 *   <li>Results that do not depend on batch size, file split or thread count</li>
 *   <li>Report files written with the expected names</li>
 *   <li>Error kinds for missing input and empty directories</li>
 * </ul>
 *
 * <p>Amounts and coordinates are exact binary fractions so results can be
 * compared with {@code isEqualTo} across different merge orders.
 */
class TaxiProcessorTest {

    private static final double[][] PICKUPS = {
            {40.75, -74.0},
            {40.625, -73.9375},
            {40.875, -73.875},
            {40.6455078125, -73.78125}
    };

    @TempDir
    Path tempDir;

    private ForkJoinPool pool;

    @BeforeEach
    void setUp() {
        pool = new ForkJoinPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    // =========================================================================
    // SINGLE FILE
    // =========================================================================

    @Test
    @DisplayName("Should analyze a single file")
    void shouldAnalyzeSingleFile() throws IOException, ProcessingException {
        // Given
        Path file = TripCsv.write(tempDir.resolve("trips.csv"), List.of(
                trip().atHour(8, 20).paymentType(1).total(20.0).build(),
                trip().atHour(8, 40).paymentType(2).total(10.0).build(),
                trip().vendorId(7).build()
        ));

        // When
        MultiAnalysisResults results = newProcessor(100).analyzeFile(file);

        // Then
        assertThat(results.peakZones()).singleElement().satisfies(zone -> {
            assertThat(zone.zoneName()).isEqualTo("Manhattan");
            assertThat(zone.hour()).isEqualTo(8);
            assertThat(zone.tripCount()).isEqualTo(2);
            assertThat(zone.totalRevenue()).isEqualTo(30.0);
        });
        assertThat(results.hourlyPatterns()).singleElement().satisfies(hour -> {
            assertThat(hour.tripCount()).isEqualTo(2);
            assertThat(hour.avgDuration()).isEqualTo(30.0);
        });
        assertThat(results.paymentAnalysis())
                .extracting(PaymentStats::paymentType, PaymentStats::percentage)
                .containsExactly(
                        tuple(1, 50.0),
                        tuple(2, 50.0));
    }

    @Test
    @DisplayName("Should give the same result for any batch size")
    void shouldBeIndependentOfBatchSize() throws IOException, ProcessingException {
        Path file = TripCsv.write(tempDir.resolve("trips.csv"), sampleTrips(0, 1_500));

        MultiAnalysisResults oneBatch = newProcessor(10_000).analyzeFile(file);
        MultiAnalysisResults smallBatches = newProcessor(7).analyzeFile(file);
        MultiAnalysisResults singleTripBatches = newProcessor(1).analyzeFile(file);

        assertThat(smallBatches).isEqualTo(oneBatch);
        assertThat(singleTripBatches).isEqualTo(oneBatch);
    }

    @Test
    @DisplayName("Should give the same result for any thread count")
    void shouldBeIndependentOfThreadCount() throws IOException, ProcessingException {
        Path file = TripCsv.write(tempDir.resolve("trips.csv"), sampleTrips(0, 1_000));

        MultiAnalysisResults parallel = newProcessor(64).analyzeFile(file);

        ForkJoinPool singleThread = new ForkJoinPool(1);
        try {
            MultiAnalysisResults sequential =
                    new TaxiProcessor(new ProcessorConfig(64, 1), singleThread).analyzeFile(file);
            assertThat(sequential).isEqualTo(parallel);
        } finally {
            singleThread.shutdown();
        }
    }

    @Test
    @DisplayName("Should run a single aggregation")
    void shouldRunSingleAggregation() throws IOException, ProcessingException {
        Path file = TripCsv.write(tempDir.resolve("trips.csv"), List.of(
                trip().paymentType(1).build(),
                trip().paymentType(1).build(),
                trip().paymentType(3).build(),
                trip().paymentType(4).build()
        ));

        List<PaymentStats> report = newProcessor(2).runStreamingTransformation(file, PaymentAggregator::new);

        assertThat(report).extracting(PaymentStats::percentage).containsExactly(50.0, 25.0, 25.0);
    }

    @Test
    @DisplayName("Should report a missing input file as an input error")
    void shouldReportMissingFile() {
        Path missing = tempDir.resolve("missing.csv");

        assertThatThrownBy(() -> newProcessor(10).analyzeFile(missing))
                .isInstanceOf(ProcessingException.class)
                .satisfies(e -> assertThat(((ProcessingException) e).getKind())
                        .isEqualTo(ProcessingException.Kind.INPUT));
    }

    // =========================================================================
    // DIRECTORY
    // =========================================================================

    @Test
    @DisplayName("Should give the same result for one file and the same trips split across files")
    void shouldBeIndependentOfFileSplit() throws IOException, ProcessingException {
        // Given
        Path single = Files.createDirectory(tempDir.resolve("single"));
        TripCsv.write(single.resolve("all.csv"), sampleTrips(0, 1_200));

        Path split = Files.createDirectory(tempDir.resolve("split"));
        TripCsv.write(split.resolve("part-1.csv"), sampleTrips(0, 400));
        TripCsv.write(split.resolve("part-2.csv"), sampleTrips(400, 800));
        TripCsv.write(split.resolve("part-3.csv"), sampleTrips(800, 1_200));

        // When
        TaxiProcessor processor = newProcessor(50);
        MultiAnalysisResults fromSingle = processor.analyzeFile(single.resolve("all.csv"));
        MultiAnalysisResults fromDirectory = processor.analyzeDirectory(split);

        // Then
        assertThat(fromDirectory).isEqualTo(fromSingle);
    }

    @Test
    @DisplayName("Should only pick up .csv files, sorted by name")
    void shouldFindCsvFiles() throws IOException, ProcessingException {
        Files.writeString(tempDir.resolve("b.csv"), TripCsv.HEADER);
        Files.writeString(tempDir.resolve("a.csv"), TripCsv.HEADER);
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");
        Files.createDirectory(tempDir.resolve("nested.csv"));

        assertThat(newProcessor(10).findCsvFiles(tempDir))
                .extracting(path -> path.getFileName().toString())
                .containsExactly("a.csv", "b.csv");
    }

    @Test
    @DisplayName("Should fail on a directory without CSV files")
    void shouldFailOnEmptyDirectory() throws IOException {
        Files.writeString(tempDir.resolve("readme.txt"), "no data");

        assertThatThrownBy(() -> newProcessor(10).analyzeDirectory(tempDir))
                .isInstanceOf(ProcessingException.class)
                .hasMessageContaining("No CSV files found in directory")
                .satisfies(e -> assertThat(((ProcessingException) e).getKind())
                        .isEqualTo(ProcessingException.Kind.PROCESSING));
    }

    @Test
    @DisplayName("Should fail the whole run if any file is malformed")
    void shouldFailOnMalformedFile() throws IOException {
        TripCsv.write(tempDir.resolve("good.csv"), sampleTrips(0, 100));
        Files.writeString(tempDir.resolve("bad.csv"), TripCsv.HEADER + "\nnot,a,trip\n");

        assertThatThrownBy(() -> newProcessor(10).analyzeDirectory(tempDir))
                .isInstanceOf(ProcessingException.class)
                .satisfies(e -> assertThat(((ProcessingException) e).getKind())
                        .isEqualTo(ProcessingException.Kind.DECODE));
    }

    // =========================================================================
    // OUTPUT FILES
    // =========================================================================

    @Test
    @DisplayName("Should write the three reports of a single-file run")
    void shouldWriteSingleFileReports() throws IOException, ProcessingException {
        Path file = TripCsv.write(tempDir.resolve("trips.csv"), sampleTrips(0, 50));
        Path out = tempDir.resolve("out");

        newProcessor(10).runAllTransformations(file, out);

        assertThat(out.resolve("peak_zones_4_cpus.json")).exists();
        assertThat(out.resolve("hourly_patterns_4_cpus.json")).exists();
        assertThat(out.resolve("payment_analysis_4_cpus.json")).exists();
    }

    @Test
    @DisplayName("Should write the three reports of a directory run")
    void shouldWriteDirectoryReports() throws IOException, ProcessingException {
        Path data = Files.createDirectory(tempDir.resolve("data"));
        TripCsv.write(data.resolve("jan.csv"), sampleTrips(0, 50));
        TripCsv.write(data.resolve("feb.csv"), sampleTrips(50, 100));
        Path out = tempDir.resolve("reports").resolve("nested");

        newProcessor(10).runDirectoryAllTransformations(data, out);

        assertThat(out.resolve("peak_zones_all_4_cpus.json")).exists();
        assertThat(out.resolve("hourly_patterns_all_4_cpus.json")).exists();
        assertThat(out.resolve("payment_analysis_all_4_cpus.json")).exists();
    }

    @Test
    @DisplayName("Should not write reports when processing fails")
    void shouldNotWriteReportsOnFailure() throws IOException {
        Path data = Files.createDirectory(tempDir.resolve("data"));
        Files.writeString(data.resolve("bad.csv"), TripCsv.HEADER + "\n1,2,3\n");
        Path out = tempDir.resolve("out");

        assertThatThrownBy(() -> newProcessor(10).runDirectoryAllTransformations(data, out))
                .isInstanceOf(ProcessingException.class);
        assertThat(out).doesNotExist();
    }

    @Test
    @DisplayName("Should only shut down a pool it created")
    void shouldOnlyCloseOwnedPool() {
        new TaxiProcessor(new ProcessorConfig(10, 4), pool).close();
        assertThat(pool.isShutdown()).isFalse();

        TaxiProcessor owning = new TaxiProcessor(new ProcessorConfig(10, 2));
        assertThat(owning.getThreadCount()).isEqualTo(2);
        owning.close();
    }

    private TaxiProcessor newProcessor(int chunkSize) {
        return new TaxiProcessor(new ProcessorConfig(chunkSize, pool.getParallelism()), pool);
    }

    private static List<TaxiTrip> sampleTrips(int from, int to) {
        return IntStream.range(from, to)
                .mapToObj(i -> {
                    double[] pickup = PICKUPS[i % PICKUPS.length];
                    return trip()
                            .vendorId(1 + i % 2)
                            .atHour(i % 24, 3 + i % 45)
                            .pickupAt(pickup[0], pickup[1])
                            .paymentType(i % 4)
                            .distance((i % 11) * 0.25)
                            .fare(2.5 + (i % 20) * 0.5)
                            .total((i % 17 == 0) ? 0.0 : 3.5 + (i % 40) * 0.25)
                            .build();
                })
                .toList();
    }
}
