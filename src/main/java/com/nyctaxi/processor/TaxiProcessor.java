package com.nyctaxi.processor;

import com.nyctaxi.aggregation.BatchAggregator;
import com.nyctaxi.aggregation.MultiAggregator;
import com.nyctaxi.batch.BatchSource;
import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.model.MultiAnalysisResults;
import com.nyctaxi.output.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Runs batch aggregations over one CSV file or a directory of CSV files.
 *
 * <p>The processor streams each file through a {@link BatchSource}, folds every
 * batch into an accumulator, and merges all accumulators into one consolidated
 * aggregator at the end. Only the accumulators, whose size is bounded by the
 * key space, are kept for the whole run.
 *
 * <p>All work runs on a single {@link ForkJoinPool}:
 * <ul>
 *   <li>Within a batch, the aggregators fold trips with parallel streams, which
 *       fork into the pool of the calling worker.</li>
 *   <li>In directory mode, files are fanned out over the pool with Reactor. Each
 *       file's batches are processed sequentially by the worker that owns it.</li>
 * </ul>
 * The final merge happens on the calling thread after all workers have finished.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (TaxiProcessor processor = new TaxiProcessor(ProcessorConfig.defaults())) {
 *     MultiAnalysisResults results = processor.analyzeDirectory(Path.of("data"));
 * }
 * }</pre>
 */
public class TaxiProcessor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaxiProcessor.class);

    private static final String CSV_EXTENSION = ".csv";

    private final ProcessorConfig config;
    private final BatchSource batchSource;
    private final ForkJoinPool pool;
    private final boolean ownsPool;
    private final Scheduler scheduler;
    private final ReportWriter reportWriter;

    /**
     * Creates a processor with {@link ProcessorConfig#defaults()}.
     */
    public TaxiProcessor() {
        this(ProcessorConfig.defaults());
    }

    /**
     * Creates a processor with its own worker pool of {@code config.threads()} threads.
     * The pool is shut down by {@link #close()}.
     *
     * @param config chunk size and thread count
     */
    public TaxiProcessor(ProcessorConfig config) {
        this(config, new ForkJoinPool(config.threads()), true);
    }

    /**
     * Creates a processor running on an existing pool. The caller keeps ownership of the pool.
     *
     * @param config chunk size; the thread count is taken from the pool
     * @param pool the worker pool
     */
    public TaxiProcessor(ProcessorConfig config, ForkJoinPool pool) {
        this(config, pool, false);
    }

    private TaxiProcessor(ProcessorConfig config, ForkJoinPool pool, boolean ownsPool) {
        this.config = config;
        this.batchSource = new BatchSource(config.chunkSize());
        this.pool = pool;
        this.ownsPool = ownsPool;
        this.scheduler = Schedulers.fromExecutor(pool);
        this.reportWriter = new ReportWriter();
    }

    /**
     * Runs all three aggregations over a single file.
     *
     * @param input the CSV file
     * @return the three reports
     * @throws ProcessingException if the file cannot be read or decoded
     */
    public MultiAnalysisResults analyzeFile(Path input) throws ProcessingException {
        return runStreamingTransformation(input, MultiAggregator::new);
    }

    /**
     * Runs all three aggregations over every CSV file of a directory.
     *
     * @param directory directory containing {@code .csv} files
     * @return the three reports
     * @throws ProcessingException {@code PROCESSING} if the directory has no CSV files,
     *         or any error of reading and decoding the files
     */
    public MultiAnalysisResults analyzeDirectory(Path directory) throws ProcessingException {
        List<Path> csvFiles = findCsvFiles(directory);
        if (csvFiles.isEmpty()) {
            throw ProcessingException.processing("No CSV files found in directory: " + directory);
        }
        return runDirectoryStreamingTransformation(csvFiles, MultiAggregator::new);
    }

    /**
     * Processes one file and writes the reports to {@code outputDir}.
     *
     * @param input the CSV file
     * @param outputDir target directory, the working directory if {@code null}
     * @return the three reports
     * @throws ProcessingException if processing or writing fails
     */
    public MultiAnalysisResults runAllTransformations(Path input, Path outputDir) throws ProcessingException {
        long start = System.nanoTime();
        Path target = outputDir != null ? outputDir : Path.of(".");

        log.info("Processing {} using streaming batches of {} records", input, config.chunkSize());
        log.info("Running all transformations: peak_zones, payment_analysis, hourly_patterns");

        MultiAnalysisResults results = analyzeFile(input);
        log.info("Streaming processing completed in: {} seconds", elapsedSeconds(start));

        logSaved(reportWriter.write(results, target, false, getThreadCount()));
        return results;
    }

    /**
     * Processes every CSV file of a directory and writes the reports to {@code outputDir}.
     *
     * @param directory directory containing {@code .csv} files
     * @param outputDir target directory, created if missing; the working directory if {@code null}
     * @return the three reports
     * @throws ProcessingException if processing or writing fails
     */
    public MultiAnalysisResults runDirectoryAllTransformations(Path directory, Path outputDir)
            throws ProcessingException {
        long start = System.nanoTime();
        Path target = outputDir != null ? outputDir : Path.of(".");

        List<Path> csvFiles = findCsvFiles(directory);
        if (csvFiles.isEmpty()) {
            throw ProcessingException.processing("No CSV files found in directory: " + directory);
        }

        log.info("Found {} CSV files to process:", csvFiles.size());
        csvFiles.forEach(file -> log.info("  - {}", file));
        log.info("Processing {} files in parallel using streaming batches of {} records each",
                csvFiles.size(), config.chunkSize());

        MultiAnalysisResults results = runDirectoryStreamingTransformation(csvFiles, MultiAggregator::new);
        log.info("Directory parallel streaming processing completed in: {} seconds", elapsedSeconds(start));

        logSaved(reportWriter.write(results, target, true, getThreadCount()));
        return results;
    }

    /**
     * Runs one aggregation over a single file: batches are folded one after the
     * other, then merged into a fresh aggregator and finished.
     *
     * @param input the CSV file
     * @param aggregatorFactory creates empty aggregators
     * @param <A> accumulator type
     * @param <R> report type
     * @return the report
     * @throws ProcessingException if the file cannot be read or decoded
     */
    public <A, R> R runStreamingTransformation(
            Path input,
            Supplier<? extends BatchAggregator<A, R>> aggregatorFactory) throws ProcessingException {
        List<A> accumulators = onPool(() -> collectAccumulators(input, aggregatorFactory.get()));
        return mergeAndFinish(accumulators, aggregatorFactory);
    }

    /**
     * Runs one aggregation over several files. Files are processed in parallel,
     * each file's batches sequentially. The per-file accumulators are
     * concatenated in file order and merged once.
     *
     * @param files the CSV files
     * @param aggregatorFactory creates empty aggregators
     * @param <A> accumulator type
     * @param <R> report type
     * @return the report
     * @throws ProcessingException the first read or decode error of any file
     */
    public <A, R> R runDirectoryStreamingTransformation(
            List<Path> files,
            Supplier<? extends BatchAggregator<A, R>> aggregatorFactory) throws ProcessingException {
        List<List<A>> fileAccumulators = block(Flux.fromIterable(files)
                .flatMapSequential(file -> Mono
                                .fromCallable(() -> collectAccumulators(file, aggregatorFactory.get()))
                                .subscribeOn(scheduler),
                        getThreadCount())
                .collectList());

        List<A> accumulators = new ArrayList<>();
        fileAccumulators.forEach(accumulators::addAll);
        return mergeAndFinish(accumulators, aggregatorFactory);
    }

    /**
     * Lists the regular {@code .csv} files of a directory, sorted by path.
     *
     * @param directory the directory to scan (not recursive)
     * @return sorted CSV files, possibly empty
     * @throws ProcessingException {@code INPUT} if the directory cannot be listed
     */
    public List<Path> findCsvFiles(Path directory) throws ProcessingException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(CSV_EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw ProcessingException.input("Cannot list directory " + directory + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the number of worker threads, which also appears in the output file names.
     */
    public int getThreadCount() {
        return pool.getParallelism();
    }

    public ProcessorConfig getConfig() {
        return config;
    }

    /**
     * Shuts down the worker pool if this processor created it.
     */
    @Override
    public void close() {
        if (ownsPool) {
            pool.shutdown();
        }
    }

    private <A> List<A> collectAccumulators(Path file, BatchAggregator<A, ?> folder) throws ProcessingException {
        log.info("Processing file: {}", file);
        List<A> accumulators = new ArrayList<>();
        batchSource.processFile(file, batch -> accumulators.add(folder.processBatch(batch)));
        log.debug("Collected {} batch accumulators from {}", accumulators.size(), file);
        return accumulators;
    }

    private static <A, R> R mergeAndFinish(
            List<A> accumulators,
            Supplier<? extends BatchAggregator<A, R>> aggregatorFactory) {
        BatchAggregator<A, R> consolidated = aggregatorFactory.get();
        consolidated.mergeAccumulators(accumulators);
        return consolidated.finish();
    }

    private <T> T onPool(Callable<T> task) throws ProcessingException {
        return block(Mono.fromCallable(task).subscribeOn(scheduler));
    }

    private static <T> T block(Mono<T> result) throws ProcessingException {
        try {
            return result.block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof ProcessingException processingException) {
                throw processingException;
            }
            throw e;
        }
    }

    private static String elapsedSeconds(long startNanos) {
        return String.format("%.2f", (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }

    private static void logSaved(List<Path> files) {
        log.info("Results saved to:");
        files.forEach(file -> log.info("  - {}", file));
    }
}
