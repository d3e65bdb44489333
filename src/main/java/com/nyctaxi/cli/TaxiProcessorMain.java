package com.nyctaxi.cli;

import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.processor.ProcessorConfig;
import com.nyctaxi.processor.TaxiProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Runs all three transformations over a file or a directory.
 *
 * <p>Usage:
 * <pre>
 * java -jar nyc-taxi-processor.jar --threads=4 --batch-size=10000 process \
 *     --input=data/yellow_tripdata_2015-01.csv --output-dir=out
 *
 * java -jar nyc-taxi-processor.jar batch-process --directory=data --output-dir=out
 * </pre>
 *
 * <p>The thread count is clamped to the number of available processors.
 * On failure the error is logged, no report is written and the exit status is 1.
 */
public class TaxiProcessorMain {

    private static final Logger log = LoggerFactory.getLogger(TaxiProcessorMain.class);

    public static void main(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(CommandLineOptions.USAGE);
            System.exit(1);
            return;
        }

        try {
            run(options);
        } catch (ProcessingException e) {
            log.error("{}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static void run(CommandLineOptions options) throws ProcessingException {
        ProcessorConfig config = new ProcessorConfig(options.batchSize(), resolveThreads(options));

        try (TaxiProcessor processor = new TaxiProcessor(config)) {
            switch (options.command()) {
                case PROCESS -> {
                    log.info("Processing {} with batch size of {} records", options.input(), options.batchSize());
                    processor.runAllTransformations(options.input(), options.outputDir());
                }
                case BATCH_PROCESS -> {
                    log.info("Processing all CSV files in {} with batch size of {} records",
                            options.directory(), options.batchSize());
                    processor.runDirectoryAllTransformations(options.directory(), options.outputDir());
                }
            }
        }
    }

    /**
     * Returns the requested thread count clamped to the available processors,
     * or all available processors if none was requested.
     */
    static int resolveThreads(CommandLineOptions options) {
        int maxThreads = ProcessorConfig.availableProcessors();
        if (options.threads().isPresent()) {
            int threads = Math.min(options.threads().get(), maxThreads);
            log.info("Using {} threads for parallel processing (max available: {})", threads, maxThreads);
            return threads;
        }
        log.info("Using {} threads for parallel processing (default, max available: {})", maxThreads, maxThreads);
        return maxThreads;
    }
}
