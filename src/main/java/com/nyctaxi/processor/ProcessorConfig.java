package com.nyctaxi.processor;

/**
 * Run-wide settings of a {@link TaxiProcessor}.
 *
 * @param chunkSize number of valid trips per batch
 * @param threads size of the worker pool used for both batch folding and file fan-out
 */
public record ProcessorConfig(
        int chunkSize,
        int threads
) {
    public static final int DEFAULT_CHUNK_SIZE = 50_000;

    public ProcessorConfig {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
    }

    /**
     * Default settings: {@value #DEFAULT_CHUNK_SIZE} trips per batch, one thread per available processor.
     */
    public static ProcessorConfig defaults() {
        return new ProcessorConfig(DEFAULT_CHUNK_SIZE, availableProcessors());
    }

    public ProcessorConfig withChunkSize(int chunkSize) {
        return new ProcessorConfig(chunkSize, threads);
    }

    public ProcessorConfig withThreads(int threads) {
        return new ProcessorConfig(chunkSize, threads);
    }

    public static int availableProcessors() {
        return Runtime.getRuntime().availableProcessors();
    }
}
