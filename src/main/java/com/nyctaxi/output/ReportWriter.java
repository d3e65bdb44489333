package com.nyctaxi.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.model.MultiAnalysisResults;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the three reports of a run as pretty-printed JSON files.
 *
 * <p>File names carry the worker thread count, e.g. {@code peak_zones_8_cpus.json}
 * for a single input file or {@code peak_zones_all_8_cpus.json} for a directory run.
 *
 * <p>All three reports are serialized before the first file is written, so a
 * serialization failure leaves no output behind.
 */
public class ReportWriter {

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes the reports of a run.
     *
     * @param results the reports
     * @param outputDir target directory, created if missing
     * @param directoryRun {@code true} to use the {@code _all_} file names of a directory run
     * @param threadCount worker thread count, part of the file names
     * @return the written files in order peak zones, hourly patterns, payment analysis
     * @throws ProcessingException {@code ENCODING} if serialization or writing fails
     */
    public List<Path> write(MultiAnalysisResults results, Path outputDir, boolean directoryRun, int threadCount)
            throws ProcessingException {
        String suffix = (directoryRun ? "_all_" : "_") + threadCount + "_cpus.json";

        Map<Path, byte[]> files = new LinkedHashMap<>();
        files.put(outputDir.resolve("peak_zones" + suffix), toJson(results.peakZones()));
        files.put(outputDir.resolve("hourly_patterns" + suffix), toJson(results.hourlyPatterns()));
        files.put(outputDir.resolve("payment_analysis" + suffix), toJson(results.paymentAnalysis()));

        try {
            Files.createDirectories(outputDir);
            for (Map.Entry<Path, byte[]> file : files.entrySet()) {
                Files.write(file.getKey(), file.getValue());
            }
        } catch (IOException e) {
            throw ProcessingException.encoding("Cannot write results to " + outputDir + ": " + e.getMessage(), e);
        }

        return List.copyOf(files.keySet());
    }

    /**
     * Serializes one report collection.
     *
     * @param report the report rows
     * @return UTF-8 JSON
     * @throws ProcessingException {@code ENCODING} if serialization fails
     */
    public byte[] toJson(List<?> report) throws ProcessingException {
        try {
            return objectMapper.writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw ProcessingException.encoding("Cannot serialize report: " + e.getOriginalMessage(), e);
        }
    }
}
