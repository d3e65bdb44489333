package com.nyctaxi.error;

import java.util.Objects;

/**
 * Failure of a processing run.
 *
 * <p>Every error the processor can surface is one of the {@link Kind}s below.
 * There is no local recovery: the first exception aborts the run and no
 * report files are written.
 */
public class ProcessingException extends Exception {

    /**
     * Error taxonomy of a run.
     */
    public enum Kind {
        /** A file or directory could not be read. */
        INPUT("IO error"),
        /** A row could not be decoded into a trip record. */
        DECODE("CSV parsing error"),
        /** A record failed a domain rule. Only used as a rejection reason. */
        VALIDATION("Data validation error"),
        /** General processing failure, e.g. an input directory without CSV files. */
        PROCESSING("Processing error"),
        /** The reports could not be serialized or written. */
        ENCODING("JSON error");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;

    public ProcessingException(Kind kind, String message) {
        super(kind.label() + ": " + message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ProcessingException(Kind kind, String message, Throwable cause) {
        super(kind.label() + ": " + message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ProcessingException input(String message, Throwable cause) {
        return new ProcessingException(Kind.INPUT, message, cause);
    }

    public static ProcessingException decode(String message, Throwable cause) {
        return new ProcessingException(Kind.DECODE, message, cause);
    }

    public static ProcessingException validation(String message) {
        return new ProcessingException(Kind.VALIDATION, message);
    }

    public static ProcessingException processing(String message) {
        return new ProcessingException(Kind.PROCESSING, message);
    }

    public static ProcessingException encoding(String message, Throwable cause) {
        return new ProcessingException(Kind.ENCODING, message, cause);
    }

    /**
     * Returns the category of this failure.
     *
     * @return the error kind
     */
    public Kind getKind() {
        return kind;
    }
}
