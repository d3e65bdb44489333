package com.nyctaxi.cli;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Parsed command line of {@link TaxiProcessorMain}.
 *
 * <p>Options use the {@code --name=value} form and may appear before or after
 * the command. {@code -j=N} is accepted for {@code --threads=N}.
 *
 * @param command {@code process} or {@code batch-process}
 * @param threads requested worker threads, empty for the default
 * @param batchSize trips per batch
 * @param input input file of {@code process}
 * @param directory input directory of {@code batch-process}
 * @param outputDir output directory, required by {@code batch-process}
 */
public record CommandLineOptions(
        Command command,
        Optional<Integer> threads,
        int batchSize,
        Path input,
        Path directory,
        Path outputDir
) {
    public static final int DEFAULT_BATCH_SIZE = 10_000;

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: nyc-taxi-processor [--threads=N] [--batch-size=N] <command> [options]",
            "Commands:",
            "  process --input=<file> [--output-dir=<dir>]          Process a single CSV file",
            "  batch-process --directory=<dir> --output-dir=<dir>   Process all CSV files in a directory");

    public enum Command {
        PROCESS("process"),
        BATCH_PROCESS("batch-process");

        private final String name;

        Command(String name) {
            this.name = name;
        }

        static Command fromName(String name) {
            for (Command command : values()) {
                if (command.name.equals(name)) {
                    return command;
                }
            }
            throw new IllegalArgumentException("Unknown command: " + name
                    + ". Valid values: process, batch-process");
        }
    }

    /**
     * Parses the arguments.
     *
     * @param args raw arguments
     * @return the options
     * @throws IllegalArgumentException if the command is missing or unknown, a
     *         required option is missing, or a number is malformed
     */
    public static CommandLineOptions parse(String[] args) {
        String commandName = null;
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                commandName = arg;
                break;
            }
        }
        if (commandName == null) {
            throw new IllegalArgumentException("A command is required");
        }
        Command command = Command.fromName(commandName);

        Optional<Integer> threads = parseIntArg(args, "threads")
                .or(() -> parseIntArg(args, "j", "-j="));
        int batchSize = parseIntArg(args, "batch-size").orElse(DEFAULT_BATCH_SIZE);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("--batch-size must be positive: " + batchSize);
        }
        if (threads.isPresent() && threads.get() <= 0) {
            throw new IllegalArgumentException("--threads must be positive: " + threads.get());
        }

        Path input = parseStringArg(args, "input").map(Path::of).orElse(null);
        Path directory = parseStringArg(args, "directory").map(Path::of).orElse(null);
        Path outputDir = parseStringArg(args, "output-dir").map(Path::of).orElse(null);

        if (command == Command.PROCESS && input == null) {
            throw new IllegalArgumentException("process requires --input=<file>");
        }
        if (command == Command.BATCH_PROCESS && (directory == null || outputDir == null)) {
            throw new IllegalArgumentException("batch-process requires --directory=<dir> and --output-dir=<dir>");
        }

        return new CommandLineOptions(command, threads, batchSize, input, directory, outputDir);
    }

    private static Optional<Integer> parseIntArg(String[] args, String name) {
        return parseIntArg(args, name, "--" + name + "=");
    }

    private static Optional<Integer> parseIntArg(String[] args, String name, String prefix) {
        return parseStringArg(args, prefix).map(value -> {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
            }
        });
    }

    private static Optional<String> parseStringArg(String[] args, String nameOrPrefix) {
        String prefix = nameOrPrefix.startsWith("-") ? nameOrPrefix : "--" + nameOrPrefix + "=";
        for (String arg : args) {
            if (arg.startsWith(prefix)) {
                return Optional.of(arg.substring(prefix.length()));
            }
        }
        return Optional.empty();
    }
}
