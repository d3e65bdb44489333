package com.nyctaxi.cli;

import com.nyctaxi.cli.CommandLineOptions.Command;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineOptionsTest {

    // =========================================================================
    // COMMANDS
    // =========================================================================

    @Test
    @DisplayName("Should parse process with defaults")
    void shouldParseProcess() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"process", "--input=data/jan.csv"});

        assertThat(options.command()).isEqualTo(Command.PROCESS);
        assertThat(options.input()).isEqualTo(Path.of("data/jan.csv"));
        assertThat(options.outputDir()).isNull();
        assertThat(options.threads()).isEmpty();
        assertThat(options.batchSize()).isEqualTo(CommandLineOptions.DEFAULT_BATCH_SIZE);
    }

    @Test
    @DisplayName("Should parse batch-process with global options before the command")
    void shouldParseBatchProcess() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{
                "--threads=4", "--batch-size=500", "batch-process", "--directory=data", "--output-dir=out"});

        assertThat(options.command()).isEqualTo(Command.BATCH_PROCESS);
        assertThat(options.threads()).contains(4);
        assertThat(options.batchSize()).isEqualTo(500);
        assertThat(options.directory()).isEqualTo(Path.of("data"));
        assertThat(options.outputDir()).isEqualTo(Path.of("out"));
    }

    @Test
    @DisplayName("Should accept -j as short form of --threads")
    void shouldAcceptShortThreads() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"-j=2", "process", "--input=a.csv"});

        assertThat(options.threads()).contains(2);
    }

    // =========================================================================
    // ERRORS
    // =========================================================================

    @Test
    @DisplayName("Should require a command")
    void shouldRequireCommand() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--threads=2"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("command");
    }

    @Test
    @DisplayName("Should reject unknown commands")
    void shouldRejectUnknownCommand() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"transform"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown command: transform");
    }

    @Test
    @DisplayName("Should require the input of process")
    void shouldRequireInput() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"process"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--input");
    }

    @Test
    @DisplayName("Should require directory and output directory of batch-process")
    void shouldRequireDirectoryOptions() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"batch-process", "--directory=data"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--output-dir");
    }

    @Test
    @DisplayName("Should reject malformed and non-positive numbers")
    void shouldRejectBadNumbers() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--threads=many", "process", "--input=a.csv"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid value for threads");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--batch-size=0", "process", "--input=a.csv"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--threads=-1", "process", "--input=a.csv"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    // THREADS
    // =========================================================================

    @Test
    @DisplayName("Should clamp requested threads to available processors")
    void shouldClampThreads() {
        int available = Runtime.getRuntime().availableProcessors();

        CommandLineOptions tooMany = CommandLineOptions.parse(new String[]{
                "--threads=" + (available + 10), "process", "--input=a.csv"});
        CommandLineOptions one = CommandLineOptions.parse(new String[]{"--threads=1", "process", "--input=a.csv"});
        CommandLineOptions none = CommandLineOptions.parse(new String[]{"process", "--input=a.csv"});

        assertThat(TaxiProcessorMain.resolveThreads(tooMany)).isEqualTo(available);
        assertThat(TaxiProcessorMain.resolveThreads(one)).isEqualTo(1);
        assertThat(TaxiProcessorMain.resolveThreads(none)).isEqualTo(available);
    }
}
