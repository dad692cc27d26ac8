package com.semanticdiff.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MergeCommand}.
 */
class MergeCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;
    private Path base;
    private Path ours;
    private Path theirs;

    @BeforeEach
    void setUp() throws IOException {
        commandLine = new CommandLine(new MergeCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        base = ModelFiles.write(tempDir, "base.json", ModelFiles.customerModel("Shop", "A customer", "Integer"));
        ours = ModelFiles.write(tempDir, "ours.json", ModelFiles.customerModel("Shop", "A buyer", "Integer"));
        theirs = ModelFiles.write(tempDir, "theirs.json", ModelFiles.customerModel("Shop", "A client", "Integer"));
    }

    @Test
    void call_withoutOut_printsMergedModelAndConflicts() throws IOException {
        int exitCode = commandLine.execute("-b", base.toString(), "-o", ours.toString(), "-t", theirs.toString());

        assertThat(exitCode).isZero();
        JsonNode merged = new ObjectMapper().readTree(out.toString());
        assertThat(merged.path("version").asText()).isEqualTo("1.1");
        assertThat(merged.path("entities").get(0).path("description").asText()).isEqualTo("A buyer");
        assertThat(merged.path("metadata").path("merged_from").asText()).isEqualTo("[Shop, Shop]");
        assertThat(err.toString()).contains("! Conflict at Customer.description (resolved: ours)");
    }

    @Test
    void call_theirsStrategyWithOut_writesMergedModelAndSummary() throws IOException {
        Path merged = tempDir.resolve("merged/shop.json");

        int exitCode = commandLine.execute("-b", base.toString(), "-o", ours.toString(), "-t", theirs.toString(),
            "--strategy", "theirs", "--out", merged.toString());

        assertThat(exitCode).isZero();
        JsonNode model = new ObjectMapper().readTree(merged.toFile());
        assertThat(model.path("entities").get(0).path("description").asText()).isEqualTo("A client");
        assertThat(out.toString())
            .contains("# Merge Summary: Shop v1.1")
            .contains("**Strategy**: theirs")
            .contains("| `Customer.description` | entity | modified `A buyer` | modified `A client` | theirs |")
            .contains("✓ Merged model written to " + merged);
    }

    @Test
    void call_unknownStrategy_returnsError() {
        int exitCode = commandLine.execute("-b", base.toString(), "-o", ours.toString(), "-t", theirs.toString(),
            "--strategy", "newest");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Merge failed:");
    }

    @Test
    void call_missingRequiredOption_returnsUsageError() {
        int exitCode = commandLine.execute("-b", base.toString(), "-o", ours.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Missing required option");
    }
}
